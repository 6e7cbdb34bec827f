package org.esa.echogram.operator;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;

import static org.junit.Assert.*;

public class EchoviewBatchProcessorTest {

    private static final String EXPORT_NAME = "D20150621-T180000_to_D20150621-T180040";

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private File inputFolder;
    private File outputFolder;

    @Before
    public void setUp() throws Exception {
        inputFolder = temporaryFolder.newFolder("exports");
        outputFolder = new File(temporaryFolder.getRoot(), "echograms");
        copyResource("/echoview/" + EXPORT_NAME + ".csv", new File(inputFolder, EXPORT_NAME + ".csv"));
        new File(inputFolder, "Bottom").mkdir();
        copyResource("/echoview/Bottom/" + EXPORT_NAME + ".csv",
                     new File(new File(inputFolder, "Bottom"), EXPORT_NAME + ".csv"));
    }

    @Test
    public void testProcessFolder() throws Exception {
        Files.write(new File(inputFolder, "EK60_FileNameList.csv").toPath(),
                    "file\nA.raw\n".getBytes(StandardCharsets.UTF_8));

        final EchoviewBatchProcessor.Summary summary = createProcessor().process(inputFolder, outputFolder);

        assertEquals(1, summary.getProcessed());
        assertEquals(1, summary.getSkipped());
        assertEquals(0, summary.getFailed());

        final File echogram = new File(outputFolder, EXPORT_NAME + "_echogram.csv");
        final List<String> lines = Files.readAllLines(echogram.toPath(), StandardCharsets.UTF_8);
        assertEquals("# title: D20150621-T180000 to / D20150621-T180040", lines.get(0));
        // 6 comment lines, depth header, 2 * 5 time rows
        assertEquals(17, lines.size());
        assertEquals(1 + 12, lines.get(6).split(",").length);

        final List<String> pings = Files.readAllLines(new File(outputFolder, EXPORT_NAME + "_pings.csv").toPath(),
                                                      StandardCharsets.UTF_8);
        assertEquals(6, pings.size());
        assertTrue(pings.get(1), pings.get(1).endsWith(",1,NaN,27.4000"));

        final List<String> bottom = Files.readAllLines(new File(outputFolder, EXPORT_NAME + "_bottom.csv").toPath(),
                                                       StandardCharsets.UTF_8);
        assertEquals("time,latitude,longitude,depth", bottom.get(0));
        assertEquals(5, bottom.size());
        assertTrue(bottom.get(4), bottom.get(4).endsWith(",27.9500"));
    }

    @Test
    public void testMissingBottomFileFailsOnlyThatFile() throws Exception {
        final File second = new File(inputFolder, "Z_second.csv");
        Files.copy(new File(inputFolder, EXPORT_NAME + ".csv").toPath(), second.toPath());

        final EchoviewBatchProcessor.Summary summary = createProcessor().process(inputFolder, outputFolder);

        assertEquals(1, summary.getProcessed());
        assertEquals(1, summary.getFailed());
        assertFalse(new File(outputFolder, "Z_second_echogram.csv").exists());
    }

    @Test
    public void testMissingBottomFileIsAcceptedWhenNotRequired() throws Exception {
        final File second = new File(inputFolder, "Z_second.csv");
        Files.copy(new File(inputFolder, EXPORT_NAME + ".csv").toPath(), second.toPath());
        final EchoviewBatchProcessor processor = createProcessor();
        processor.setRequireBottom(false);

        final EchoviewBatchProcessor.Summary summary = processor.process(inputFolder, outputFolder);

        assertEquals(2, summary.getProcessed());
        assertTrue(new File(outputFolder, "Z_second_echogram.csv").exists());
    }

    @Test
    public void testFileStartSkipsLeadingFiles() throws Exception {
        Files.copy(new File(inputFolder, EXPORT_NAME + ".csv").toPath(), new File(inputFolder, "Z_second.csv").toPath());
        final EchoviewBatchProcessor processor = createProcessor();
        processor.setRequireBottom(false);
        processor.setFileStart(2);

        final EchoviewBatchProcessor.Summary summary = processor.process(inputFolder, outputFolder);

        assertEquals(1, summary.getProcessed());
        assertFalse(new File(outputFolder, EXPORT_NAME + "_echogram.csv").exists());
        assertTrue(new File(outputFolder, "Z_second_echogram.csv").exists());
    }

    @Test
    public void testExportsAreListedByName() throws Exception {
        Files.write(new File(inputFolder, "A_first.csv").toPath(), new byte[0]);
        Files.write(new File(inputFolder, "notes.txt").toPath(), new byte[0]);

        final File[] files = EchoviewBatchProcessor.listExports(inputFolder);

        assertEquals(2, files.length);
        assertEquals("A_first.csv", files[0].getName());
        assertEquals(EXPORT_NAME + ".csv", files[1].getName());
    }

    @Test
    public void testUpperCaseExtensionIsListedInAnyDefaultLocale() throws Exception {
        Files.write(new File(inputFolder, "IMPORT.CSV").toPath(), new byte[0]);
        final Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            final File[] files = EchoviewBatchProcessor.listExports(inputFolder);

            assertEquals(2, files.length);
            assertEquals("IMPORT.CSV", files[1].getName());
        } finally {
            Locale.setDefault(defaultLocale);
        }
    }

    private static EchoviewBatchProcessor createProcessor() {
        return new EchoviewBatchProcessor(new EchogramNormalizationOperator(null, 288));
    }

    private void copyResource(String resource, File target) throws Exception {
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            Files.copy(in, target.toPath());
        }
    }
}
