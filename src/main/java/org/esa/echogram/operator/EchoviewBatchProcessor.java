package org.esa.echogram.operator;

import org.esa.echogram.EchogramException;
import org.esa.echogram.io.BottomLine;
import org.esa.echogram.io.EchogramDisplayOptions;
import org.esa.echogram.io.EchogramWriter;
import org.esa.echogram.io.EchoviewBottomReader;
import org.esa.echogram.io.EchoviewCsvReader;
import org.esa.echogram.io.EchoviewExport;
import org.esa.echogram.util.AxisUtils;
import org.esa.echogram.util.EchogramLogManager;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Processes all Echoview exports ({@code *.csv}) of a folder, one file after the other, in the
 * order of their names. A file that cannot be processed is reported and skipped.
 */
public class EchoviewBatchProcessor {

    static final String FILE_NAME_LIST_MARKER = "FileNameList";

    private final EchogramNormalizationOperator operator;
    private final EchoviewCsvReader csvReader;
    private final EchoviewBottomReader bottomReader;
    private final EchogramWriter writer;
    private final Logger logger;

    private int fileStart = 1;
    private boolean requireBottom = true;

    public EchoviewBatchProcessor(EchogramNormalizationOperator operator) {
        this.operator = operator;
        this.csvReader = new EchoviewCsvReader();
        this.bottomReader = new EchoviewBottomReader();
        this.writer = new EchogramWriter();
        this.logger = EchogramLogManager.getSystemLogger();
    }

    /**
     * @param fileStart the 1-based position of the first file to process
     */
    public void setFileStart(int fileStart) {
        if (fileStart < 1) {
            throw new IllegalArgumentException("fileStart < 1");
        }
        this.fileStart = fileStart;
    }

    /**
     * @param requireBottom whether an export without bottom file is an error
     */
    public void setRequireBottom(boolean requireBottom) {
        this.requireBottom = requireBottom;
    }

    /**
     * @throws EchogramException if the input folder cannot be listed
     */
    public Summary process(File inputFolder, File outputFolder) {
        final File[] files = listExports(inputFolder);
        logger.info(String.format("Found %d exports in %s", files.length, inputFolder));
        final Summary summary = new Summary();
        for (int i = fileStart - 1; i < files.length; i++) {
            final File file = files[i];
            logger.info("Processing: " + file);
            if (file.getName().contains(FILE_NAME_LIST_MARKER)) {
                logger.info("Skipped: " + file);
                summary.skipped++;
                continue;
            }
            try {
                if (processFile(file, inputFolder, outputFolder)) {
                    summary.processed++;
                } else {
                    logger.info("Skipped, too few pings: " + file);
                    summary.skipped++;
                }
            } catch (EchogramException | IOException e) {
                logger.log(Level.WARNING, "Failed to process " + file + ": " + e.getMessage(), e);
                summary.failed++;
            }
        }
        logger.info(String.format("Processed %d, skipped %d, failed %d", summary.processed, summary.skipped,
                                  summary.failed));
        return summary;
    }

    /**
     * @return {@code false} if the export holds too few pings
     */
    boolean processFile(File file, File inputFolder, File outputFolder) throws IOException {
        final EchoviewExport export = csvReader.read(file);
        if (export.isEmpty()) {
            return false;
        }
        final BottomLine bottomLine = readBottomLine(inputFolder, export.getName());
        final EchogramResult result = operator.process(export, bottomLine);
        final double[] times = result.getPingTimes();
        final EchogramDisplayOptions options = EchogramDisplayOptions.forExport(export.getName(),
                                                                                AxisUtils.min(times),
                                                                                AxisUtils.max(times));
        final File target = writer.write(result, options, outputFolder, export.getName());
        logger.info("Written: " + target);
        return true;
    }

    private BottomLine readBottomLine(File inputFolder, String exportName) throws IOException {
        final File bottomFile = EchoviewBottomReader.getBottomFile(inputFolder, exportName);
        if (!bottomFile.isFile()) {
            if (requireBottom) {
                throw new EchogramException("File not found: " + bottomFile);
            }
            logger.fine("No bottom file " + bottomFile);
            return null;
        }
        final BottomLine bottomLine = bottomReader.read(bottomFile);
        if (bottomLine == null) {
            logger.fine("Bottom line of " + exportName + " has too few good points, using bathymetry");
        }
        return bottomLine;
    }

    static File[] listExports(File inputFolder) {
        final File[] files = inputFolder.listFiles(
                file -> file.isFile() && file.getName().toLowerCase(Locale.ENGLISH).endsWith(".csv"));
        if (files == null) {
            throw new EchogramException("Not a readable folder: " + inputFolder);
        }
        Arrays.sort(files);
        return files;
    }

    /**
     * File counts of one batch run.
     */
    public static class Summary {

        private int processed;
        private int skipped;
        private int failed;

        public int getProcessed() {
            return processed;
        }

        public int getSkipped() {
            return skipped;
        }

        public int getFailed() {
            return failed;
        }
    }
}
