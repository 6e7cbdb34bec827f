package org.esa.echogram.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import org.esa.echogram.EchogramException;
import org.esa.echogram.bathymetry.BathymetryProvider;
import org.esa.echogram.bathymetry.GridBathymetryProvider;
import org.esa.echogram.operator.EchogramNormalizationOperator;
import org.esa.echogram.operator.EchoviewBatchProcessor;
import org.esa.echogram.sun.SolarEphemeris;
import org.esa.echogram.util.EchogramLogManager;

import java.io.File;
import java.util.logging.Level;
import java.util.logging.Logger;

@Parameters(commandDescription = "Normalise a folder of Echoview Sv exports")
public class ProcessEchoviewCommand implements CliCommand {

    @Parameter(names = {"--input", "-i"}, required = true,
               description = "Folder with the Echoview CSV exports and their Bottom sub-folder")
    private File inputFolder;

    @Parameter(names = {"--output", "-o"}, required = true,
               description = "Folder receiving the normalised echograms")
    private File outputFolder;

    @Parameter(names = "--file-start", description = "1-based position of the first export to process")
    private int fileStart = 1;

    @Parameter(names = "--bathymetry",
               description = "ESRI ASCII bathymetry grid used for exports without bottom line")
    private File bathymetryFile;

    @Parameter(names = "--require-bottom", arity = 1,
               description = "Treat an export without bottom file as an error")
    private boolean requireBottom = true;

    @Parameter(names = "--sun-steps", description = "Number of steps used to sample a day for sunrise and sunset")
    private int sunSteps = SolarEphemeris.DEFAULT_STEP_COUNT;

    @Override
    public int run() {
        final Logger logger = EchogramLogManager.getSystemLogger();
        try {
            BathymetryProvider bathymetry = null;
            if (bathymetryFile != null) {
                bathymetry = new GridBathymetryProvider(bathymetryFile);
            }
            final EchogramNormalizationOperator operator = new EchogramNormalizationOperator(bathymetry, sunSteps);
            final EchoviewBatchProcessor processor = new EchoviewBatchProcessor(operator);
            processor.setFileStart(fileStart);
            processor.setRequireBottom(requireBottom);
            final EchoviewBatchProcessor.Summary summary = processor.process(inputFolder, outputFolder);
            return summary.getFailed() > 0 ? 1 : 0;
        } catch (EchogramException | IllegalArgumentException e) {
            logger.log(Level.SEVERE, e.getMessage(), e);
            return 1;
        }
    }

    File getInputFolder() {
        return inputFolder;
    }

    File getOutputFolder() {
        return outputFolder;
    }

    int getFileStart() {
        return fileStart;
    }

    boolean isRequireBottom() {
        return requireBottom;
    }

    int getSunSteps() {
        return sunSteps;
    }
}
