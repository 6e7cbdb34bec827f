package org.esa.echogram.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.esa.echogram.util.EchogramLogManager;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line entry point of the echogram processor.
 * <pre>
 *   echogram process --input exports --output echograms [--bathymetry gebco.asc]
 *   echogram sun --lat 41.5 --lon 70.7 --date 2015-06-21
 * </pre>
 */
public final class EchogramCli {

    static final String PROGRAM_NAME = "echogram";

    private EchogramCli() {
    }

    public static void main(String[] args) {
        try {
            EchogramLogManager.configure();
        } catch (IOException e) {
            System.err.println("Unable to read logging configuration: " + e.getMessage());
        }
        System.exit(run(args));
    }

    /**
     * @return the exit code: 0 success, 1 processing failure, 2 usage error
     */
    static int run(String... args) {
        final Map<String, CliCommand> commands = new LinkedHashMap<>();
        commands.put("process", new ProcessEchoviewCommand());
        commands.put("sun", new SunCycleCommand());

        final JCommander.Builder builder = JCommander.newBuilder().programName(PROGRAM_NAME);
        for (Map.Entry<String, CliCommand> entry : commands.entrySet()) {
            builder.addCommand(entry.getKey(), entry.getValue());
        }
        final JCommander commander = builder.build();
        try {
            commander.parse(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            commander.usage();
            return 2;
        }
        final String parsed = commander.getParsedCommand();
        if (parsed == null) {
            commander.usage();
            return 2;
        }
        return commands.get(parsed).run();
    }
}
