package org.esa.echogram.io;

import org.esa.echogram.operator.EchogramGrid;
import org.esa.echogram.operator.EchogramResult;
import org.esa.echogram.sun.SolarState;
import org.esa.echogram.util.PingTime;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;

/**
 * Writes a normalised echogram and its per-ping annotations as plain CSV for an external renderer.
 * <p>
 * The echogram file starts with {@code #} comment lines carrying the display options, followed by
 * a header row with the depth axis and one row per time sample. Missing values are written as
 * {@code NaN}.
 */
public class EchogramWriter {

    public static final String ECHOGRAM_SUFFIX = "_echogram.csv";
    public static final String PINGS_SUFFIX = "_pings.csv";
    public static final String BOTTOM_SUFFIX = "_bottom.csv";

    static final String PINGS_HEADER = "time,latitude,longitude,sunrise,sunset,day,estimated_bottom,bottom";
    static final String BOTTOM_HEADER = "time,latitude,longitude,depth";

    /**
     * Writes {@code <name>_echogram.csv} and {@code <name>_pings.csv} into the given folder, and
     * {@code <name>_bottom.csv} if the result carries a bottom line.
     *
     * @return the echogram file
     */
    public File write(EchogramResult result, EchogramDisplayOptions options, File outputFolder, String name)
            throws IOException {
        Files.createDirectories(outputFolder.toPath());
        final File echogramFile = new File(outputFolder, name + ECHOGRAM_SUFFIX);
        try (BufferedWriter writer = Files.newBufferedWriter(echogramFile.toPath(), StandardCharsets.UTF_8)) {
            writeEchogram(result.getGrid(), options, writer);
        }
        final File pingsFile = new File(outputFolder, name + PINGS_SUFFIX);
        try (BufferedWriter writer = Files.newBufferedWriter(pingsFile.toPath(), StandardCharsets.UTF_8)) {
            writePings(result, writer);
        }
        if (result.hasBottomLine()) {
            final File bottomFile = new File(outputFolder, name + BOTTOM_SUFFIX);
            try (BufferedWriter writer = Files.newBufferedWriter(bottomFile.toPath(), StandardCharsets.UTF_8)) {
                writeBottomLine(result.getBottomLine(), writer);
            }
        }
        return echogramFile;
    }

    void writeEchogram(EchogramGrid grid, EchogramDisplayOptions options, Writer writer) throws IOException {
        final double[] threshold = options.getThreshold();
        writer.write("# title: " + String.join(" / ", options.getTitle()) + "\n");
        writer.write("# xlabel: " + options.getXLabel() + "\n");
        writer.write("# ylabel: " + options.getYLabel() + "\n");
        writer.write("# colormap: " + options.getColormap() + "\n");
        writer.write("# threshold: " + format(threshold[0]) + "," + format(threshold[1]) + "\n");
        if (options.getFigureTarget() != null) {
            writer.write("# figure: " + options.getFigureTarget() + "\n");
        }

        final StringBuilder header = new StringBuilder("time");
        for (double depth : grid.getDepthAxis()) {
            header.append(',').append(format(depth));
        }
        writer.write(header.append('\n').toString());

        final double[] timeAxis = grid.getTimeAxis();
        for (int i = 0; i < grid.getTimeCount(); i++) {
            final StringBuilder row = new StringBuilder(PingTime.toDateTime(timeAxis[i]).toString());
            for (int j = 0; j < grid.getDepthCount(); j++) {
                row.append(',').append(format(grid.getValue(i, j)));
            }
            writer.write(row.append('\n').toString());
        }
    }

    void writePings(EchogramResult result, Writer writer) throws IOException {
        writer.write(PINGS_HEADER + "\n");
        final double[] times = result.getPingTimes();
        final SolarState[] states = result.getSolarStates();
        for (int i = 0; i < result.getPingCount(); i++) {
            writer.write(PingTime.toDateTime(times[i]) + ","
                         + format(result.getLatitudes()[i]) + ","
                         + format(result.getLongitudes()[i]) + ","
                         + format(states[i].getSunrise()) + ","
                         + format(states[i].getSunset()) + ","
                         + (result.getDayFlags()[i] ? 1 : 0) + ","
                         + format(result.getEstimatedBottom()[i]) + ","
                         + format(result.getBottomDepth()[i]) + "\n");
        }
    }

    void writeBottomLine(BottomLine bottomLine, Writer writer) throws IOException {
        writer.write(BOTTOM_HEADER + "\n");
        for (int i = 0; i < bottomLine.getPointCount(); i++) {
            writer.write(PingTime.toDateTime(bottomLine.getTimes()[i]) + ","
                         + format(bottomLine.getLatitudes()[i]) + ","
                         + format(bottomLine.getLongitudes()[i]) + ","
                         + format(bottomLine.getDepths()[i]) + "\n");
        }
    }

    static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return String.format(Locale.ROOT, "%.6g", value);
    }
}
