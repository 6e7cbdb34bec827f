package org.esa.echogram.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

/**
 * Reads an Echoview bottom line export with the columns
 * {@code Ping_date, Ping_time, Ping_milliseconds, Latitude, Longitude, Position_status, Depth,
 * Line_status, ...}. Only points with a line status of 1 ("good") are kept.
 */
public class EchoviewBottomReader {

    public static final String BOTTOM_FOLDER = "Bottom";

    /**
     * A bottom line with fewer good points is treated as absent.
     */
    public static final int MIN_GOOD_POINTS = 4;

    static final int PING_DATE = 0;
    static final int PING_TIME = 1;
    static final int LATITUDE = 3;
    static final int LONGITUDE = 4;
    static final int DEPTH = 6;
    static final int LINE_STATUS = 7;

    private static final double GOOD_STATUS = 1.0;

    /**
     * @return the bottom file belonging to an export: {@code <folder>/Bottom/<name>.csv}
     */
    public static File getBottomFile(File exportFolder, String exportName) {
        return new File(new File(exportFolder, BOTTOM_FOLDER), exportName + ".csv");
    }

    /**
     * @return the bottom line, or {@code null} if it has fewer than {@link #MIN_GOOD_POINTS} good points
     */
    public BottomLine read(File file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return read(reader, file.getName());
        }
    }

    public BottomLine read(Reader source, String name) throws IOException {
        final BufferedReader reader = source instanceof BufferedReader
                                      ? (BufferedReader) source : new BufferedReader(source);
        double[] times = new double[64];
        double[] lats = new double[64];
        double[] lons = new double[64];
        double[] depths = new double[64];
        int count = 0;

        String line = reader.readLine();
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            final String[] fields = EchoviewCsv.split(line);
            if (fields.length <= LINE_STATUS) {
                continue;
            }
            final double status = EchoviewCsv.parseDouble(fields[LINE_STATUS], "Line_status", name, lineNumber);
            if (status != GOOD_STATUS) {
                continue;
            }
            if (count == times.length) {
                times = Arrays.copyOf(times, 2 * count);
                lats = Arrays.copyOf(lats, 2 * count);
                lons = Arrays.copyOf(lons, 2 * count);
                depths = Arrays.copyOf(depths, 2 * count);
            }
            times[count] = EchoviewCsv.parseTimestamp(fields[PING_DATE], fields[PING_TIME], name, lineNumber);
            lats[count] = EchoviewCsv.parseDouble(fields[LATITUDE], "Latitude", name, lineNumber);
            lons[count] = EchoviewCsv.parseDouble(fields[LONGITUDE], "Longitude", name, lineNumber);
            depths[count] = EchoviewCsv.parseDouble(fields[DEPTH], "Depth", name, lineNumber);
            count++;
        }
        if (count < MIN_GOOD_POINTS) {
            return null;
        }
        return new BottomLine(Arrays.copyOf(times, count), Arrays.copyOf(lats, count),
                              Arrays.copyOf(lons, count), Arrays.copyOf(depths, count));
    }
}
