package org.esa.echogram.io;

import org.esa.echogram.EchogramException;
import org.esa.echogram.PingRecord;
import org.esa.echogram.util.AxisUtils;
import org.esa.echogram.util.NoDataValues;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads an Echoview Sv export ("Export Sv raw" CSV, one row per ping).
 * <p>
 * The first line is a header. Each data row starts with the columns
 * {@code Ping_index, Distance_gps, Distance_vl, Ping_date, Ping_time, Ping_milliseconds,
 * Latitude, Longitude, Depth_start, Depth_stop, Range_start, Range_stop, Sample_count}
 * followed by the sample values. The milliseconds column is not part of the timestamp.
 */
public class EchoviewCsvReader {

    static final int PING_DATE = 3;
    static final int PING_TIME = 4;
    static final int LATITUDE = 6;
    static final int LONGITUDE = 7;
    static final int RANGE_START = 10;
    static final int RANGE_STOP = 11;
    static final int SAMPLE_COUNT = 12;
    static final int FIRST_SAMPLE = 13;

    /**
     * Files with fewer data rows carry no usable echogram.
     */
    public static final int MIN_PING_COUNT = 2;

    public EchoviewExport read(File file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return read(reader, baseName(file));
        }
    }

    /**
     * @param source the export, positioned at the header line
     * @param name   the export's name, used for messages
     * @return the pings; empty if the export has fewer than {@link #MIN_PING_COUNT} rows
     * @throws EchogramException on a malformed row
     */
    public EchoviewExport read(Reader source, String name) throws IOException {
        final BufferedReader reader = source instanceof BufferedReader
                                      ? (BufferedReader) source : new BufferedReader(source);
        final List<String[]> rows = new ArrayList<>();
        final List<Integer> lineNumbers = new ArrayList<>();
        String line = reader.readLine();
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            rows.add(EchoviewCsv.split(line));
            lineNumbers.add(lineNumber);
        }
        if (rows.size() < MIN_PING_COUNT) {
            return new EchoviewExport(name, Collections.<PingRecord>emptyList(), 0);
        }

        int sampleCountMax = 0;
        final List<PingRecord> pings = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            final PingRecord ping = parsePing(rows.get(i), name, lineNumbers.get(i));
            sampleCountMax = Math.max(sampleCountMax, ping.getSampleCount());
            pings.add(ping);
        }
        if (sampleCountMax < 1) {
            throw new EchogramException(MessageFormat.format("{0}: no ping has samples", name));
        }
        final List<PingRecord> fitted = new ArrayList<>(pings.size());
        for (PingRecord ping : pings) {
            fitted.add(fitToSampleCount(ping, sampleCountMax));
        }
        return new EchoviewExport(name, fitted, sampleCountMax);
    }

    static PingRecord parsePing(String[] fields, String source, int lineNumber) {
        if (fields.length < FIRST_SAMPLE) {
            throw new EchogramException(MessageFormat.format("{0}, line {1}: expected at least {2} columns, found {3}",
                                                             source, lineNumber, FIRST_SAMPLE, fields.length));
        }
        final double timestamp = EchoviewCsv.parseTimestamp(fields[PING_DATE], fields[PING_TIME], source,
                                                            lineNumber);
        final double lat = EchoviewCsv.parseDouble(fields[LATITUDE], "Latitude", source, lineNumber);
        final double lon = EchoviewCsv.parseDouble(fields[LONGITUDE], "Longitude", source, lineNumber);
        final double rangeStart = EchoviewCsv.parseDouble(fields[RANGE_START], "Range_start", source, lineNumber);
        final double rangeStop = EchoviewCsv.parseDouble(fields[RANGE_STOP], "Range_stop", source, lineNumber);
        final double sampleCountValue = EchoviewCsv.parseDouble(fields[SAMPLE_COUNT], "Sample_count", source,
                                                                lineNumber);
        if (Double.isNaN(sampleCountValue) || sampleCountValue < 0) {
            throw new EchogramException(MessageFormat.format("{0}, line {1}: invalid Sample_count ''{2}''",
                                                             source, lineNumber, fields[SAMPLE_COUNT]));
        }
        final double[] samples = new double[fields.length - FIRST_SAMPLE];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = EchoviewCsv.parseDouble(fields[FIRST_SAMPLE + i], "Sample", source, lineNumber);
        }
        return new PingRecord(timestamp, lat, lon, rangeStart, rangeStop, (int) sampleCountValue, samples);
    }

    // samples beyond the file-wide maximum are dropped, missing ones are no-data
    private static PingRecord fitToSampleCount(PingRecord ping, int sampleCountMax) {
        final double[] samples = AxisUtils.fitLength(Arrays.copyOf(ping.getSamples(), ping.getSamples().length),
                                                     sampleCountMax, NoDataValues.NO_DATA);
        NoDataValues.normalize(samples);
        return new PingRecord(ping.getTimestamp(), ping.getLatitude(), ping.getLongitude(), ping.getRangeStart(),
                              ping.getRangeStop(), Math.min(ping.getSampleCount(), sampleCountMax), samples);
    }

    static String baseName(File file) {
        final String name = file.getName();
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
