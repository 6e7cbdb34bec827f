package org.esa.echogram.bathymetry;

import org.esa.echogram.EchogramException;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.MessageFormat;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads an ESRI ASCII raster (as offered for GEBCO grids) into a {@link BathymetryGrid}.
 * <p>
 * Header keys: {@code ncols, nrows, xllcorner|xllcenter, yllcorner|yllcenter, cellsize} and the
 * optional {@code NODATA_value}. The first data row is the northernmost one; the latitude axis of
 * the grid keeps this north-to-south order.
 */
public class EsriAsciiGridReader {

    private static final String[] REQUIRED_KEYS = {"ncols", "nrows", "cellsize"};

    public BathymetryGrid read(File file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.US_ASCII)) {
            return read(reader, file.getName());
        }
    }

    BathymetryGrid read(Reader source, String name) throws IOException {
        final BufferedReader reader = source instanceof BufferedReader
                                      ? (BufferedReader) source : new BufferedReader(source);
        final Map<String, Double> header = new HashMap<>();
        String line = reader.readLine();
        while (line != null && isHeaderLine(line)) {
            final String[] tokens = line.trim().split("\\s+");
            if (tokens.length != 2) {
                throw new EchogramException(MessageFormat.format("Malformed header line in {0}: {1}", name, line));
            }
            header.put(tokens[0].toLowerCase(Locale.ENGLISH), parse(tokens[1], name));
            line = reader.readLine();
        }
        for (String key : REQUIRED_KEYS) {
            if (!header.containsKey(key)) {
                throw new EchogramException(MessageFormat.format("Missing header key ''{0}'' in {1}", key, name));
            }
        }
        final int ncols = header.get("ncols").intValue();
        final int nrows = header.get("nrows").intValue();
        final double cellSize = header.get("cellsize");
        final double lonOrigin = origin(header, "xllcenter", "xllcorner", cellSize, name);
        final double latOrigin = origin(header, "yllcenter", "yllcorner", cellSize, name);
        final Double noData = header.get("nodata_value");

        final double[] lonAxis = new double[ncols];
        for (int j = 0; j < ncols; j++) {
            lonAxis[j] = lonOrigin + j * cellSize;
        }
        final double[] latAxis = new double[nrows];
        for (int i = 0; i < nrows; i++) {
            latAxis[i] = latOrigin + (nrows - 1 - i) * cellSize;
        }

        final double[][] elevation = new double[nrows][ncols];
        int row = 0;
        int col = 0;
        while (line != null) {
            for (String token : line.trim().split("\\s+")) {
                if (token.isEmpty()) {
                    continue;
                }
                if (row >= nrows) {
                    throw new EchogramException(MessageFormat.format("Too many values in {0}", name));
                }
                final double value = parse(token, name);
                elevation[row][col] = noData != null && value == noData ? Double.NaN : value;
                if (++col == ncols) {
                    col = 0;
                    row++;
                }
            }
            line = reader.readLine();
        }
        if (row != nrows) {
            throw new EchogramException(MessageFormat.format("Expected {0} rows in {1}, found {2}", nrows, name, row));
        }
        return BathymetryGrid.wrap(latAxis, lonAxis, elevation);
    }

    private static boolean isHeaderLine(String line) {
        final String trimmed = line.trim();
        return !trimmed.isEmpty() && Character.isLetter(trimmed.charAt(0));
    }

    private static double origin(Map<String, Double> header, String centerKey, String cornerKey, double cellSize,
                                 String name) {
        if (header.containsKey(centerKey)) {
            return header.get(centerKey);
        }
        if (header.containsKey(cornerKey)) {
            return header.get(cornerKey) + cellSize / 2.0;
        }
        throw new EchogramException(MessageFormat.format("Missing header key ''{0}'' in {1}", cornerKey, name));
    }

    private static double parse(String token, String name) {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new EchogramException(MessageFormat.format("Not a number in {0}: {1}", name, token), e);
        }
    }
}
