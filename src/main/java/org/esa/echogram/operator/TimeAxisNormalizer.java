package org.esa.echogram.operator;

import org.esa.echogram.util.AxisUtils;
import org.esa.echogram.util.NearestNeighbourInterpolation;

/**
 * Resamples a depth-normalised echogram onto a uniform time axis with twice as many samples as
 * there are pings. Every depth column is resampled on its own.
 */
public class TimeAxisNormalizer {

    /**
     * @param times the (repaired) ping times
     * @return {@code 2 * times.length} equally spaced times from the first to the last ping time
     */
    public double[] createTimeAxis(double[] times) {
        if (times.length == 0) {
            throw new IllegalArgumentException("no ping times");
        }
        return AxisUtils.linspace(AxisUtils.min(times), AxisUtils.max(times), 2 * times.length);
    }

    /**
     * @param rows     one row per ping, all rows of equal length
     * @param times    the ping times, one per row
     * @param timeAxis the target time axis
     * @return a matrix with one row per target time
     */
    public double[][] resample(double[][] rows, double[] times, double[] timeAxis) {
        if (rows.length != times.length) {
            throw new IllegalArgumentException("rows.length != times.length");
        }
        final int columnCount = rows.length > 0 ? rows[0].length : 0;
        final int[] index = NearestNeighbourInterpolation.createIndex(times, timeAxis);
        final double[][] resampled = new double[timeAxis.length][columnCount];
        for (int column = 0; column < columnCount; column++) {
            for (int i = 0; i < timeAxis.length; i++) {
                resampled[i][column] = rows[index[i]][column];
            }
        }
        return resampled;
    }
}
