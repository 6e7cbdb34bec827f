package org.esa.echogram.bathymetry;

import org.esa.echogram.PingRecord;

/**
 * Looks up the depth of a position in a {@link BathymetryGrid}.
 * <p>
 * The lookup is not a true nearest neighbour. Longitudes are taken as west (negative) longitudes.
 * For every axis the candidate cells are those with a coordinate greater than or equal to the
 * query; for a positive query the last candidate in axis order is taken, otherwise the first one.
 * With the north-to-south latitude order of a raster and a west-to-east longitude order this is
 * the next cell towards the pole and towards the prime meridian. The behaviour is kept as it is
 * for compatibility with existing products.
 */
public class BathymetryEstimator {

    /**
     * @return the depth in m (positive), NaN for an invalid position, a position outside the grid
     *         or a zero elevation
     */
    public double estimateDepth(BathymetryGrid grid, double lat, double lon) {
        if (!PingRecord.isValidPosition(lat, lon)) {
            return Double.NaN;
        }
        final double westLon = -Math.abs(lon);
        final int row = findCeilingIndex(grid, true, lat);
        final int col = findCeilingIndex(grid, false, westLon);
        if (row < 0 || col < 0) {
            return Double.NaN;
        }
        final double depth = Math.abs(grid.getElevation(row, col));
        if (depth == 0.0) {
            return Double.NaN;
        }
        return depth;
    }

    /**
     * @return the selected index or -1 if the query lies outside the axis range
     */
    static int findCeilingIndex(BathymetryGrid grid, boolean latitude, double value) {
        final int count = latitude ? grid.getLatCount() : grid.getLonCount();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int first = -1;
        int last = -1;
        for (int i = 0; i < count; i++) {
            final double axisValue = latitude ? grid.getLat(i) : grid.getLon(i);
            min = Math.min(min, axisValue);
            max = Math.max(max, axisValue);
            if (axisValue >= value) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        if (value < min || value > max || first < 0) {
            return -1;
        }
        return value > 0.0 ? last : first;
    }
}
