package org.esa.echogram.util;

import org.apache.commons.math3.util.MathArrays;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Nearest-neighbour interpolation with extrapolation.
 * <p>
 * Every target coordinate gets the value of the closest source coordinate. Targets outside the
 * source domain get the value of the nearest end point. If a target lies exactly between two
 * source coordinates, the upper one wins.
 */
public final class NearestNeighbourInterpolation {

    private NearestNeighbourInterpolation() {
    }

    /**
     * @param x  the source coordinates, should be sorted ascending; unsorted input is sorted
     *           (stable) before lookup
     * @param y  the source values, same length as {@code x}
     * @param xi the target coordinates
     * @return the interpolated values, one per target coordinate
     */
    public static double[] interpolate(double[] x, double[] y, double[] xi) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x.length != y.length");
        }
        if (x.length == 0) {
            throw new IllegalArgumentException("x is empty");
        }
        final int[] index = createIndex(x, xi);
        final double[] yi = new double[xi.length];
        for (int i = 0; i < yi.length; i++) {
            yi[i] = y[index[i]];
        }
        return yi;
    }

    /**
     * Computes, for every target coordinate, the index of the source value to take. The result
     * can be reused for all source vectors sharing the axis {@code x}.
     */
    public static int[] createIndex(double[] x, double[] xi) {
        if (x.length == 0) {
            throw new IllegalArgumentException("x is empty");
        }
        final int[] order = sortOrder(x);
        final double[] sortedX = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            sortedX[i] = x[order[i]];
        }
        final int[] index = new int[xi.length];
        for (int i = 0; i < xi.length; i++) {
            index[i] = order[nearest(sortedX, xi[i])];
        }
        return index;
    }

    static int nearest(double[] sortedX, double value) {
        final int upper = lowerBound(sortedX, value);
        if (upper == 0) {
            return 0;
        }
        if (upper == sortedX.length) {
            return sortedX.length - 1;
        }
        final int lower = upper - 1;
        if (sortedX[upper] - value <= value - sortedX[lower]) {
            return upper;
        }
        return lower;
    }

    // first index i with sortedX[i] >= value
    private static int lowerBound(double[] sortedX, double value) {
        int low = 0;
        int high = sortedX.length;
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (sortedX[mid] < value) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static int[] sortOrder(final double[] x) {
        final int[] identity = new int[x.length];
        for (int i = 0; i < identity.length; i++) {
            identity[i] = i;
        }
        if (MathArrays.isMonotonic(x, MathArrays.OrderDirection.INCREASING, false)) {
            return identity;
        }
        final Integer[] boxed = new Integer[x.length];
        for (int i = 0; i < boxed.length; i++) {
            boxed[i] = i;
        }
        Arrays.sort(boxed, Comparator.comparingDouble(i -> x[i]));
        for (int i = 0; i < boxed.length; i++) {
            identity[i] = boxed[i];
        }
        return identity;
    }
}
