package org.esa.echogram.util;

/**
 * Helpers for building the sample axes of an echogram.
 */
public final class AxisUtils {

    private AxisUtils() {
    }

    /**
     * Creates {@code n} equally spaced values from {@code first} to {@code last}, both included.
     * The last element is exactly {@code last}. For {@code n == 1} the result is {@code [last]}.
     */
    public static double[] linspace(double first, double last, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n < 1");
        }
        final double[] axis = new double[n];
        if (n == 1) {
            axis[0] = last;
            return axis;
        }
        final double step = (last - first) / (n - 1);
        for (int i = 0; i < n - 1; i++) {
            axis[i] = first + i * step;
        }
        axis[n - 1] = last;
        return axis;
    }

    /**
     * Creates the values {@code start, start + step, ...} not exceeding {@code stop}.
     * A small relative tolerance keeps {@code stop} itself when rounding errors accumulate.
     */
    public static double[] colon(double start, double step, double stop) {
        if (!(step > 0.0) || Double.isInfinite(step)) {
            throw new IllegalArgumentException("step must be positive and finite: " + step);
        }
        if (stop < start) {
            return new double[0];
        }
        final double tolerance = 1.0E-10 * Math.max(Math.abs(start), Math.abs(stop));
        final int n = (int) Math.floor((stop - start) / step + tolerance / step) + 1;
        final double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = start + i * step;
        }
        return values;
    }

    /**
     * Forces an axis to the given length by truncating it, or by padding it with {@code padValue}.
     */
    public static double[] fitLength(double[] axis, int length, double padValue) {
        if (axis.length == length) {
            return axis;
        }
        final double[] fitted = new double[length];
        final int copied = Math.min(axis.length, length);
        System.arraycopy(axis, 0, fitted, 0, copied);
        for (int i = copied; i < length; i++) {
            fitted[i] = padValue;
        }
        return fitted;
    }

    public static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double value : values) {
            if (value < min) {
                min = value;
            }
        }
        return min;
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            if (value > max) {
                max = value;
            }
        }
        return max;
    }
}
