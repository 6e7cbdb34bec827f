package org.esa.echogram.bathymetry;

/**
 * Gridded seafloor elevation. Immutable.
 * <p>
 * The axes are kept in the order of the source data; {@code elevation[i][j]} belongs to
 * {@code latAxis[i]} and {@code lonAxis[j]}. Land is positive, sea floor negative, no-data NaN.
 */
public final class BathymetryGrid {

    private final double[] latAxis;
    private final double[] lonAxis;
    private final double[][] elevation;

    /**
     * Creates a grid from copies of the given arrays.
     */
    public BathymetryGrid(double[] latAxis, double[] lonAxis, double[][] elevation) {
        this(latAxis, lonAxis, elevation, true);
    }

    private BathymetryGrid(double[] latAxis, double[] lonAxis, double[][] elevation, boolean copy) {
        if (elevation.length != latAxis.length) {
            throw new IllegalArgumentException("elevation rows != latitude count");
        }
        this.latAxis = copy ? latAxis.clone() : latAxis;
        this.lonAxis = copy ? lonAxis.clone() : lonAxis;
        this.elevation = copy ? new double[elevation.length][] : elevation;
        for (int i = 0; i < elevation.length; i++) {
            if (elevation[i].length != lonAxis.length) {
                throw new IllegalArgumentException("elevation columns != longitude count in row " + i);
            }
            if (copy) {
                this.elevation[i] = elevation[i].clone();
            }
        }
    }

    /**
     * Creates a grid that takes ownership of the given arrays; the caller must not modify them afterwards.
     */
    static BathymetryGrid wrap(double[] latAxis, double[] lonAxis, double[][] elevation) {
        return new BathymetryGrid(latAxis, lonAxis, elevation, false);
    }

    public int getLatCount() {
        return latAxis.length;
    }

    public int getLonCount() {
        return lonAxis.length;
    }

    public double getLat(int index) {
        return latAxis[index];
    }

    public double getLon(int index) {
        return lonAxis[index];
    }

    public double getElevation(int latIndex, int lonIndex) {
        return elevation[latIndex][lonIndex];
    }
}
