package org.esa.echogram.operator;

/**
 * A regular echogram: a matrix of Sv values over a uniform time axis (rows) and a uniform depth
 * axis (columns). Missing values are NaN.
 */
public class EchogramGrid {

    private final double[] timeAxis;
    private final double[] depthAxis;
    private final double[][] matrix;

    public EchogramGrid(double[] timeAxis, double[] depthAxis, double[][] matrix) {
        if (matrix.length != timeAxis.length) {
            throw new IllegalArgumentException("matrix has " + matrix.length + " rows, expected " + timeAxis.length);
        }
        for (double[] row : matrix) {
            if (row.length != depthAxis.length) {
                throw new IllegalArgumentException(
                        "matrix row has " + row.length + " columns, expected " + depthAxis.length);
            }
        }
        this.timeAxis = timeAxis;
        this.depthAxis = depthAxis;
        this.matrix = matrix;
    }

    public double[] getTimeAxis() {
        return timeAxis;
    }

    public double[] getDepthAxis() {
        return depthAxis;
    }

    public double[][] getMatrix() {
        return matrix;
    }

    public int getTimeCount() {
        return timeAxis.length;
    }

    public int getDepthCount() {
        return depthAxis.length;
    }

    public double getValue(int timeIndex, int depthIndex) {
        return matrix[timeIndex][depthIndex];
    }
}
