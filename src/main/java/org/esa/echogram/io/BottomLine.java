package org.esa.echogram.io;

/**
 * The good points of an Echoview bottom line export.
 */
public class BottomLine {

    private final double[] times;      /* days since 1970-01-01 */
    private final double[] latitudes;  /* deg */
    private final double[] longitudes; /* deg */
    private final double[] depths;     /* m */

    public BottomLine(double[] times, double[] latitudes, double[] longitudes, double[] depths) {
        if (latitudes.length != times.length || longitudes.length != times.length || depths.length != times.length) {
            throw new IllegalArgumentException("bottom line columns differ in length");
        }
        this.times = times;
        this.latitudes = latitudes;
        this.longitudes = longitudes;
        this.depths = depths;
    }

    public int getPointCount() {
        return times.length;
    }

    public double[] getTimes() {
        return times;
    }

    public double[] getLatitudes() {
        return latitudes;
    }

    public double[] getLongitudes() {
        return longitudes;
    }

    public double[] getDepths() {
        return depths;
    }
}
