package org.esa.echogram;

/**
 * One acoustic ping as delivered by an importer.
 * <p>
 * All values are read-only for the processing chain, except the timestamp which may be
 * corrected in place by the timestamp repair.
 */
public class PingRecord {

    public static final double UNKNOWN_LATITUDE = 999.0;
    public static final double UNKNOWN_LONGITUDE = -999.0;

    private double timestamp;           /* days since 1970-01-01T00:00Z, GMT, fractional time of day */
    private final double latitude;      /* decimal degrees, 999 if unknown */
    private final double longitude;     /* decimal degrees, -999 if unknown */
    private final double rangeStart;    /* m */
    private final double rangeStop;     /* m */
    private final int sampleCount;      /* declared number of depth samples */
    private final double[] samples;     /* Sv in dB, NO_DATA for invalid samples */

    public PingRecord(double timestamp, double latitude, double longitude,
                      double rangeStart, double rangeStop, double[] samples) {
        this(timestamp, latitude, longitude, rangeStart, rangeStop, samples.length, samples);
    }

    public PingRecord(double timestamp, double latitude, double longitude,
                      double rangeStart, double rangeStop, int sampleCount, double[] samples) {
        if (samples == null) {
            throw new IllegalArgumentException("samples == null");
        }
        this.timestamp = timestamp;
        this.latitude = latitude;
        this.longitude = longitude;
        this.rangeStart = rangeStart;
        this.rangeStop = rangeStop;
        this.sampleCount = sampleCount;
        this.samples = samples;
    }

    public double getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(double timestamp) {
        this.timestamp = timestamp;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getRangeStart() {
        return rangeStart;
    }

    public double getRangeStop() {
        return rangeStop;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    /**
     * @return the sample array itself, not a copy
     */
    public double[] getSamples() {
        return samples;
    }

    public boolean hasValidPosition() {
        return isValidPosition(latitude, longitude);
    }

    /**
     * @return {@code false} for the unknown-position markers, non-finite values and latitudes
     *         outside [-90, 90]
     */
    public static boolean isValidPosition(double lat, double lon) {
        if (lat == UNKNOWN_LATITUDE || lon == UNKNOWN_LONGITUDE) {
            return false;
        }
        if (Double.isNaN(lat) || Double.isNaN(lon) || Double.isInfinite(lon)) {
            return false;
        }
        return Math.abs(lat) <= 90.0;
    }

    public boolean isRangeDegenerate() {
        return rangeStart == rangeStop;
    }
}
