package org.esa.echogram.util;

/**
 * The single no-data marker used for backscatter samples once they have been ingested.
 * <p>
 * Echoview exports flag missing samples in several ways (0, -9.9E37, -999, NaN). All of
 * them are mapped to {@link #NO_DATA} before any resampling takes place.
 */
public final class NoDataValues {

    public static final double NO_DATA = Double.NaN;

    static final double ECHOVIEW_NO_DATA = -9.9E37;
    static final double EXPORT_NO_DATA = -999.0;

    private NoDataValues() {
    }

    public static boolean isNoData(double value) {
        return Double.isNaN(value);
    }

    /**
     * Checks a raw exported value against all known no-data encodings.
     */
    public static boolean isRawNoData(double value) {
        return value == 0.0
               || value == ECHOVIEW_NO_DATA
               || value == EXPORT_NO_DATA
               || Double.isNaN(value)
               || Double.isInfinite(value);
    }

    /**
     * Replaces, in place, every raw no-data encoding by {@link #NO_DATA}.
     *
     * @param samples the raw samples
     * @return the number of replaced samples
     */
    public static int normalize(double[] samples) {
        int count = 0;
        for (int i = 0; i < samples.length; i++) {
            if (isRawNoData(samples[i])) {
                samples[i] = NO_DATA;
                count++;
            }
        }
        return count;
    }
}
