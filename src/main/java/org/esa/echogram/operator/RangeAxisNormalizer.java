package org.esa.echogram.operator;

import org.esa.echogram.EchogramException;
import org.esa.echogram.PingRecord;
import org.esa.echogram.util.AxisUtils;
import org.esa.echogram.util.NearestNeighbourInterpolation;
import org.esa.echogram.util.NoDataValues;

import java.text.MessageFormat;
import java.util.List;

/**
 * Resamples the samples of every ping onto one depth axis shared by all pings of a file.
 * <p>
 * The shared axis has {@code 2 * sampleCountMax} equally spaced values from the smallest range
 * start to the largest range stop of all pings.
 */
public class RangeAxisNormalizer {

    private final int sampleCountMax;
    private final double[] depthAxis;

    /**
     * @param pings          the pings of one file
     * @param sampleCountMax the maximum sample count of the file
     */
    public RangeAxisNormalizer(List<PingRecord> pings, int sampleCountMax) {
        if (pings.isEmpty()) {
            throw new IllegalArgumentException("no pings");
        }
        if (sampleCountMax < 1) {
            throw new IllegalArgumentException("sampleCountMax < 1");
        }
        this.sampleCountMax = sampleCountMax;
        this.depthAxis = createDepthAxis(pings, sampleCountMax);
    }

    public double[] getDepthAxis() {
        return depthAxis;
    }

    static double[] createDepthAxis(List<PingRecord> pings, int sampleCountMax) {
        double minStart = Double.POSITIVE_INFINITY;
        double maxStop = Double.NEGATIVE_INFINITY;
        for (PingRecord ping : pings) {
            minStart = Math.min(minStart, ping.getRangeStart());
            maxStop = Math.max(maxStop, ping.getRangeStop());
        }
        return AxisUtils.linspace(minStart, maxStop, 2 * sampleCountMax);
    }

    /**
     * Resamples all pings.
     *
     * @return a matrix with one row per ping and {@code 2 * sampleCountMax} columns
     * @throws EchogramException if the first ping has a degenerate range
     */
    public double[][] resample(List<PingRecord> pings) {
        final double[][] rows = new double[pings.size()][];
        PingRecord previous = null;
        for (int i = 0; i < rows.length; i++) {
            final PingRecord ping = pings.get(i);
            rows[i] = resample(ping, previous, i);
            previous = ping;
        }
        return rows;
    }

    double[] resample(PingRecord ping, PingRecord previous, int pingIndex) {
        final double[] nativeRange = createNativeRange(ping, previous, pingIndex);
        final double[] samples = fitSamples(ping.getSamples());
        return NearestNeighbourInterpolation.interpolate(nativeRange, samples, depthAxis);
    }

    /**
     * Builds the range of every sample of a ping: values from range start in steps of
     * {@code rangeStop / sampleCountMax}, forced to {@code sampleCountMax} values. A ping whose
     * range start equals its range stop borrows the range stop of the previous ping.
     */
    double[] createNativeRange(PingRecord ping, PingRecord previous, int pingIndex) {
        double stop = ping.getRangeStop();
        if (ping.isRangeDegenerate()) {
            if (previous == null) {
                throw new EchogramException(MessageFormat.format(
                        "Ping {0} has an empty range ({1} m) and no preceding ping", pingIndex, stop));
            }
            stop = previous.getRangeStop();
        }
        final double step = stop / sampleCountMax;
        if (!(step > 0.0) || Double.isInfinite(step)) {
            throw new EchogramException(MessageFormat.format(
                    "Ping {0} has an invalid range: start {1} m, stop {2} m", pingIndex, ping.getRangeStart(), stop));
        }
        final double[] range = AxisUtils.colon(ping.getRangeStart(), step, stop);
        return AxisUtils.fitLength(range, sampleCountMax, stop);
    }

    // copy of the samples, no-data normalised, truncated or padded to sampleCountMax
    private double[] fitSamples(double[] samples) {
        final double[] fitted = AxisUtils.fitLength(samples.clone(), sampleCountMax, NoDataValues.NO_DATA);
        NoDataValues.normalize(fitted);
        return fitted;
    }
}
