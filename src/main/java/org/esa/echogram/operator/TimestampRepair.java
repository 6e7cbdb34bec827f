package org.esa.echogram.operator;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.esa.echogram.PingRecord;
import org.esa.echogram.util.EchogramLogManager;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Makes a sequence of ping times strictly increasing, changing as few values as possible.
 * <p>
 * A time {@code t[i]} is defective if it is not later than {@code t[i-1]}. The repair runs in two
 * passes:
 * <ol>
 * <li>every run of consecutive defective times that has a successor is spread evenly between the
 * last time before the run and the first time after it (a single defect becomes the midpoint of
 * its neighbours);</li>
 * <li>defects left within the first or last {@link #EDGE_WINDOW} indices are rebuilt with a
 * uniform interval, walking backward from the first trusted time (start of the sequence) or
 * forward from the last trusted time (end of the sequence).</li>
 * </ol>
 * This is a local heuristic. Several defect clusters away from the edges are not guaranteed to
 * be resolved; a warning is logged in that case.
 */
public class TimestampRepair {

    static final int EDGE_WINDOW = 5;

    /**
     * Smallest interval used when rebuilding an edge run: one millisecond, in days.
     */
    public static final double MIN_INTERVAL = 1.0 / 86400000.0;

    private final Logger logger;

    public TimestampRepair() {
        logger = EchogramLogManager.getSystemLogger();
    }

    /**
     * Repairs the timestamps of the given pings in place.
     *
     * @param pings the pings of one file, in acquisition order
     * @return the number of changed timestamps
     */
    public int repair(List<PingRecord> pings) {
        final double[] times = new double[pings.size()];
        for (int i = 0; i < times.length; i++) {
            times[i] = pings.get(i).getTimestamp();
        }
        final double[] repaired = repair(times);
        int changed = 0;
        for (int i = 0; i < repaired.length; i++) {
            if (repaired[i] != times[i]) {
                pings.get(i).setTimestamp(repaired[i]);
                changed++;
            }
        }
        return changed;
    }

    /**
     * @param times ping times in days
     * @return the repaired times, a new array
     */
    public double[] repair(double[] times) {
        final double[] t = times.clone();
        final int n = t.length;
        if (n < 2) {
            return t;
        }

        int[] defects = findDefects(t);
        if (defects.length == 0) {
            return t;
        }
        logger.fine(String.format("Repairing %d non-increasing timestamps out of %d", defects.length, n));

        int runStart = 0;
        while (runStart < defects.length) {
            int runEnd = runStart;
            while (runEnd + 1 < defects.length && defects[runEnd + 1] == defects[runEnd] + 1) {
                runEnd++;
            }
            interpolateRun(t, defects[runStart], defects[runEnd]);
            runStart = runEnd + 1;
        }

        defects = findDefects(t);
        if (defects.length > 0 && defects[defects.length - 1] < EDGE_WINDOW) {
            repairStartRun(t, defects);
            defects = findDefects(t);
        }
        if (defects.length > 0 && defects[0] >= n - EDGE_WINDOW) {
            repairEndRun(t, defects);
            defects = findDefects(t);
        }

        if (defects.length > 0) {
            logger.warning(String.format("%d timestamps are still not increasing after repair, first at index %d",
                                         defects.length, defects[0]));
        }
        return t;
    }

    /**
     * @return all indices {@code i} with {@code t[i] <= t[i-1]}, ascending
     */
    static int[] findDefects(double[] t) {
        final int[] defects = new int[t.length];
        int count = 0;
        for (int i = 1; i < t.length; i++) {
            if (t[i] - t[i - 1] <= 0.0) {
                defects[count++] = i;
            }
        }
        return Arrays.copyOf(defects, count);
    }

    // t[first..last] evenly between t[first-1] and t[last+1]; runs reaching the end are left to the edge pass
    private static void interpolateRun(double[] t, int first, int last) {
        if (last >= t.length - 1) {
            return;
        }
        final double left = t[first - 1];
        final double step = (t[last + 1] - left) / (last - first + 2);
        for (int i = first; i <= last; i++) {
            t[i] = left + (i - first + 1) * step;
        }
    }

    // times before the last defect are rebuilt backward from it
    private void repairStartRun(double[] t, int[] defects) {
        final int anchor = defects[defects.length - 1];
        final int validSteps = Math.min(defects.length, t.length - 1 - anchor);
        double interval = Double.NaN;
        if (validSteps > 0) {
            interval = (t[anchor + validSteps] - t[anchor]) / validSteps;
        }
        interval = boundInterval(interval, t);
        for (int k = anchor - 1; k >= 0; k--) {
            t[k] = t[k + 1] - interval;
        }
    }

    // times from the first defect on are rebuilt forward from its predecessor
    private void repairEndRun(double[] t, int[] defects) {
        final int first = defects[0];
        final int anchor = first - 1;
        final int validSteps = Math.min(defects.length, anchor);
        double interval = Double.NaN;
        if (validSteps > 0) {
            interval = (t[anchor] - t[anchor - validSteps]) / validSteps;
        }
        interval = boundInterval(interval, t);
        for (int k = first; k < t.length; k++) {
            t[k] = t[k - 1] + interval;
        }
    }

    private static double boundInterval(double interval, double[] t) {
        if (Double.isNaN(interval) || Double.isInfinite(interval) || interval < MIN_INTERVAL) {
            return fallbackInterval(t);
        }
        return interval;
    }

    /**
     * @return the median of all positive steps, at least {@link #MIN_INTERVAL}
     */
    static double fallbackInterval(double[] t) {
        final double[] steps = new double[t.length - 1];
        int count = 0;
        for (int i = 1; i < t.length; i++) {
            final double step = t[i] - t[i - 1];
            if (step > 0.0 && !Double.isInfinite(step)) {
                steps[count++] = step;
            }
        }
        if (count == 0) {
            return MIN_INTERVAL;
        }
        final double median = new Median().evaluate(steps, 0, count);
        return Math.max(median, MIN_INTERVAL);
    }
}
