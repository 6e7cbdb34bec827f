package org.esa.echogram.operator;

import org.esa.echogram.EchogramException;
import org.esa.echogram.PingRecord;
import org.esa.echogram.bathymetry.BathymetryProvider;
import org.esa.echogram.io.BottomLine;
import org.esa.echogram.io.EchoviewExport;
import org.esa.echogram.sun.DayNightClassifier;
import org.esa.echogram.sun.SolarEphemeris;
import org.esa.echogram.sun.SolarState;
import org.esa.echogram.util.EchogramLogManager;
import org.esa.echogram.util.NearestNeighbourInterpolation;

import java.text.MessageFormat;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Main operator for the echogram normalisation of one export.
 * <p>
 * The steps are: repair of the ping times, resampling of every ping onto a shared depth axis,
 * resampling of every depth column onto a uniform time axis, day/night classification of every
 * ping and the sea floor depth per ping, taken from the bottom line or, for exports without one,
 * estimated from the bathymetry.
 */
public class EchogramNormalizationOperator {

    private final TimestampRepair timestampRepair;
    private final TimeAxisNormalizer timeAxisNormalizer;
    private final DayNightClassifier dayNightClassifier;
    private final BathymetryProvider bathymetryProvider;
    private final Logger logger;

    /**
     * @param bathymetryProvider the bathymetry used for exports without bottom line, may be {@code null}
     * @param sunStepCount       the number of steps used to sample a day for sunrise and sunset
     */
    public EchogramNormalizationOperator(BathymetryProvider bathymetryProvider, int sunStepCount) {
        if (sunStepCount < 1) {
            throw new IllegalArgumentException("sunStepCount < 1");
        }
        this.timestampRepair = new TimestampRepair();
        this.timeAxisNormalizer = new TimeAxisNormalizer();
        this.dayNightClassifier = new DayNightClassifier(new SolarEphemeris(), sunStepCount);
        this.bathymetryProvider = bathymetryProvider;
        this.logger = EchogramLogManager.getSystemLogger();
    }

    public EchogramNormalizationOperator(BathymetryProvider bathymetryProvider) {
        this(bathymetryProvider, SolarEphemeris.DEFAULT_STEP_COUNT);
    }

    public EchogramResult process(EchoviewExport export, BottomLine bottomLine) {
        return process(export.getPings(), export.getSampleCountMax(), bottomLine);
    }

    /**
     * Normalises the pings of one export. The ping times are repaired in place.
     *
     * @param pings          the pings in acquisition order
     * @param sampleCountMax the largest sample count of the export
     * @param bottomLine     the detected bottom line, or {@code null}
     * @return the echogram with its annotations
     * @throws EchogramException if the pings cannot be normalised
     */
    public EchogramResult process(List<PingRecord> pings, int sampleCountMax, BottomLine bottomLine) {
        validateInput(pings, sampleCountMax);

        final int repaired = timestampRepair.repair(pings);
        if (repaired > 0) {
            logger.fine(MessageFormat.format("Repaired {0} of {1} ping times", repaired, pings.size()));
        }
        final double[] times = new double[pings.size()];
        final double[] lats = new double[pings.size()];
        final double[] lons = new double[pings.size()];
        for (int i = 0; i < times.length; i++) {
            final PingRecord ping = pings.get(i);
            times[i] = ping.getTimestamp();
            lats[i] = ping.getLatitude();
            lons[i] = ping.getLongitude();
        }

        final EchogramGrid grid;
        try {
            final RangeAxisNormalizer rangeAxisNormalizer = new RangeAxisNormalizer(pings, sampleCountMax);
            final double[][] rows = rangeAxisNormalizer.resample(pings);
            final double[] timeAxis = timeAxisNormalizer.createTimeAxis(times);
            final double[][] matrix = timeAxisNormalizer.resample(rows, times, timeAxis);
            grid = new EchogramGrid(timeAxis, rangeAxisNormalizer.getDepthAxis(), matrix);
        } catch (IllegalArgumentException e) {
            throw new EchogramException("Unable to normalise echogram: " + e.getMessage(), e);
        }
        logger.fine(MessageFormat.format("Echogram grid has {0} time and {1} depth samples",
                                         grid.getTimeCount(), grid.getDepthCount()));

        final SolarState[] solarStates = dayNightClassifier.computeSolarStates(pings);
        final boolean[] day = dayNightClassifier.classify(pings, solarStates);

        final double[] estimatedBottom = estimateBottom(lats, lons, bottomLine);
        final double[] bottomDepth;
        if (bottomLine != null) {
            bottomDepth = NearestNeighbourInterpolation.interpolate(bottomLine.getTimes(), bottomLine.getDepths(), times);
        } else {
            bottomDepth = estimatedBottom.clone();
        }

        return new EchogramResult(grid, times, lats, lons, day, solarStates, estimatedBottom, bottomDepth,
                                  bottomLine);
    }

    private double[] estimateBottom(double[] lats, double[] lons, BottomLine bottomLine) {
        final double[] depth = new double[lats.length];
        Arrays.fill(depth, Double.NaN);
        if (bottomLine != null || bathymetryProvider == null) {
            return depth;
        }
        for (int i = 0; i < depth.length; i++) {
            depth[i] = bathymetryProvider.estimateDepth(lats[i], lons[i]);
        }
        return depth;
    }

    private static void validateInput(List<PingRecord> pings, int sampleCountMax) {
        if (pings == null || pings.isEmpty()) {
            throw new EchogramException("No pings to process.");
        }
        if (sampleCountMax < 1) {
            throw new EchogramException("Invalid maximum sample count: " + sampleCountMax);
        }
        for (int i = 0; i < pings.size(); i++) {
            final PingRecord ping = pings.get(i);
            if (Double.isNaN(ping.getTimestamp()) || Double.isInfinite(ping.getTimestamp())) {
                throw new EchogramException(MessageFormat.format("Ping {0} has no valid time", i));
            }
        }
    }
}
