package org.esa.echogram.operator;

import org.esa.echogram.io.BottomLine;
import org.esa.echogram.sun.SolarState;

/**
 * Everything derived from one export: the regular echogram and the per-ping annotations.
 * The per-ping arrays are aligned to the original pings, not to the oversampled time axis.
 */
public class EchogramResult {

    private final EchogramGrid grid;
    private final double[] pingTimes;
    private final double[] latitudes;
    private final double[] longitudes;
    private final boolean[] day;
    private final SolarState[] solarStates;
    private final double[] estimatedBottom;
    private final double[] bottomDepth;
    private final BottomLine bottomLine;

    EchogramResult(EchogramGrid grid, double[] pingTimes, double[] latitudes, double[] longitudes, boolean[] day,
                   SolarState[] solarStates, double[] estimatedBottom, double[] bottomDepth, BottomLine bottomLine) {
        this.grid = grid;
        this.pingTimes = pingTimes;
        this.latitudes = latitudes;
        this.longitudes = longitudes;
        this.day = day;
        this.solarStates = solarStates;
        this.estimatedBottom = estimatedBottom;
        this.bottomDepth = bottomDepth;
        this.bottomLine = bottomLine;
    }

    public EchogramGrid getGrid() {
        return grid;
    }

    /**
     * @return the repaired ping times
     */
    public double[] getPingTimes() {
        return pingTimes;
    }

    public double[] getLatitudes() {
        return latitudes;
    }

    public double[] getLongitudes() {
        return longitudes;
    }

    public int getPingCount() {
        return pingTimes.length;
    }

    /**
     * @return one flag per ping, {@code true} for day
     */
    public boolean[] getDayFlags() {
        return day;
    }

    public SolarState[] getSolarStates() {
        return solarStates;
    }

    /**
     * @return the depth from the bathymetry grid per ping; all NaN if a bottom line exists or
     *         no bathymetry is available
     */
    public double[] getEstimatedBottom() {
        return estimatedBottom;
    }

    /**
     * @return the sea floor depth per ping: the bottom line point nearest in time if a bottom line
     *         exists, the bathymetry estimate otherwise
     */
    public double[] getBottomDepth() {
        return bottomDepth;
    }

    /**
     * @return the detected bottom line, or {@code null}
     */
    public BottomLine getBottomLine() {
        return bottomLine;
    }

    public boolean hasBottomLine() {
        return bottomLine != null;
    }
}
