package org.esa.echogram.sun;

import org.esa.echogram.PingRecord;
import org.esa.echogram.util.PingTime;

import java.util.List;

/**
 * Classifies pings as day or night by comparing the GMT hour of each ping with the sunrise and
 * sunset of its day.
 */
public class DayNightClassifier {

    private final SolarEphemeris ephemeris;
    private final int stepCount;

    public DayNightClassifier(SolarEphemeris ephemeris, int stepCount) {
        this.ephemeris = ephemeris;
        this.stepCount = stepCount;
    }

    /**
     * @return one solar state per ping
     */
    public SolarState[] computeSolarStates(List<PingRecord> pings) {
        final SolarState[] states = new SolarState[pings.size()];
        for (int i = 0; i < states.length; i++) {
            states[i] = ephemeris.computeSolarState(pings.get(i), stepCount);
        }
        return states;
    }

    /**
     * @return one flag per ping, {@code true} for day; pings with an undefined solar state are night
     */
    public boolean[] classify(List<PingRecord> pings, SolarState[] states) {
        final boolean[] day = new boolean[pings.size()];
        for (int i = 0; i < day.length; i++) {
            final double hour = PingTime.hourOfDay(pings.get(i).getTimestamp());
            day[i] = isDay(hour, states[i].getSunrise(), states[i].getSunset());
        }
        return day;
    }

    /**
     * Decides whether the GMT hour lies between sunrise and sunset.
     * <p>
     * At longitudes where sunset (GMT) falls before sunrise (GMT), the day wraps around midnight
     * GMT; the comparison is inverted for that case.
     *
     * @param hour    GMT hour in [0, 24)
     * @param sunrise GMT hour, 0 for polar day, 24 for polar night
     * @param sunset  GMT hour, 24 for polar day, 0 for polar night
     */
    public static boolean isDay(double hour, double sunrise, double sunset) {
        if (Double.isNaN(sunrise) || Double.isNaN(sunset)) {
            return false;
        }
        if (sunrise == SunCycle.POLAR_DAY[0] && sunset == SunCycle.POLAR_DAY[1]) {
            return true;
        }
        if (sunrise == SunCycle.POLAR_NIGHT[0] && sunset == SunCycle.POLAR_NIGHT[1]) {
            return false;
        }
        final boolean between = Math.min(sunrise, sunset) < hour && hour < Math.max(sunrise, sunset);
        return between ^ (sunrise > sunset);
    }
}
