package org.esa.echogram.sun;

import org.esa.echogram.PingRecord;
import org.esa.echogram.util.PingTime;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.apache.commons.math3.util.FastMath.*;

/**
 * Reduced accuracy solar ephemeris, valid for the years 1800-2100.
 * <p>
 * The expressions are those of Appendix E of the 1978 edition of the Almanac for Computers
 * (Nautical Almanac Office, U.S. Naval Observatory). The solar declination computed from them is
 * accurate to at least 1'. The solar constant of 1368 W m-2 is the mean of the satellite
 * measurements over the sunspot cycle 1979-1995 (Coffey et al. 1995).
 * <p>
 * Instances are stateless and may be shared.
 */
public class SolarEphemeris {

    public static final double SOLAR_CONSTANT = 1368.0;

    /**
     * Number of steps used to sample one day: 30 second intervals.
     */
    public static final int DEFAULT_STEP_COUNT = 2880;

    static final double NIGHT_RADIATION_THRESHOLD = 1.0E-10;

    private static final double J1900 = 2415020.0;
    private static final double DAYS_PER_CENTURY = 36525.0;

    /**
     * @param lat      latitude in deg
     * @param lon      longitude in deg, any range
     * @param dateTime the time, GMT
     * @return the position of the sun
     */
    public SunPosition computeSunPosition(double lat, double lon, LocalDateTime dateTime) {
        final double ut = dateTime.getHour() + dateTime.getMinute() / 60.0
                          + (dateTime.getSecond() + dateTime.getNano() * 1.0E-9) / 3600.0;
        return computeSunPosition(lat, normalizeLongitude(lon), dateTime.getYear(), dateTime.getMonthValue(),
                                  dateTime.getDayOfMonth(), ut);
    }

    /**
     * Samples one day with {@link #DEFAULT_STEP_COUNT} steps.
     *
     * @see #computeSunCycle(double, double, LocalDate, int)
     */
    public SunCycle computeSunCycle(double lat, double lon, LocalDate date) {
        return computeSunCycle(lat, lon, date, DEFAULT_STEP_COUNT);
    }

    /**
     * Samples the course of the sun over one day and derives sunrise and sunset.
     * <p>
     * The samples start at local midnight, i.e. GMT midnight shifted by {@code -lon/360} days. A
     * sample is night if the radiation vanishes. Sunrise is half a step after the last night
     * sample at the start of the day, sunset half a step before the first night sample at the
     * end of the day.
     *
     * @param lat       latitude in deg
     * @param lon       longitude in deg, any range
     * @param date      the calendar day
     * @param stepCount the number of samples, at least 1
     * @return the sun cycle
     */
    public SunCycle computeSunCycle(double lat, double lon, LocalDate date, int stepCount) {
        if (stepCount < 1) {
            throw new IllegalArgumentException("stepCount < 1");
        }
        final double normLon = normalizeLongitude(lon);
        final double dt = 1.0 / stepCount;
        final double startOfDay = PingTime.toDays(date);
        final double startOfYear = PingTime.toDays(date.withDayOfYear(1));

        final double[] times = new double[stepCount];
        final double[] dayOfYear = new double[stepCount];
        final double[] declination = new double[stepCount];
        final double[] altitude = new double[stepCount];
        final double[] azimuth = new double[stepCount];
        final double[] radiation = new double[stepCount];
        final boolean[] night = new boolean[stepCount];
        int nightCount = 0;
        for (int i = 0; i < stepCount; i++) {
            times[i] = startOfDay + dt * i - normLon / 360.0;
            dayOfYear[i] = times[i] - startOfYear;
            final SunPosition position = computeSunPosition(lat, normLon, PingTime.toDateTime(times[i]));
            declination[i] = position.getDeclination();
            altitude[i] = position.getAltitude();
            azimuth[i] = position.getAzimuth();
            radiation[i] = position.getRadiation();
            night[i] = position.isBelowHorizon();
            if (night[i]) {
                nightCount++;
            }
        }

        final double sunrise;
        final double sunset;
        if (nightCount == stepCount) {
            sunrise = SunCycle.POLAR_NIGHT[0];
            sunset = SunCycle.POLAR_NIGHT[1];
        } else if (nightCount == 0) {
            sunrise = SunCycle.POLAR_DAY[0];
            sunset = SunCycle.POLAR_DAY[1];
        } else {
            int leading = 0;
            while (leading < stepCount && night[leading]) {
                leading++;
            }
            int trailing = 0;
            while (trailing < stepCount && night[stepCount - 1 - trailing]) {
                trailing++;
            }
            // 1-based positions of the last leading and the first trailing night sample
            final int riseIndex = clamp(leading, 1, stepCount);
            final int setIndex = clamp(stepCount - trailing + 1, 1, stepCount);
            sunrise = PingTime.hourOfDay(times[riseIndex - 1]) + 24.0 * dt / 2.0;
            sunset = PingTime.hourOfDay(times[setIndex - 1]) - 24.0 * dt / 2.0;
        }
        return new SunCycle(sunrise, sunset, dayOfYear, declination, altitude, azimuth, radiation);
    }

    /**
     * Computes sunrise, sunset and sun position for a ping. Pings without a valid position get
     * an undefined state.
     */
    public SolarState computeSolarState(PingRecord ping, int stepCount) {
        if (!ping.hasValidPosition()) {
            return SolarState.UNDEFINED;
        }
        final double lat = ping.getLatitude();
        final double lon = ping.getLongitude();
        final double time = ping.getTimestamp();
        final SunCycle cycle = computeSunCycle(lat, lon, PingTime.toDate(time), stepCount);
        final SunPosition position = computeSunPosition(lat, lon, PingTime.toDateTime(time));
        return new SolarState(cycle.getSunrise(), cycle.getSunset(), position.getDeclination(),
                              position.getAltitude(), position.getAzimuth(), position.getRadiation());
    }

    /**
     * @return the longitude in [-180, 180)
     */
    static double normalizeLongitude(double lon) {
        return lon - 360.0 * floor((lon + 180.0) / 360.0);
    }

    private static SunPosition computeSunPosition(double lat, double lon, int year, int month, int day,
                                                  double ut) {
        /* Julian ephemeris date in days (day 1 is 1 Jan 4713 B.C. = -4712 Jan 1) */
        final long dayNumber = 367L * year - (7L * (year + (month + 9) / 12)) / 4 + (275L * month) / 9 + day
                               + 1721013L;
        final double jd = dayNumber + ut / 24.0;

        /* interval in Julian centuries since 1900 */
        final double t = (jd - J1900) / DAYS_PER_CENTURY;

        /* mean anomaly and mean longitude of the sun */
        final double g = toRadians(reduce(358.475833 + 35999.049750 * t - 0.000150 * t * t));
        final double l = toRadians(reduce(279.696678 + 36000.768920 * t + 0.000303 * t * t));
        /* mean anomalies of Jupiter and Venus */
        final double jp = toRadians(reduce(225.444651 + 3034.906654 * t));
        final double vn = toRadians(reduce(212.603219 + 58517.803875 * t + 0.001286 * t * t));
        /* longitude of the ascending node of the moon's orbit */
        final double nm = toRadians(reduce(259.183275 - 1934.142008 * t + 0.002078 * t * t) + 360.0);

        final double theta = 0.397930 * sin(l) - 0.000040 * cos(l)
                             + 0.009999 * sin(g - l) + 0.003334 * sin(g + l)
                             + 0.000042 * sin(2 * g + l) - 0.000014 * sin(2 * g - l)
                             - 0.000030 * t * sin(g - l) - 0.000010 * t * sin(g + l)
                             - 0.000208 * t * sin(l) - 0.000039 * sin(nm - l)
                             - 0.000010 * cos(g - l - jp);

        final double rho = 1.000421 - 0.033503 * cos(g) - 0.000140 * cos(2 * g)
                           + 0.000084 * t * cos(g) - 0.000033 * sin(g - jp) + 0.000027 * sin(2 * g - 2 * vn);

        final double sinDec = theta / sqrt(rho);

        /* equation of time in hours */
        final double e = toRadians(reduce(276.697 + (0.98564734 * DAYS_PER_CENTURY) * t));
        final double eqt = (-97.8 * sin(e) - 431.3 * cos(e)
                            + 596.6 * sin(2 * e) - 1.9 * cos(2 * e)
                            + 4.0 * sin(3 * e) + 19.3 * cos(3 * e) - 12.7 * sin(4 * e)) / 3600.0;

        /* local hour angle */
        final double lha = toRadians(15.0 * (eqt + ut - 12.0) + lon);
        final double latRad = toRadians(lat);

        final double sinAlt = sin(latRad) * sinDec + cos(latRad) * sqrt(1.0 - sinDec * sinDec) * cos(lha);

        /* radiation outside the atmosphere */
        final double radiation = sinAlt > 0.0 ? (SOLAR_CONSTANT / rho) * sinAlt : 0.0;

        final double dec = asin(sinDec);
        final double alt = asin(sinAlt);

        // 0: hour angle in [0, 180), 1: in [180, 360)
        final long halfDay = floorMod((long) floor(lha / PI), 2L);
        double azm = toDegrees(atan(sin(lha) / (sin(latRad) * cos(lha) - cos(latRad) * tan(dec))));
        azm = azm + 180.0 * (1 - halfDay) + (azm < 0.0 ? 180.0 : 0.0);
        azm = azm - 360.0 * floor(azm / 360.0);

        return new SunPosition(toDegrees(dec), toDegrees(alt), azm, radiation, rho);
    }

    // x - 360 * fix(x / 360)
    private static double reduce(double degrees) {
        final double turns = degrees / 360.0;
        return degrees - 360.0 * (turns < 0.0 ? ceil(turns) : floor(turns));
    }

    private static int clamp(int value, int min, int max) {
        return value < min ? min : (value > max ? max : value);
    }
}
