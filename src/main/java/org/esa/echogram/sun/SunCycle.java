package org.esa.echogram.sun;

/**
 * The course of the sun over one calendar day, sampled in equal steps.
 * <p>
 * Sunrise and sunset are decimal hours GMT. The special pairs {@code [0, 24]} and
 * {@code [24, 0]} denote polar day and polar night.
 */
public final class SunCycle {

    public static final double[] POLAR_DAY = {0.0, 24.0};
    public static final double[] POLAR_NIGHT = {24.0, 0.0};

    private final double sunrise;
    private final double sunset;
    private final double[] dayOfYear;
    private final double[] declination;
    private final double[] altitude;
    private final double[] azimuth;
    private final double[] radiation;

    SunCycle(double sunrise, double sunset, double[] dayOfYear, double[] declination, double[] altitude,
             double[] azimuth, double[] radiation) {
        this.sunrise = sunrise;
        this.sunset = sunset;
        this.dayOfYear = dayOfYear;
        this.declination = declination;
        this.altitude = altitude;
        this.azimuth = azimuth;
        this.radiation = radiation;
    }

    public double getSunrise() {
        return sunrise;
    }

    public double getSunset() {
        return sunset;
    }

    public boolean isPolarDay() {
        return sunrise == POLAR_DAY[0] && sunset == POLAR_DAY[1];
    }

    public boolean isPolarNight() {
        return sunrise == POLAR_NIGHT[0] && sunset == POLAR_NIGHT[1];
    }

    public int getStepCount() {
        return dayOfYear.length;
    }

    /**
     * @return decimal day since January 1st of the year, one value per step
     */
    public double[] getDayOfYear() {
        return dayOfYear;
    }

    public double[] getDeclination() {
        return declination;
    }

    public double[] getAltitude() {
        return altitude;
    }

    public double[] getAzimuth() {
        return azimuth;
    }

    public double[] getRadiation() {
        return radiation;
    }
}
