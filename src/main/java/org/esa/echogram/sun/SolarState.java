package org.esa.echogram.sun;

/**
 * Sun related values for one ping: sunrise and sunset of the ping's day and the sun position at
 * the ping time. All values are NaN if the ping has no valid position.
 */
public final class SolarState {

    static final SolarState UNDEFINED = new SolarState(Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                                                       Double.NaN, Double.NaN);

    private final double sunrise;
    private final double sunset;
    private final double declination;
    private final double altitude;
    private final double azimuth;
    private final double radiation;

    SolarState(double sunrise, double sunset, double declination, double altitude, double azimuth,
               double radiation) {
        this.sunrise = sunrise;
        this.sunset = sunset;
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

    public double getDeclination() {
        return declination;
    }

    public double getAltitude() {
        return altitude;
    }

    public double getAzimuth() {
        return azimuth;
    }

    public double getRadiation() {
        return radiation;
    }

    public boolean isDefined() {
        return !Double.isNaN(sunrise);
    }
}
