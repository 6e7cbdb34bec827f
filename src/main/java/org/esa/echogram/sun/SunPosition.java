package org.esa.echogram.sun;

/**
 * Instantaneous position of the sun seen from an observer.
 */
public final class SunPosition {

    private final double declination;   /* deg */
    private final double altitude;      /* deg, negative below the horizon */
    private final double azimuth;       /* deg, [0, 360) */
    private final double radiation;     /* W m-2, top of atmosphere, normalised with sin(altitude) */
    private final double rho;           /* sun-earth distance ratio series */

    SunPosition(double declination, double altitude, double azimuth, double radiation, double rho) {
        this.declination = declination;
        this.altitude = altitude;
        this.azimuth = azimuth;
        this.radiation = radiation;
        this.rho = rho;
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

    public double getRho() {
        return rho;
    }

    public boolean isBelowHorizon() {
        return Math.abs(radiation) <= SolarEphemeris.NIGHT_RADIATION_THRESHOLD;
    }
}
