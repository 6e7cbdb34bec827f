package org.esa.echogram.sun;

import org.junit.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.Assert.*;

public class SolarEphemerisTest {

    private final SolarEphemeris ephemeris = new SolarEphemeris();

    @Test
    public void testPolarDayAndNight() throws Exception {
        final LocalDate june = LocalDate.of(2015, 6, 21);
        final LocalDate december = LocalDate.of(2015, 12, 21);

        assertPolarDay(ephemeris.computeSunCycle(80.0, 15.0, june));
        assertPolarNight(ephemeris.computeSunCycle(80.0, 15.0, december));
        assertPolarNight(ephemeris.computeSunCycle(-80.0, -60.0, june));
        assertPolarDay(ephemeris.computeSunCycle(-80.0, -60.0, december));
    }

    @Test
    public void testEquinoxAtGreenwichEquator() throws Exception {
        final SunCycle cycle = ephemeris.computeSunCycle(0.0, 0.0, LocalDate.of(2015, 3, 21));

        assertEquals(6.1, cycle.getSunrise(), 0.25);
        assertEquals(18.1, cycle.getSunset(), 0.25);
        assertFalse(cycle.isPolarDay());
        assertFalse(cycle.isPolarNight());
        assertEquals(SolarEphemeris.DEFAULT_STEP_COUNT, cycle.getStepCount());
        assertEquals(79.0, cycle.getDayOfYear()[0], 1.0e-6);
    }

    @Test
    public void testSunsetBeforeSunriseInGmtFarEast() throws Exception {
        final SunCycle cycle = ephemeris.computeSunCycle(-33.9, 151.2, LocalDate.of(2015, 3, 21));

        assertTrue(cycle.getSunrise() > cycle.getSunset());
        assertEquals(20.0, cycle.getSunrise(), 0.5);
        assertEquals(8.0, cycle.getSunset(), 0.5);
    }

    @Test
    public void testSunPositionAtJuneSolsticeNoon() throws Exception {
        final SunPosition position = ephemeris.computeSunPosition(23.44, 0.0, LocalDateTime.of(2015, 6, 21, 12, 2));

        assertEquals(23.44, position.getDeclination(), 0.05);
        assertEquals(90.0, position.getAltitude(), 0.5);
        assertEquals(SolarEphemeris.SOLAR_CONSTANT / position.getRho(), position.getRadiation(), 1.0);
        assertFalse(position.isBelowHorizon());
    }

    @Test
    public void testSunPositionAtNight() throws Exception {
        final SunPosition position = ephemeris.computeSunPosition(45.0, 0.0, LocalDateTime.of(2015, 6, 21, 0, 0));

        assertTrue(position.getAltitude() < 0.0);
        assertEquals(0.0, position.getRadiation(), 0.0);
        assertTrue(position.isBelowHorizon());
        assertTrue(position.getAzimuth() >= 0.0 && position.getAzimuth() < 360.0);
    }

    @Test
    public void testAzimuthFollowsTheSun() throws Exception {
        final LocalDate day = LocalDate.of(2015, 3, 21);
        final double morning = ephemeris.computeSunPosition(45.0, 0.0, day.atTime(9, 0)).getAzimuth();
        final double afternoon = ephemeris.computeSunPosition(45.0, 0.0, day.atTime(15, 0)).getAzimuth();

        assertTrue("morning azimuth " + morning, morning > 90.0 && morning < 180.0);
        assertTrue("afternoon azimuth " + afternoon, afternoon > 180.0 && afternoon < 270.0);
    }

    @Test
    public void testNormalizeLongitude() throws Exception {
        assertEquals(-170.0, SolarEphemeris.normalizeLongitude(190.0), 1.0e-12);
        assertEquals(-180.0, SolarEphemeris.normalizeLongitude(180.0), 1.0e-12);
        assertEquals(10.0, SolarEphemeris.normalizeLongitude(-350.0), 1.0e-12);
        assertEquals(-70.7, SolarEphemeris.normalizeLongitude(-70.7), 1.0e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStepCountMustBePositive() throws Exception {
        ephemeris.computeSunCycle(0.0, 0.0, LocalDate.of(2015, 3, 21), 0);
    }

    private static void assertPolarDay(SunCycle cycle) {
        assertEquals(0.0, cycle.getSunrise(), 0.0);
        assertEquals(24.0, cycle.getSunset(), 0.0);
        assertTrue(cycle.isPolarDay());
    }

    private static void assertPolarNight(SunCycle cycle) {
        assertEquals(24.0, cycle.getSunrise(), 0.0);
        assertEquals(0.0, cycle.getSunset(), 0.0);
        assertTrue(cycle.isPolarNight());
    }
}
