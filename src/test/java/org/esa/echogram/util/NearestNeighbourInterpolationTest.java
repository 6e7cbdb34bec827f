package org.esa.echogram.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class NearestNeighbourInterpolationTest {

    @Test
    public void testInterpolateOnIdenticalAxisReturnsSourceValues() throws Exception {
        final double[] x = AxisUtils.linspace(3.0, 17.0, 29);
        final double[] y = new double[x.length];
        for (int i = 0; i < y.length; i++) {
            y[i] = -80.0 + 0.37 * i;
        }
        y[5] = NoDataValues.NO_DATA;

        final double[] yi = NearestNeighbourInterpolation.interpolate(x, y, x.clone());

        assertArrayEquals(y, yi, 0.0);
        assertTrue(Double.isNaN(yi[5]));
    }

    @Test
    public void testInterpolateExtrapolatesWithEndpointValues() throws Exception {
        final double[] x = {1.0, 2.0, 3.0};
        final double[] y = {-50.0, -60.0, -70.0};

        final double[] yi = NearestNeighbourInterpolation.interpolate(x, y, new double[]{-5.0, 0.9, 3.1, 100.0});

        assertArrayEquals(new double[]{-50.0, -50.0, -70.0, -70.0}, yi, 0.0);
    }

    @Test
    public void testTieGoesToUpperNeighbour() throws Exception {
        final double[] sorted = {0.0, 1.0, 2.0};
        assertEquals(1, NearestNeighbourInterpolation.nearest(sorted, 0.5));
        assertEquals(2, NearestNeighbourInterpolation.nearest(sorted, 1.5));
        assertEquals(0, NearestNeighbourInterpolation.nearest(sorted, 0.49));
    }

    @Test
    public void testUnsortedAxisIsSortedBeforeLookup() throws Exception {
        final double[] x = {3.0, 1.0, 2.0};
        final double[] y = {30.0, 10.0, 20.0};

        final double[] yi = NearestNeighbourInterpolation.interpolate(x, y, new double[]{0.0, 1.1, 2.2, 2.9});

        assertArrayEquals(new double[]{10.0, 10.0, 20.0, 30.0}, yi, 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInterpolateRejectsLengthMismatch() throws Exception {
        NearestNeighbourInterpolation.interpolate(new double[]{1.0, 2.0}, new double[]{1.0}, new double[]{1.5});
    }
}
