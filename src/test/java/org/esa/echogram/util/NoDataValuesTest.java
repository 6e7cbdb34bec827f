package org.esa.echogram.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class NoDataValuesTest {

    @Test
    public void testNormalizeMapsAllEncodingsToOneMarker() throws Exception {
        final double[] samples = {-65.0, 0.0, -9.9E37, -999.0, Double.NaN, Double.NEGATIVE_INFINITY, -34.5};

        final int count = NoDataValues.normalize(samples);

        assertEquals(5, count);
        assertEquals(-65.0, samples[0], 0.0);
        assertEquals(-34.5, samples[6], 0.0);
        for (int i = 1; i < 6; i++) {
            assertTrue(NoDataValues.isNoData(samples[i]));
        }
    }
}
