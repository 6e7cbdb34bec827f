package org.esa.echogram.bathymetry;

import org.junit.Test;

import static org.junit.Assert.*;

public class BathymetryGridTest {

    @Test
    public void testPublicConstructorCopiesArrays() throws Exception {
        final double[] lats = {42.0, 41.0};
        final double[][] elevation = {{-100.0, -110.0}, {-200.0, -210.0}};

        final BathymetryGrid grid = new BathymetryGrid(lats, new double[]{-72.0, -71.0}, elevation);
        elevation[0][1] = 5.0;
        lats[0] = 0.0;

        assertEquals(-110.0, grid.getElevation(0, 1), 0.0);
        assertEquals(42.0, grid.getLat(0), 0.0);
    }

    @Test
    public void testWrappedGridSharesRows() throws Exception {
        final double[][] elevation = {{-100.0, -110.0}, {-200.0, -210.0}};

        final BathymetryGrid grid = BathymetryGrid.wrap(new double[]{42.0, 41.0}, new double[]{-72.0, -71.0},
                                                        elevation);
        elevation[1][0] = -250.0;

        assertEquals(-250.0, grid.getElevation(1, 0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrapRejectsRaggedRows() throws Exception {
        BathymetryGrid.wrap(new double[]{42.0, 41.0}, new double[]{-72.0, -71.0},
                            new double[][]{{-100.0, -110.0}, {-200.0}});
    }
}
