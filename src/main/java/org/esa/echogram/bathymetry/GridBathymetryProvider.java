package org.esa.echogram.bathymetry;

import org.esa.echogram.EchogramException;
import org.esa.echogram.util.EchogramLogManager;

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

/**
 * Provides depth estimates from a bathymetry grid. A grid file is loaded on the first query
 * only and then kept; the provider is meant to be created once and shared by all files of a
 * batch.
 */
public class GridBathymetryProvider implements BathymetryProvider {

    private final File gridFile;
    private final BathymetryEstimator estimator;
    private BathymetryGrid grid;

    public GridBathymetryProvider(File gridFile) {
        this.gridFile = gridFile;
        this.estimator = new BathymetryEstimator();
    }

    public GridBathymetryProvider(BathymetryGrid grid) {
        this.gridFile = null;
        this.estimator = new BathymetryEstimator();
        this.grid = grid;
    }

    @Override
    public double estimateDepth(double lat, double lon) {
        return estimator.estimateDepth(getGrid(), lat, lon);
    }

    /**
     * @throws EchogramException if the grid file cannot be read
     */
    public BathymetryGrid getGrid() {
        if (grid == null) {
            final Logger logger = EchogramLogManager.getSystemLogger();
            logger.info("Loading bathymetry grid " + gridFile);
            try {
                grid = new EsriAsciiGridReader().read(gridFile);
            } catch (IOException e) {
                throw new EchogramException("Could not read bathymetry grid " + gridFile, e);
            }
            logger.fine(String.format("Bathymetry grid has %d x %d cells", grid.getLatCount(), grid.getLonCount()));
        }
        return grid;
    }
}
