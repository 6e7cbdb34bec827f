package org.esa.echogram.bathymetry;

/**
 * Source of seafloor depth estimates for positions without a detected bottom.
 */
public interface BathymetryProvider {

    /**
     * @param lat latitude in deg
     * @param lon longitude in deg
     * @return the estimated depth in m (positive), or NaN if unknown
     */
    double estimateDepth(double lat, double lon);
}
