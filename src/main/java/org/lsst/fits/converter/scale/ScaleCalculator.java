package org.lsst.fits.converter.scale;

import org.lsst.fits.converter.RawData;

/**
 * Computes the range of raw values which is mapped onto the display range.
 *
 * @author tonyj
 */
public interface ScaleCalculator {

    /**
     * @param data The raw data
     * @return A two element array {low, high}
     */
    double[] computeScale(RawData<?> data);
}
