package org.lsst.fits.converter;

import java.util.List;

/**
 * Receives results as a batch is converted, for example to drive a progress
 * bar or a log view.
 *
 * @author tonyj
 */
public interface ConversionListener {

    void converted(ConversionResult result, int index, int total);

    default void batchComplete(List<ConversionResult> results) {
    }
}
