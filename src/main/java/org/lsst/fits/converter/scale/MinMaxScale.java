package org.lsst.fits.converter.scale;

import java.util.logging.Logger;
import org.lsst.fits.converter.RawData;

/**
 * Scale covering the full range of the data. NaN and infinite samples (FITS
 * blank pixels) are ignored, data with no finite samples gives {0, 0}.
 *
 * @author tonyj
 */
public class MinMaxScale implements ScaleCalculator {

    private static final Logger LOG = Logger.getLogger(MinMaxScale.class.getName());

    @Override
    public double[] computeScale(RawData<?> data) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int n = data.getSampleCount();
        for (int i = 0; i < n; i++) {
            double value = data.getValue(i);
            if (!Double.isFinite(value)) {
                continue;
            }
            if (value < min) {
                min = value;
            }
            if (value > max) {
                max = value;
            }
        }
        if (min > max) {
            LOG.fine(() -> String.format("No finite samples in %s", data));
            return new double[]{0, 0};
        }
        final double lo = min;
        final double hi = max;
        LOG.fine(() -> String.format("min=%g max=%g", lo, hi));
        return new double[]{lo, hi};
    }
}
