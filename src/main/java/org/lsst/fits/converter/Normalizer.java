package org.lsst.fits.converter;

import java.util.logging.Logger;
import org.lsst.fits.converter.ConversionException.Failure;
import org.lsst.fits.converter.scale.MinMaxScale;
import org.lsst.fits.converter.scale.ScaleCalculator;

/**
 * Turns raw FITS data into an 8 bit display image, either by a linear
 * stretch of the data range onto 0..255 or by a plain cast.
 * <p>
 * A 2 dimensional array becomes a single channel image, a 3 dimensional array
 * an image whose channel count is the size of the last axis. Anything else is
 * rejected.
 *
 * @author tonyj
 */
public class Normalizer {

    private static final Logger LOG = Logger.getLogger(Normalizer.class.getName());

    private final ScaleCalculator scaleCalculator;

    public Normalizer() {
        this(new MinMaxScale());
    }

    public Normalizer(ScaleCalculator scaleCalculator) {
        this.scaleCalculator = scaleCalculator;
    }

    /**
     * Linear stretch of the data. The low end of the scale maps to 0, the high
     * end to exactly 255, fractional results in between are truncated. Constant
     * data maps to all zeros. Non finite samples map to 0.
     *
     * @param raw The raw data
     * @return The display image
     * @throws ConversionException If the data is not 2 or 3 dimensional
     */
    public DisplayImage normalize(RawData<?> raw) throws ConversionException {
        int[] geometry = displayGeometry(raw);
        double[] scale = scaleCalculator.computeScale(raw);
        double lo = scale[0];
        double hi = scale[1];
        double range = hi - lo;
        int n = raw.getSampleCount();
        byte[] out = new byte[n];
        if (range > 0) {
            // A range wider than Double.MAX_VALUE is stretched on halved values
            boolean halved = Double.isInfinite(range);
            double halfRange = hi / 2 - lo / 2;
            for (int i = 0; i < n; i++) {
                double value = raw.getValue(i);
                if (!Double.isFinite(value)) {
                    continue;
                }
                if (value >= hi) {
                    out[i] = (byte) 255;
                } else if (halved) {
                    out[i] = (byte) clip((value / 2 - lo / 2) / halfRange * 255);
                } else {
                    out[i] = (byte) clip((value - lo) * 255 / range);
                }
            }
        } else {
            LOG.fine(() -> String.format("Constant data in %s, skipping scaling", raw));
        }
        return new DisplayImage(geometry[1], geometry[0], geometry[2], out);
    }

    /**
     * Conversion used when normalization is switched off. Each value is
     * truncated toward zero and then clipped to 0..255, NaN maps to 0.
     * Unsigned 8 bit data is passed through unchanged.
     *
     * @param raw The raw data
     * @return The display image
     * @throws ConversionException If the data is not 2 or 3 dimensional
     */
    public DisplayImage coerce(RawData<?> raw) throws ConversionException {
        int[] geometry = displayGeometry(raw);
        int n = raw.getSampleCount();
        byte[] out = new byte[n];
        for (int i = 0; i < n; i++) {
            out[i] = (byte) clip(raw.getValue(i));
        }
        return new DisplayImage(geometry[1], geometry[0], geometry[2], out);
    }

    private static int clip(double value) {
        if (!(value > 0)) {
            return 0;
        } else if (value >= 255) {
            return 255;
        } else {
            return (int) value;
        }
    }

    /**
     * The display geometry of the data, without reading any samples.
     *
     * @param raw The raw data
     * @return {height, width, channels}
     * @throws ConversionException If the data is not 2 or 3 dimensional
     */
    public static int[] displayGeometry(RawData<?> raw) throws ConversionException {
        int[] shape = raw.getShape();
        return switch (shape.length) {
            case 2 ->
                new int[]{shape[0], shape[1], 1};
            case 3 ->
                new int[]{shape[0], shape[1], shape[2]};
            default ->
                throw new ConversionException(Failure.UNSUPPORTED_DIMENSIONALITY, String.format("Cannot display %d dimensional data", shape.length));
        };
    }
}
