package org.lsst.fits.converter;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.converter.adjust.ImageAdjuster;
import org.lsst.fits.converter.encode.ImageEncoder;

/**
 * Converts FITS files to raster images: decode the primary HDU, normalize it to
 * 8 bits, apply the requested adjustments and write the result beside the
 * source.
 * <p>
 * Every file is converted independently. Any failure is reported as a
 * {@link ConversionResult} for that file and never stops the rest of a batch.
 *
 * @author tonyj
 */
public class FitsConverter {

    private static final Logger LOG = Logger.getLogger(FitsConverter.class.getName());

    private final FitsDecoder decoder;
    private final Normalizer normalizer;
    private final ImageAdjuster adjuster;
    private final ImageEncoder encoder;

    public FitsConverter() {
        this(new FitsDecoder(), new Normalizer(), new ImageAdjuster(), new ImageEncoder());
    }

    public FitsConverter(FitsDecoder decoder, Normalizer normalizer, ImageAdjuster adjuster, ImageEncoder encoder) {
        this.decoder = decoder;
        this.normalizer = normalizer;
        this.adjuster = adjuster;
        this.encoder = encoder;
    }

    public ConversionResult convert(ConversionRequest request) {
        File source = request.getSource();
        try {
            DisplayImage image = render(request);
            File output = ImageEncoder.outputFile(source, request.getOutputFormat());
            Timed.execute(() -> encoder.write(image, request.getOutputFormat(), output), "Writing %s took %dms", output);
            LOG.log(Level.INFO, "Converted {0} to {1}", new Object[]{source, output});
            return ConversionResult.success(source, output);
        } catch (ConversionException x) {
            LOG.log(Level.WARNING, x, () -> String.format("Conversion of %s failed: %s", source, x.getFailure()));
            return ConversionResult.failure(source, x.getFailure(), x.getMessage());
        } catch (RuntimeException x) {
            // Reading wraps its own errors, anything left came from adjusting or encoding
            LOG.log(Level.WARNING, x, () -> String.format("Unexpected error converting %s", source));
            return ConversionResult.failure(source, ConversionException.Failure.ENCODING_ERROR, "Unexpected error: " + x);
        }
    }

    public List<ConversionResult> convert(List<ConversionRequest> requests) {
        return convert(requests, null);
    }

    /**
     * Convert a batch of files one after the other, in the order given.
     *
     * @param requests The files to convert
     * @param listener Notified after each file and once the batch is done, may
     * be <code>null</code>
     * @return One result per request, in request order
     */
    public List<ConversionResult> convert(List<ConversionRequest> requests, ConversionListener listener) {
        List<ConversionResult> results = new ArrayList<>(requests.size());
        for (ConversionRequest request : requests) {
            ConversionResult result = convert(request);
            results.add(result);
            if (listener != null) {
                try {
                    listener.converted(result, results.size() - 1, requests.size());
                } catch (RuntimeException x) {
                    LOG.log(Level.WARNING, x, () -> String.format("Listener failed for %s", result.getSource()));
                }
            }
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        LOG.log(Level.INFO, "Converted {0} files, {1} failed", new Object[]{results.size() - failed, failed});
        if (listener != null) {
            try {
                listener.batchComplete(results);
            } catch (RuntimeException x) {
                LOG.log(Level.WARNING, "Listener failed at end of batch", x);
            }
        }
        return results;
    }

    /**
     * Decode, normalize and adjust a file without writing anything.
     *
     * @param request The request, its output format is ignored
     * @return The adjusted image
     * @throws ConversionException If the file cannot be decoded or displayed
     */
    public DisplayImage render(ConversionRequest request) throws ConversionException {
        DisplayImage image = prepare(request.getSource(), request.isAutoNormalise());
        return adjuster.adjust(image, request.getSettings());
    }

    /**
     * Decode a file and bring it to display range, before any adjustment.
     *
     * @param source The FITS file
     * @param autoNormalise Stretch the data range onto 0..255, otherwise cast
     * @return The display image
     * @throws ConversionException If the file cannot be decoded or displayed
     */
    public DisplayImage prepare(File source, boolean autoNormalise) throws ConversionException {
        try {
            RawData<?> raw = Timed.execute(() -> decoder.decode(source), "Decoding %s took %dms", source.getName());
            return autoNormalise ? normalizer.normalize(raw) : normalizer.coerce(raw);
        } catch (RuntimeException x) {
            throw new ConversionException(ConversionException.Failure.UNREADABLE_CONTAINER, "Unexpected error reading " + source + ": " + x, x);
        }
    }

    ImageEncoder getEncoder() {
        return encoder;
    }

    ImageAdjuster getAdjuster() {
        return adjuster;
    }
}
