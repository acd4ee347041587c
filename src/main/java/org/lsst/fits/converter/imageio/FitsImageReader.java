package org.lsst.fits.converter.imageio;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.stream.ImageInputStream;
import org.lsst.fits.converter.DisplayImage;
import org.lsst.fits.converter.FitsDecoder;
import org.lsst.fits.converter.Normalizer;
import org.lsst.fits.converter.RawData;
import org.lsst.fits.converter.adjust.AdjustmentSettings;
import org.lsst.fits.converter.adjust.ImageAdjuster;
import org.lsst.fits.converter.encode.ImageEncoder;

/**
 * ImageIO reader returning the primary image of a FITS file as an 8 bit
 * image. Source regions and subsampling are not supported.
 *
 * @author tonyj
 */
public class FitsImageReader extends ImageReader {

    private static final Logger LOG = Logger.getLogger(FitsImageReader.class.getName());

    private final FitsDecoder decoder = new FitsDecoder();
    private final Normalizer normalizer = new Normalizer();
    private final ImageAdjuster adjuster = new ImageAdjuster();
    private final ImageEncoder encoder = new ImageEncoder();
    private RawData<?> raw;

    public FitsImageReader(ImageReaderSpi originatingProvider) {
        super(originatingProvider);
    }

    @Override
    public void setInput(Object input, boolean seekForwardOnly, boolean ignoreMetadata) {
        super.setInput(input, seekForwardOnly, ignoreMetadata);
        raw = null;
    }

    @Override
    public void reset() {
        super.reset();
        raw = null;
    }

    @Override
    public FitsImageReadParam getDefaultReadParam() {
        return new FitsImageReadParam();
    }

    @Override
    public int getNumImages(boolean allowSearch) throws IOException {
        return 1;
    }

    @Override
    public int getWidth(int imageIndex) throws IOException {
        return Normalizer.displayGeometry(readRaw(imageIndex))[1];
    }

    @Override
    public int getHeight(int imageIndex) throws IOException {
        return Normalizer.displayGeometry(readRaw(imageIndex))[0];
    }

    @Override
    public Iterator<ImageTypeSpecifier> getImageTypes(int imageIndex) throws IOException {
        int channels = Normalizer.displayGeometry(readRaw(imageIndex))[2];
        // Only the layout matters, so describe it with a single pixel
        BufferedImage sample = encoder.toBufferedImage(new DisplayImage(1, 1, channels, new byte[channels]));
        return Collections.singleton(ImageTypeSpecifier.createFromRenderedImage(sample)).iterator();
    }

    @Override
    public IIOMetadata getStreamMetadata() throws IOException {
        return null;
    }

    @Override
    public IIOMetadata getImageMetadata(int imageIndex) throws IOException {
        return null;
    }

    @Override
    public BufferedImage read(int imageIndex, ImageReadParam param) throws IOException {
        boolean autoNormalise = true;
        AdjustmentSettings adjustments = AdjustmentSettings.IDENTITY;
        if (param instanceof FitsImageReadParam fitsParam) {
            autoNormalise = fitsParam.isAutoNormalise();
            adjustments = fitsParam.getAdjustments();
        }
        RawData<?> data = readRaw(imageIndex);
        LOG.log(Level.FINE, "read called autoNormalise={0} adjustments={1}", new Object[]{autoNormalise, adjustments});
        DisplayImage display = autoNormalise ? normalizer.normalize(data) : normalizer.coerce(data);
        return encoder.toBufferedImage(adjuster.adjust(display, adjustments));
    }

    private RawData<?> readRaw(int imageIndex) throws IOException {
        if (imageIndex != 0) {
            throw new IndexOutOfBoundsException("FITS reader only supports image 0, got " + imageIndex);
        }
        if (raw == null) {
            Object input = getInput();
            if (!(input instanceof ImageInputStream)) {
                throw new IllegalStateException("Input not set");
            }
            ImageInputStream in = (ImageInputStream) input;
            raw = decoder.decode(new ByteArrayInputStream(readFully(in)), "image input stream");
        }
        return raw;
    }

    private static byte[] readFully(ImageInputStream in) throws IOException {
        in.seek(0);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        for (;;) {
            int n = in.read(buffer);
            if (n < 0) {
                break;
            }
            out.write(buffer, 0, n);
        }
        return out.toByteArray();
    }
}
