package org.lsst.fits.converter.imageio;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import javax.imageio.ImageReader;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.stream.ImageInputStream;

/**
 * Makes FITS files readable through {@link javax.imageio.ImageIO}.
 *
 * @author tonyj
 */
public class FitsImageReaderSpi extends ImageReaderSpi {

    private static final byte[] SIGNATURE = "SIMPLE  =".getBytes(StandardCharsets.US_ASCII);

    public FitsImageReaderSpi() {
        super("LSST", "1.0-SNAPSHOT", new String[]{"fits", "FITS"}, new String[]{"fits", "fit", "fts"}, new String[]{"image/fits", "application/fits"},
                FitsImageReader.class.getName(),
                new Class[]{ImageInputStream.class}, null, false, null, null, null, null, false,
                null, null, null, null);
    }

    @Override
    public boolean canDecodeInput(Object source) throws IOException {
        if (!(source instanceof ImageInputStream)) {
            return false;
        }
        ImageInputStream in = (ImageInputStream) source;
        byte[] header = new byte[SIGNATURE.length];
        in.mark();
        try {
            in.readFully(header);
        } catch (IOException x) {
            // Too short to be a FITS file
            return false;
        } finally {
            in.reset();
        }
        return Arrays.equals(header, SIGNATURE);
    }

    @Override
    public ImageReader createReaderInstance(Object extension) throws IOException {
        return new FitsImageReader(this);
    }

    @Override
    public String getDescription(Locale locale) {
        return "FITS Primary Image";
    }
}
