package org.lsst.fits.converter;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.Buffer;
import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;
import java.util.Arrays;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import nom.tam.fits.header.Standard;
import nom.tam.util.ArrayFuncs;
import org.lsst.fits.converter.ConversionException.Failure;

/**
 * Reads the pixel array of the primary HDU of a FITS file. Only the primary
 * HDU is looked at, extensions are ignored. The file is closed before any of
 * the decode methods return.
 *
 * @author tonyj
 */
public class FitsDecoder {

    private static final Logger LOG = Logger.getLogger(FitsDecoder.class.getName());

    static {
        FitsFactory.setUseHierarch(true);
    }

    public RawData<?> decode(File file) throws ConversionException {
        if (!file.isFile()) {
            throw new ConversionException(Failure.UNREADABLE_CONTAINER, "No such file: " + file);
        }
        try (Fits fits = new Fits(file)) {
            return readPrimary(fits, file.getName());
        } catch (ConversionException x) {
            throw x;
        } catch (FitsException | IOException | RuntimeException x) {
            throw new ConversionException(Failure.UNREADABLE_CONTAINER, "Unable to read FITS file " + file + ": " + x.getMessage(), x);
        }
    }

    public RawData<?> decode(InputStream in, String name) throws ConversionException {
        try (Fits fits = new Fits(in)) {
            return readPrimary(fits, name);
        } catch (ConversionException x) {
            throw x;
        } catch (FitsException | IOException | RuntimeException x) {
            throw new ConversionException(Failure.UNREADABLE_CONTAINER, "Unable to read FITS data from " + name + ": " + x.getMessage(), x);
        }
    }

    private RawData<?> readPrimary(Fits fits, String name) throws ConversionException, FitsException, IOException {
        BasicHDU<?> hdu = fits.readHDU();
        if (hdu == null) {
            throw new ConversionException(Failure.UNREADABLE_CONTAINER, "No header data unit in " + name);
        }
        Header header = hdu.getHeader();
        int nAxis = header.getIntValue(Standard.NAXIS, 0);
        if (nAxis <= 0) {
            throw new ConversionException(Failure.NO_IMAGE_DATA, "Primary HDU of " + name + " has no data");
        }
        if (!(hdu instanceof ImageHDU)) {
            throw new ConversionException(Failure.UNREADABLE_CONTAINER, "Primary HDU of " + name + " is not an image");
        }
        // FITS lists the fastest varying axis first, Java arrays the slowest
        int[] shape = new int[nAxis];
        for (int i = 0; i < nAxis; i++) {
            shape[nAxis - 1 - i] = header.getIntValue("NAXIS" + (i + 1), 0);
        }
        if (Arrays.stream(shape).anyMatch(n -> n <= 0)) {
            throw new ConversionException(Failure.NO_IMAGE_DATA, "Primary HDU of " + name + " has an empty axis " + Arrays.toString(shape));
        }
        Object kernel = hdu.getKernel();
        if (kernel == null) {
            throw new ConversionException(Failure.NO_IMAGE_DATA, "Primary HDU of " + name + " has no data");
        }
        int bitpix = header.getIntValue(Standard.BITPIX);
        double bscale = header.getDoubleValue(Standard.BSCALE, 1.0);
        double bzero = header.getDoubleValue(Standard.BZERO, 0.0);
        Buffer buffer = wrap(ArrayFuncs.flatten(kernel));
        RawData<?> raw = new RawData<>(buffer, shape, bitpix, bscale, bzero);
        LOG.fine(() -> String.format("Read %s from %s", raw, name));
        return raw;
    }

    private static Buffer wrap(Object flat) throws FitsException {
        if (flat instanceof byte[] b) {
            return ByteBuffer.wrap(b);
        } else if (flat instanceof short[] s) {
            return ShortBuffer.wrap(s);
        } else if (flat instanceof int[] i) {
            return IntBuffer.wrap(i);
        } else if (flat instanceof long[] l) {
            return LongBuffer.wrap(l);
        } else if (flat instanceof float[] f) {
            return FloatBuffer.wrap(f);
        } else if (flat instanceof double[] d) {
            return DoubleBuffer.wrap(d);
        } else {
            throw new FitsException("Unsupported pixel data type " + flat.getClass().getName());
        }
    }
}
