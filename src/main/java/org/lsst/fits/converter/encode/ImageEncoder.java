package org.lsst.fits.converter.encode;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.WritableRaster;
import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageIO;
import org.lsst.fits.converter.ConversionException;
import org.lsst.fits.converter.ConversionException.Failure;
import org.lsst.fits.converter.DisplayImage;

/**
 * Encodes display images with ImageIO and writes them next to their source.
 *
 * @author tonyj
 */
public class ImageEncoder {

    private static final Logger LOG = Logger.getLogger(ImageEncoder.class.getName());

    /**
     * The file a source converts to: same directory and base name, with the
     * extension replaced by the format's extension.
     *
     * @param source The source file
     * @param format The output format
     * @return The absolute output file
     */
    public static File outputFile(File source, OutputFormat format) {
        File absolute = source.getAbsoluteFile();
        String name = absolute.getName();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return new File(absolute.getParentFile(), base + "." + format.getExtension());
    }

    /**
     * Wrap a display image as a buffered image. One channel gives an 8 bit
     * gray image, two gray plus alpha, three RGB and four RGBA.
     *
     * @param image The display image
     * @return The buffered image
     * @throws ConversionException If the channel count has no color model
     */
    public BufferedImage toBufferedImage(DisplayImage image) throws ConversionException {
        int w = image.getWidth();
        int h = image.getHeight();
        BufferedImage result = switch (image.getChannels()) {
            case 1 ->
                new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
            case 2 ->
                grayAlphaImage(w, h);
            case 3 ->
                new BufferedImage(w, h, BufferedImage.TYPE_3BYTE_BGR);
            case 4 ->
                new BufferedImage(w, h, BufferedImage.TYPE_4BYTE_ABGR);
            default ->
                throw new ConversionException(Failure.ENCODING_ERROR, "Unsupported channel count " + image.getChannels());
        };
        byte[] samples = image.getSamples();
        int[] pixels = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            pixels[i] = samples[i] & 0xff;
        }
        result.getRaster().setPixels(0, 0, w, h, pixels);
        return result;
    }

    private static BufferedImage grayAlphaImage(int w, int h) {
        ColorModel cm = new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_GRAY), true, false, Transparency.TRANSLUCENT, DataBuffer.TYPE_BYTE);
        WritableRaster raster = cm.createCompatibleWritableRaster(w, h);
        return new BufferedImage(cm, raster, false, null);
    }

    /**
     * Encode an image and write it to the target file, replacing any existing
     * file. The image is written to a temporary file first, so the target is
     * never left half written.
     *
     * @param image The image to write
     * @param format The output format
     * @param target The file to write
     * @return The target file
     * @throws ConversionException If the format cannot encode the image or the
     * file cannot be written
     */
    public File write(DisplayImage image, OutputFormat format, File target) throws ConversionException {
        BufferedImage bi = toBufferedImage(image);
        Path targetPath = target.toPath().toAbsolutePath();
        Path temp = null;
        try {
            temp = Files.createTempFile(targetPath.getParent(), "." + targetPath.getFileName(), ".tmp");
            if (!ImageIO.write(bi, format.getFormatName(), temp.toFile())) {
                throw new ConversionException(Failure.ENCODING_ERROR, String.format("No %s writer can encode a %d channel image", format, image.getChannels()));
            }
            move(temp, targetPath);
            temp = null;
            return target;
        } catch (ConversionException x) {
            throw x;
        } catch (IOException | RuntimeException x) {
            throw new ConversionException(Failure.ENCODING_ERROR, "Unable to write " + target + ": " + x.getMessage(), x);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException x) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException x) {
            LOG.log(Level.WARNING, x, () -> "Unable to delete temporary file " + temp);
        }
    }
}
