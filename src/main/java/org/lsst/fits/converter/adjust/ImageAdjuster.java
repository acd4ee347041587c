package org.lsst.fits.converter.adjust;

import java.awt.Rectangle;
import java.awt.geom.AffineTransform;
import java.awt.geom.NoninvertibleTransformException;
import java.awt.geom.Rectangle2D;
import java.util.logging.Logger;
import org.lsst.fits.converter.DisplayImage;

/**
 * Applies brightness, contrast and rotation to a display image, in that
 * order. Settings which leave the image unchanged are skipped, so identity
 * settings return the input image itself.
 * <p>
 * Brightness and contrast both blend the image with a uniform "degenerate"
 * image: black for brightness, the mean luminance of the image for contrast.
 * Results are truncated and clipped to 0..255, alpha channels are left
 * alone.
 *
 * @author tonyj
 */
public class ImageAdjuster {

    private static final Logger LOG = Logger.getLogger(ImageAdjuster.class.getName());
    // Tolerance when sizing the rotated canvas, absorbs rounding in sin/cos
    private static final double CANVAS_EPSILON = 1e-6;

    public DisplayImage adjust(DisplayImage image, AdjustmentSettings settings) {
        DisplayImage result = image;
        if (settings.getBrightness() != 1.0) {
            result = brightness(result, settings.getBrightness());
        }
        if (settings.getContrast() != 1.0) {
            result = contrast(result, settings.getContrast());
        }
        if (!isNoRotation(settings.getRotationDegrees())) {
            result = rotate(result, settings.getRotationDegrees());
        }
        return result;
    }

    public DisplayImage brightness(DisplayImage image, double factor) {
        return blend(image, 0, factor);
    }

    public DisplayImage contrast(DisplayImage image, double factor) {
        int mean = meanLuminance(image);
        LOG.fine(() -> String.format("Contrast %g around mean %d for %s", factor, mean, image));
        return blend(image, mean, factor);
    }

    /**
     * Rotate counter-clockwise about the image center. The canvas grows to
     * the bounding box of the rotated image, uncovered pixels are 0. Quarter
     * turns are exact, other angles use nearest neighbour sampling.
     *
     * @param image The image to rotate
     * @param degrees The angle, counter-clockwise
     * @return The rotated image
     */
    public DisplayImage rotate(DisplayImage image, double degrees) {
        double angle = degrees % 360.0;
        if (angle < 0) {
            angle += 360.0;
        }
        if (angle == 0.0) {
            return image;
        } else if (angle == 90.0) {
            return quarterTurns(image, 1);
        } else if (angle == 180.0) {
            return quarterTurns(image, 2);
        } else if (angle == 270.0) {
            return quarterTurns(image, 3);
        } else {
            return rotateAny(image, angle);
        }
    }

    static boolean isNoRotation(double degrees) {
        return degrees % 360.0 == 0.0;
    }

    static int meanLuminance(DisplayImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int channels = image.getChannels();
        byte[] data = image.getSamples();
        double sum = 0;
        for (int p = 0; p < w * h; p++) {
            int i = p * channels;
            if (channels < 3) {
                sum += data[i] & 0xff;
            } else {
                // ITU-R 601 luma, fixed point
                sum += ((data[i] & 0xff) * 19595 + (data[i + 1] & 0xff) * 38470 + (data[i + 2] & 0xff) * 7471 + 0x8000) >> 16;
            }
        }
        return (int) (sum / (w * h) + 0.5);
    }

    private static DisplayImage blend(DisplayImage image, int degenerate, double factor) {
        int channels = image.getChannels();
        int alpha = image.hasAlpha() ? channels - 1 : -1;
        byte[] data = image.getSamples();
        for (int i = 0; i < data.length; i++) {
            if (i % channels == alpha) {
                continue;
            }
            double value = degenerate + factor * ((data[i] & 0xff) - degenerate);
            data[i] = (byte) clip(value);
        }
        return new DisplayImage(image.getWidth(), image.getHeight(), channels, data);
    }

    private static int clip(double value) {
        if (value <= 0) {
            return 0;
        } else if (value >= 255) {
            return 255;
        } else {
            return (int) value;
        }
    }

    private static DisplayImage quarterTurns(DisplayImage image, int turns) {
        int w = image.getWidth();
        int h = image.getHeight();
        int channels = image.getChannels();
        byte[] in = image.getSamples();
        int outWidth = turns == 2 ? w : h;
        int outHeight = turns == 2 ? h : w;
        byte[] out = new byte[in.length];
        for (int y = 0; y < outHeight; y++) {
            for (int x = 0; x < outWidth; x++) {
                int sx;
                int sy;
                switch (turns) {
                    case 1:
                        sx = w - 1 - y;
                        sy = x;
                        break;
                    case 2:
                        sx = w - 1 - x;
                        sy = h - 1 - y;
                        break;
                    default:
                        sx = y;
                        sy = h - 1 - x;
                        break;
                }
                System.arraycopy(in, (sy * w + sx) * channels, out, (y * outWidth + x) * channels, channels);
            }
        }
        return new DisplayImage(outWidth, outHeight, channels, out);
    }

    private static DisplayImage rotateAny(DisplayImage image, double degrees) {
        int w = image.getWidth();
        int h = image.getHeight();
        int channels = image.getChannels();
        // Image y axis points down, so counter-clockwise on screen is a negative angle
        double theta = -Math.toRadians(degrees);
        Rectangle2D bounds = AffineTransform.getRotateInstance(theta).createTransformedShape(new Rectangle(0, 0, w, h)).getBounds2D();
        int outWidth = Math.max(1, (int) Math.ceil(bounds.getWidth() - CANVAS_EPSILON));
        int outHeight = Math.max(1, (int) Math.ceil(bounds.getHeight() - CANVAS_EPSILON));

        AffineTransform transform = new AffineTransform();
        transform.translate(outWidth / 2.0, outHeight / 2.0);
        transform.rotate(theta);
        transform.translate(-w / 2.0, -h / 2.0);
        AffineTransform inverse;
        try {
            inverse = transform.createInverse();
        } catch (NoninvertibleTransformException x) {
            throw new IllegalStateException("Rotation is not invertible", x);
        }

        byte[] in = image.getSamples();
        byte[] out = new byte[outWidth * outHeight * channels];
        double[] points = new double[2 * outWidth];
        for (int y = 0; y < outHeight; y++) {
            for (int x = 0; x < outWidth; x++) {
                points[2 * x] = x + 0.5;
                points[2 * x + 1] = y + 0.5;
            }
            inverse.transform(points, 0, points, 0, outWidth);
            for (int x = 0; x < outWidth; x++) {
                int sx = (int) Math.floor(points[2 * x]);
                int sy = (int) Math.floor(points[2 * x + 1]);
                if (sx >= 0 && sx < w && sy >= 0 && sy < h) {
                    System.arraycopy(in, (sy * w + sx) * channels, out, (y * outWidth + x) * channels, channels);
                }
            }
        }
        LOG.fine(() -> String.format("Rotated %s by %g degrees to %dx%d", image, degrees, outWidth, outHeight));
        return new DisplayImage(outWidth, outHeight, channels, out);
    }
}
