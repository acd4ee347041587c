package org.lsst.fits.converter;

import java.util.Arrays;

/**
 * An 8 bit image ready for adjustment and encoding. Samples are stored
 * interleaved, row by row, with {@code channels} samples per pixel.
 *
 * @author tonyj
 */
public class DisplayImage {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    /**
     * Create a display image. The data array is copied.
     *
     * @param width The image width
     * @param height The image height
     * @param channels The number of samples per pixel
     * @param data The samples, {@code width * height * channels} long
     */
    public DisplayImage(int width, int height, int channels, byte[] data) {
        if (width <= 0 || height <= 0 || channels <= 0) {
            throw new IllegalArgumentException(String.format("Invalid image geometry %dx%dx%d", width, height, channels));
        }
        if (data.length != (long) width * height * channels) {
            throw new IllegalArgumentException(String.format("Expected %d samples for %dx%dx%d image, got %d", (long) width * height * channels, width, height, channels, data.length));
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    public boolean isGrayscale() {
        return channels == 1;
    }

    /**
     * True for gray+alpha and RGBA images, where the last channel is alpha.
     *
     * @return If the image has an alpha channel
     */
    public boolean hasAlpha() {
        return channels == 2 || channels == 4;
    }

    public int getSample(int x, int y, int channel) {
        return data[(y * width + x) * channels + channel] & 0xff;
    }

    /**
     * @return A copy of the samples
     */
    public byte[] getSamples() {
        return data.clone();
    }

    public int getMinSample() {
        int min = 255;
        for (byte b : data) {
            min = Math.min(min, b & 0xff);
        }
        return min;
    }

    public int getMaxSample() {
        int max = 0;
        for (byte b : data) {
            max = Math.max(max, b & 0xff);
        }
        return max;
    }

    @Override
    public String toString() {
        return "DisplayImage{" + "width=" + width + ", height=" + height + ", channels=" + channels + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 53 * hash + this.width;
        hash = 53 * hash + this.height;
        hash = 53 * hash + this.channels;
        hash = 53 * hash + Arrays.hashCode(this.data);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final DisplayImage other = (DisplayImage) obj;
        if (this.width != other.width || this.height != other.height || this.channels != other.channels) {
            return false;
        }
        return Arrays.equals(this.data, other.data);
    }
}
