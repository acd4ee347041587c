package org.lsst.fits.converter.encode;

import java.util.Locale;

/**
 * Supported output formats. The extension doubles as the ImageIO format name.
 *
 * @author tonyj
 */
public enum OutputFormat {
    PNG("png"), TIFF("tiff"), JPG("jpg"), BMP("bmp");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public String getFormatName() {
        return extension;
    }

    /**
     * Case insensitive lookup of a format by name.
     *
     * @param name The format name, for example "png" or "TIFF"
     * @return The format
     * @throws IllegalArgumentException If the name is not a supported format
     */
    public static OutputFormat parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException x) {
            throw new IllegalArgumentException("Unknown output format: " + name, x);
        }
    }
}
