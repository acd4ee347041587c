package org.lsst.fits.converter;

import java.io.File;
import java.util.Objects;
import org.lsst.fits.converter.adjust.AdjustmentSettings;
import org.lsst.fits.converter.encode.OutputFormat;

/**
 * Everything needed to convert one file. Requests are immutable and
 * independent of each other.
 *
 * @author tonyj
 */
public final class ConversionRequest {

    private final File source;
    private final OutputFormat outputFormat;
    private final boolean autoNormalise;
    private final AdjustmentSettings settings;

    public ConversionRequest(File source, OutputFormat outputFormat, boolean autoNormalise, AdjustmentSettings settings) {
        this.source = Objects.requireNonNull(source, "source");
        this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
        this.autoNormalise = autoNormalise;
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * A normalized conversion with no adjustments.
     *
     * @param source The FITS file
     * @param outputFormat The format to write
     * @return The request
     */
    public static ConversionRequest of(File source, OutputFormat outputFormat) {
        return new ConversionRequest(source, outputFormat, true, AdjustmentSettings.IDENTITY);
    }

    public File getSource() {
        return source;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public boolean isAutoNormalise() {
        return autoNormalise;
    }

    public AdjustmentSettings getSettings() {
        return settings;
    }

    @Override
    public String toString() {
        return "ConversionRequest{" + "source=" + source + ", outputFormat=" + outputFormat + ", autoNormalise=" + autoNormalise + ", settings=" + settings + '}';
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, outputFormat, autoNormalise, settings);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ConversionRequest other = (ConversionRequest) obj;
        return this.autoNormalise == other.autoNormalise
                && this.outputFormat == other.outputFormat
                && Objects.equals(this.source, other.source)
                && Objects.equals(this.settings, other.settings);
    }
}
