package org.lsst.fits.converter;

import java.io.File;
import java.util.Objects;
import org.lsst.fits.converter.ConversionException.Failure;

/**
 * The outcome of converting one file: either the file written, or the reason
 * nothing was written.
 *
 * @author tonyj
 */
public final class ConversionResult {

    private final File source;
    private final File output;
    private final Failure failure;
    private final String message;

    private ConversionResult(File source, File output, Failure failure, String message) {
        this.source = source;
        this.output = output;
        this.failure = failure;
        this.message = message;
    }

    public static ConversionResult success(File source, File output) {
        return new ConversionResult(source, Objects.requireNonNull(output), null, null);
    }

    public static ConversionResult failure(File source, Failure failure, String message) {
        return new ConversionResult(source, null, Objects.requireNonNull(failure), message);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public File getSource() {
        return source;
    }

    /**
     * @return The file written, or <code>null</code> for a failure
     */
    public File getOutput() {
        return output;
    }

    /**
     * @return The failure, or <code>null</code> for a success
     */
    public Failure getFailure() {
        return failure;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "OK " + output;
        } else {
            return "FAILED " + source.getName() + ": " + failure + " " + message;
        }
    }
}
