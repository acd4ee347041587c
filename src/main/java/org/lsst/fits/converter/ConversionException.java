package org.lsst.fits.converter;

import java.io.IOException;

/**
 * Thrown when one stage of the conversion of a single file fails. The
 * {@link Failure} tag says which kind of problem stopped the conversion.
 *
 * @author tonyj
 */
public class ConversionException extends IOException {

    private static final long serialVersionUID = 1L;

    public enum Failure {
        /**
         * The source could not be opened or parsed as a FITS file
         */
        UNREADABLE_CONTAINER,
        /**
         * The primary HDU carries no pixel array
         */
        NO_IMAGE_DATA,
        /**
         * The pixel array is neither 2 nor 3 dimensional
         */
        UNSUPPORTED_DIMENSIONALITY,
        /**
         * The output format rejected the final image
         */
        ENCODING_ERROR
    };

    private final Failure failure;

    public ConversionException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ConversionException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public Failure getFailure() {
        return failure;
    }
}
