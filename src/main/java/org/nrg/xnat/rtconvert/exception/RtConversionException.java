package org.nrg.xnat.rtconvert.exception;

/**
 * Base class for failures that abort a single conversion request.
 */
public class RtConversionException extends Exception {

    public RtConversionException(String message) {
        super(message);
    }

    public RtConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
