package org.nrg.xnat.rtconvert.exception;

/**
 * Malformed caller configuration, such as an empty wanted-region list. Not recoverable per request.
 */
public class InvalidConversionConfigException extends IllegalArgumentException {

    public InvalidConversionConfigException(String message) {
        super(message);
    }
}
