package org.nrg.xnat.rtconvert.exception;

public class ConversionCancelledException extends RtConversionException {

    public ConversionCancelledException(String message) {
        super(message);
    }
}
