package org.nrg.xnat.rtconvert.report;

/**
 * Non-fatal condition recorded during a conversion step.
 */
public abstract class ConversionWarning {

    private final String message;

    protected ConversionWarning(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + message;
    }
}
