package org.nrg.xnat.rtconvert.exception;

/**
 * Thrown when the slices of a series do not form a regular volume.
 */
public class InconsistentGeometryException extends RtConversionException {

    private final String seriesInstanceUid;

    public InconsistentGeometryException(String seriesInstanceUid, String message) {
        super("Series " + seriesInstanceUid + ": " + message);
        this.seriesInstanceUid = seriesInstanceUid;
    }

    public String getSeriesInstanceUid() {
        return seriesInstanceUid;
    }
}
