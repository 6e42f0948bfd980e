package org.nrg.xnat.rtconvert.exception;

/**
 * Thrown when a structure set is paired with a series from another frame of reference.
 */
public class FrameOfReferenceMismatchException extends RtConversionException {

    private final String seriesFrameOfReferenceUid;
    private final String structureFrameOfReferenceUid;

    public FrameOfReferenceMismatchException(String seriesFrameOfReferenceUid, String structureFrameOfReferenceUid) {
        super("Structure set frame of reference " + structureFrameOfReferenceUid
                + " does not match series frame of reference " + seriesFrameOfReferenceUid);
        this.seriesFrameOfReferenceUid = seriesFrameOfReferenceUid;
        this.structureFrameOfReferenceUid = structureFrameOfReferenceUid;
    }

    public String getSeriesFrameOfReferenceUid() {
        return seriesFrameOfReferenceUid;
    }

    public String getStructureFrameOfReferenceUid() {
        return structureFrameOfReferenceUid;
    }
}
