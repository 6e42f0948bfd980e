package org.nrg.xnat.rtconvert.exception;

/**
 * Thrown when a contour does not lie on a slice plane of the target volume.
 * Rejects that contour only.
 */
public class SliceAlignmentException extends RtConversionException {

    private final double sliceCoordinate;

    public SliceAlignmentException(String message, double sliceCoordinate) {
        super(message);
        this.sliceCoordinate = sliceCoordinate;
    }

    /**
     * Fractional through-plane voxel coordinate of the offending point.
     */
    public double getSliceCoordinate() {
        return sliceCoordinate;
    }
}
