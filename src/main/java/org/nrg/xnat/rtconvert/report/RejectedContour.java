package org.nrg.xnat.rtconvert.report;

import org.nrg.xnat.rtconvert.exception.SliceAlignmentException;

/**
 * A contour left out of the mask because it does not sit on a slice plane.
 */
public class RejectedContour extends ConversionWarning {

    private final String regionName;
    private final int contourIndex;
    private final SliceAlignmentException alignmentError;

    public RejectedContour(String regionName, int contourIndex, SliceAlignmentException cause) {
        super("Contour " + contourIndex + " of region '" + regionName + "' rejected: " + cause.getMessage());
        this.regionName = regionName;
        this.contourIndex = contourIndex;
        this.alignmentError = cause;
    }

    public String getRegionName() {
        return regionName;
    }

    public int getContourIndex() {
        return contourIndex;
    }

    public SliceAlignmentException getAlignmentError() {
        return alignmentError;
    }
}
