package org.nrg.xnat.rtconvert.service;

/**
 * Lifecycle of one series / structure set pair.
 */
public enum ConversionState {
    UNINDEXED,
    INDEXED,
    ASSEMBLED,
    MASK_READY,
    STRUCTURE_READY,
    GEOMETRY_ERROR,
    ALIGNMENT_ERROR,
    FAILED,
    CANCELLED;

    public boolean isFailure() {
        return this == GEOMETRY_ERROR || this == ALIGNMENT_ERROR || this == FAILED || this == CANCELLED;
    }

    /**
     * States from which a new mask or structure request can start.
     */
    public boolean acceptsRequest() {
        return this == ASSEMBLED || this == MASK_READY || this == STRUCTURE_READY;
    }
}
