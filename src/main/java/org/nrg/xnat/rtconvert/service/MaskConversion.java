package org.nrg.xnat.rtconvert.service;

import org.nrg.xnat.rtconvert.model.LabeledMask;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.nrg.xnat.rtconvert.model.VoxelGrid;
import org.nrg.xnat.rtconvert.report.ConversionWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Image volume and label mask produced for one request.
 */
public final class MaskConversion {

    private final String requestId;
    private final VoxelGrid grid;
    private final LabeledMask mask;
    private final StructureSet structureSet;
    private final List<ConversionWarning> warnings;

    public MaskConversion(String requestId, VoxelGrid grid, LabeledMask mask, StructureSet structureSet,
                          List<ConversionWarning> warnings) {
        this.requestId = requestId;
        this.grid = grid;
        this.mask = mask;
        this.structureSet = structureSet;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public String getRequestId() {
        return requestId;
    }

    public VoxelGrid getGrid() {
        return grid;
    }

    public LabeledMask getMask() {
        return mask;
    }

    public StructureSet getStructureSet() {
        return structureSet;
    }

    public List<ConversionWarning> getWarnings() {
        return warnings;
    }
}
