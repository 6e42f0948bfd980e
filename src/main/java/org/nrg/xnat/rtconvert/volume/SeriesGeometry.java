package org.nrg.xnat.rtconvert.volume;

import org.nrg.xnat.rtconvert.geometry.VoxelTransform;
import org.nrg.xnat.rtconvert.model.SliceHeader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Validated spatial layout of a series: slices in through-plane order and the derived transform.
 */
public final class SeriesGeometry {

    private final List<SliceHeader> orderedSlices;
    private final int rows;
    private final int columns;
    private final double sliceSpacing;
    private final VoxelTransform transform;

    SeriesGeometry(List<SliceHeader> orderedSlices, int rows, int columns, double sliceSpacing,
                   VoxelTransform transform) {
        this.orderedSlices = Collections.unmodifiableList(new ArrayList<>(orderedSlices));
        this.rows = rows;
        this.columns = columns;
        this.sliceSpacing = sliceSpacing;
        this.transform = transform;
    }

    public List<SliceHeader> getOrderedSlices() {
        return orderedSlices;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public double getSliceSpacing() {
        return sliceSpacing;
    }

    public VoxelTransform getTransform() {
        return transform;
    }
}
