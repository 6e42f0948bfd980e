package org.nrg.xnat.rtconvert.model;

import org.nrg.xnat.rtconvert.geometry.VoxelTransform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assembled image volume of shape (slices, rows, columns) with its voxel-to-patient transform.
 * Immutable: array accessors return copies.
 */
public final class VoxelGrid {

    private final int slices;
    private final int rows;
    private final int columns;
    private final float[] data;
    private final VoxelTransform transform;
    private final String seriesInstanceUid;
    private final String frameOfReferenceUid;
    private final List<String> sliceSopInstanceUids;

    public VoxelGrid(int slices, int rows, int columns, float[] data, VoxelTransform transform,
                     String seriesInstanceUid, String frameOfReferenceUid, List<String> sliceSopInstanceUids) {
        if (slices <= 0 || rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive");
        }
        if (data == null || data.length != slices * rows * columns) {
            throw new IllegalArgumentException("Voxel data does not match grid shape "
                    + slices + "x" + rows + "x" + columns);
        }
        if (transform == null) {
            throw new IllegalArgumentException("Voxel transform is required");
        }
        this.slices = slices;
        this.rows = rows;
        this.columns = columns;
        this.data = data.clone();
        this.transform = transform;
        this.seriesInstanceUid = seriesInstanceUid;
        this.frameOfReferenceUid = frameOfReferenceUid;
        List<String> uids = sliceSopInstanceUids != null ? new ArrayList<>(sliceSopInstanceUids) : new ArrayList<String>();
        while (uids.size() < slices) {
            uids.add(null);
        }
        this.sliceSopInstanceUids = Collections.unmodifiableList(uids);
    }

    /**
     * An all-zero grid, useful as a geometry reference when only the shape and transform matter.
     */
    public static VoxelGrid empty(int slices, int rows, int columns, VoxelTransform transform, String frameOfReferenceUid) {
        return new VoxelGrid(slices, rows, columns, new float[slices * rows * columns], transform,
                null, frameOfReferenceUid, null);
    }

    public int getSlices() {
        return slices;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int[] getShape() {
        return new int[]{slices, rows, columns};
    }

    public float get(int slice, int row, int column) {
        return data[(slice * rows + row) * columns + column];
    }

    /**
     * Copy of the voxel values in slice-major, then row-major order.
     */
    public float[] toArray() {
        return data.clone();
    }

    public float[][][] toArray3D() {
        float[][][] out = new float[slices][rows][columns];
        for (int k = 0; k < slices; k++) {
            for (int j = 0; j < rows; j++) {
                System.arraycopy(data, (k * rows + j) * columns, out[k][j], 0, columns);
            }
        }
        return out;
    }

    public VoxelTransform getTransform() {
        return transform;
    }

    public String getSeriesInstanceUid() {
        return seriesInstanceUid;
    }

    public String getFrameOfReferenceUid() {
        return frameOfReferenceUid;
    }

    /**
     * SOP Instance UID of each slice in spatial order; entries may be null for synthetic grids.
     */
    public List<String> getSliceSopInstanceUids() {
        return sliceSopInstanceUids;
    }

    @Override
    public String toString() {
        return "VoxelGrid[" + slices + "x" + rows + "x" + columns + ", series=" + seriesInstanceUid + "]";
    }
}
