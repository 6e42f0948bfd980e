package org.nrg.xnat.rtconvert.model;

import org.nrg.xnat.rtconvert.geometry.VoxelTransform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Integer label volume aligned with a {@link VoxelGrid}. Label 0 is background, label {@code i + 1}
 * is the region named at index {@code i} of {@link #getLabelNames()}.
 */
public final class LabeledMask {

    private final int slices;
    private final int rows;
    private final int columns;
    private final int[] labels;
    private final VoxelTransform transform;
    private final String frameOfReferenceUid;
    private final List<String> labelNames;

    public LabeledMask(int slices, int rows, int columns, int[] labels, VoxelTransform transform,
                       String frameOfReferenceUid, List<String> labelNames) {
        if (labels == null || labels.length != slices * rows * columns) {
            throw new IllegalArgumentException("Label data does not match mask shape "
                    + slices + "x" + rows + "x" + columns);
        }
        for (int value : labels) {
            if (value < 0) {
                throw new IllegalArgumentException("Labels must be non-negative, found " + value);
            }
        }
        this.slices = slices;
        this.rows = rows;
        this.columns = columns;
        this.labels = labels.clone();
        this.transform = transform;
        this.frameOfReferenceUid = frameOfReferenceUid;
        this.labelNames = Collections.unmodifiableList(new ArrayList<>(labelNames));
    }

    public static LabeledMask fromArray(int[][][] labels, VoxelTransform transform, String frameOfReferenceUid,
                                        List<String> labelNames) {
        int slices = labels.length;
        int rows = slices > 0 ? labels[0].length : 0;
        int columns = rows > 0 ? labels[0][0].length : 0;
        int[] flat = new int[slices * rows * columns];
        for (int k = 0; k < slices; k++) {
            for (int j = 0; j < rows; j++) {
                if (labels[k][j].length != columns) {
                    throw new IllegalArgumentException("Ragged label array at slice " + k + ", row " + j);
                }
                System.arraycopy(labels[k][j], 0, flat, (k * rows + j) * columns, columns);
            }
        }
        return new LabeledMask(slices, rows, columns, flat, transform, frameOfReferenceUid, labelNames);
    }

    /**
     * Collapse one binary mask per region into a single label volume. Masks are painted in list order,
     * so where two regions overlap the later one keeps the voxel.
     */
    public static LabeledMask fromBinaryMasks(List<boolean[][][]> masks, List<String> labelNames,
                                              VoxelTransform transform, String frameOfReferenceUid) {
        if (masks.isEmpty() || masks.size() != labelNames.size()) {
            throw new IllegalArgumentException("Expected one binary mask per label name");
        }
        boolean[][][] first = masks.get(0);
        int slices = first.length;
        int rows = first[0].length;
        int columns = first[0][0].length;
        int[] flat = new int[slices * rows * columns];
        for (int m = 0; m < masks.size(); m++) {
            boolean[][][] mask = masks.get(m);
            if (mask.length != slices || mask[0].length != rows || mask[0][0].length != columns) {
                throw new IllegalArgumentException("Binary mask for " + labelNames.get(m) + " has a different shape");
            }
            for (int k = 0; k < slices; k++) {
                for (int j = 0; j < rows; j++) {
                    for (int i = 0; i < columns; i++) {
                        if (mask[k][j][i]) {
                            flat[(k * rows + j) * columns + i] = m + 1;
                        }
                    }
                }
            }
        }
        return new LabeledMask(slices, rows, columns, flat, transform, frameOfReferenceUid, labelNames);
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

    public int get(int slice, int row, int column) {
        return labels[(slice * rows + row) * columns + column];
    }

    public int[] toArray() {
        return labels.clone();
    }

    public int[][][] toArray3D() {
        int[][][] out = new int[slices][rows][columns];
        for (int k = 0; k < slices; k++) {
            for (int j = 0; j < rows; j++) {
                System.arraycopy(labels, (k * rows + j) * columns, out[k][j], 0, columns);
            }
        }
        return out;
    }

    /**
     * Binary view of a single label.
     */
    public boolean[][][] toBinary(int label) {
        boolean[][][] out = new boolean[slices][rows][columns];
        for (int k = 0; k < slices; k++) {
            for (int j = 0; j < rows; j++) {
                for (int i = 0; i < columns; i++) {
                    out[k][j][i] = labels[(k * rows + j) * columns + i] == label;
                }
            }
        }
        return out;
    }

    public long countVoxels(int label) {
        long count = 0;
        for (int value : labels) {
            if (value == label) {
                count++;
            }
        }
        return count;
    }

    public int getMaxLabel() {
        int max = 0;
        for (int value : labels) {
            max = Math.max(max, value);
        }
        return max;
    }

    public VoxelTransform getTransform() {
        return transform;
    }

    public String getFrameOfReferenceUid() {
        return frameOfReferenceUid;
    }

    public List<String> getLabelNames() {
        return labelNames;
    }

    /**
     * Label value of a region name, or 0 when the name is not part of this mask.
     */
    public int labelOf(String name) {
        int index = labelNames.indexOf(name);
        return index < 0 ? 0 : index + 1;
    }

    @Override
    public String toString() {
        return "LabeledMask[" + slices + "x" + rows + "x" + columns + ", labels=" + labelNames + "]";
    }
}
