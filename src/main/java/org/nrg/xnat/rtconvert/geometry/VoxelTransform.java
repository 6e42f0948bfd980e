package org.nrg.xnat.rtconvert.geometry;

import java.util.Arrays;

/**
 * Affine mapping between voxel indices and patient coordinates.
 *
 * Voxel index triples are ordered (column, row, slice), so a point is
 * {@code origin + column * colSpacing * rowCosine + row * rowSpacing * columnCosine + slice * sliceSpacing * normal}.
 * This follows the DICOM convention where the first Image Orientation (Patient) vector is the direction
 * of increasing column index along a row.
 */
public final class VoxelTransform {

    private static final double SINGULAR_EPSILON = 1e-12;

    private final double[] origin;
    private final double[] spacing;
    private final double[][] direction;
    private final double[][] forward;
    private final double[][] inverse;

    private VoxelTransform(double[] origin, double[] spacing, double[][] direction) {
        this.origin = origin.clone();
        this.spacing = spacing.clone();
        this.direction = new double[3][];
        for (int axis = 0; axis < 3; axis++) {
            this.direction[axis] = direction[axis].clone();
        }

        // Column a of the forward matrix is direction[a] scaled by spacing[a]
        this.forward = new double[3][3];
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                forward[row][col] = direction[col][row] * spacing[col];
            }
        }
        this.inverse = invert(forward);
    }

    /**
     * Build a transform from a slice's image position, image orientation and the volume's spacings.
     *
     * @param imagePosition   Image Position (Patient) of the first slice
     * @param imageOrientation the six Image Orientation (Patient) direction cosines
     * @param pixelSpacing    Pixel Spacing as stored in DICOM: row spacing, then column spacing
     * @param sliceSpacing    distance between consecutive slices along the normal
     */
    public static VoxelTransform fromSliceGeometry(double[] imagePosition, double[] imageOrientation,
                                                   double[] pixelSpacing, double sliceSpacing) {
        if (imagePosition == null || imagePosition.length < 3) {
            throw new IllegalArgumentException("Image position requires three values");
        }
        if (imageOrientation == null || imageOrientation.length < 6) {
            throw new IllegalArgumentException("Image orientation requires six values");
        }
        if (pixelSpacing == null || pixelSpacing.length < 2) {
            throw new IllegalArgumentException("Pixel spacing requires two values");
        }
        double[] rowCosine = Arrays.copyOfRange(imageOrientation, 0, 3);
        double[] columnCosine = Arrays.copyOfRange(imageOrientation, 3, 6);
        double[] normal = cross(rowCosine, columnCosine);
        return new VoxelTransform(
                Arrays.copyOf(imagePosition, 3),
                new double[]{pixelSpacing[1], pixelSpacing[0], sliceSpacing},
                new double[][]{rowCosine, columnCosine, normal});
    }

    /**
     * Build a transform from an explicit origin, per-axis spacing and per-axis direction vectors.
     */
    public static VoxelTransform of(double[] origin, double[] spacing, double[][] direction) {
        if (origin == null || origin.length != 3 || spacing == null || spacing.length != 3
                || direction == null || direction.length != 3) {
            throw new IllegalArgumentException("Origin, spacing and direction must all be three-dimensional");
        }
        return new VoxelTransform(origin, spacing, direction);
    }

    public static VoxelTransform identity() {
        return new VoxelTransform(new double[3], new double[]{1, 1, 1},
                new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});
    }

    public PatientPoint voxelToPatient(double column, double row, double slice) {
        double[] v = {column, row, slice};
        double[] p = new double[3];
        for (int r = 0; r < 3; r++) {
            p[r] = origin[r] + forward[r][0] * v[0] + forward[r][1] * v[1] + forward[r][2] * v[2];
        }
        return new PatientPoint(p[0], p[1], p[2]);
    }

    /**
     * Map a patient point to fractional (column, row, slice) voxel coordinates.
     */
    public double[] patientToVoxel(PatientPoint point) {
        double[] d = {point.getX() - origin[0], point.getY() - origin[1], point.getZ() - origin[2]};
        double[] v = new double[3];
        for (int r = 0; r < 3; r++) {
            v[r] = inverse[r][0] * d[0] + inverse[r][1] * d[1] + inverse[r][2] * d[2];
        }
        return v;
    }

    public double[] getOrigin() {
        return origin.clone();
    }

    /**
     * Spacing per voxel axis: column spacing, row spacing, slice spacing.
     */
    public double[] getSpacing() {
        return spacing.clone();
    }

    /**
     * Unit direction per voxel axis: row cosine, column cosine, slice normal.
     */
    public double[][] getDirection() {
        double[][] copy = new double[3][];
        for (int axis = 0; axis < 3; axis++) {
            copy[axis] = direction[axis].clone();
        }
        return copy;
    }

    /**
     * Homogeneous 4x4 voxel-to-patient matrix, row major.
     */
    public double[][] toMatrix() {
        double[][] m = new double[4][4];
        for (int r = 0; r < 3; r++) {
            System.arraycopy(forward[r], 0, m[r], 0, 3);
            m[r][3] = origin[r];
        }
        m[3][3] = 1.0;
        return m;
    }

    /**
     * Homogeneous 4x4 patient-to-voxel matrix, row major.
     */
    public double[][] toInverseMatrix() {
        double[][] m = new double[4][4];
        for (int r = 0; r < 3; r++) {
            System.arraycopy(inverse[r], 0, m[r], 0, 3);
            m[r][3] = -(inverse[r][0] * origin[0] + inverse[r][1] * origin[1] + inverse[r][2] * origin[2]);
        }
        m[3][3] = 1.0;
        return m;
    }

    static double[] cross(double[] a, double[] b) {
        return new double[]{
                a[1] * b[2] - a[2] * b[1],
                a[2] * b[0] - a[0] * b[2],
                a[0] * b[1] - a[1] * b[0]
        };
    }

    private static double[][] invert(double[][] m) {
        double det = m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
        if (Math.abs(det) < SINGULAR_EPSILON) {
            throw new IllegalArgumentException("Voxel transform is singular (determinant " + det + ")");
        }
        double[][] inv = new double[3][3];
        inv[0][0] = (m[1][1] * m[2][2] - m[1][2] * m[2][1]) / det;
        inv[0][1] = (m[0][2] * m[2][1] - m[0][1] * m[2][2]) / det;
        inv[0][2] = (m[0][1] * m[1][2] - m[0][2] * m[1][1]) / det;
        inv[1][0] = (m[1][2] * m[2][0] - m[1][0] * m[2][2]) / det;
        inv[1][1] = (m[0][0] * m[2][2] - m[0][2] * m[2][0]) / det;
        inv[1][2] = (m[0][2] * m[1][0] - m[0][0] * m[1][2]) / det;
        inv[2][0] = (m[1][0] * m[2][1] - m[1][1] * m[2][0]) / det;
        inv[2][1] = (m[0][1] * m[2][0] - m[0][0] * m[2][1]) / det;
        inv[2][2] = (m[0][0] * m[1][1] - m[0][1] * m[1][0]) / det;
        return inv;
    }

    @Override
    public String toString() {
        return "VoxelTransform[origin=" + Arrays.toString(origin)
                + ", spacing=" + Arrays.toString(spacing) + "]";
    }
}
