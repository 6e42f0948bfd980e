package org.nrg.xnat.rtconvert.model;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;

import java.io.File;
import java.util.Arrays;

/**
 * Header-level geometry of a single image slice. Pixel data is not held here.
 */
public final class SliceHeader {

    private final File file;
    private final String sopInstanceUid;
    private final String sopClassUid;
    private final int instanceNumber;
    private final double[] imagePosition;
    private final double[] imageOrientation;
    private final double[] pixelSpacing;
    private final int rows;
    private final int columns;
    private final double sliceThickness;
    private final double spacingBetweenSlices;
    private final double rescaleSlope;
    private final double rescaleIntercept;

    private SliceHeader(Builder builder) {
        this.file = builder.file;
        this.sopInstanceUid = builder.sopInstanceUid;
        this.sopClassUid = builder.sopClassUid;
        this.instanceNumber = builder.instanceNumber;
        this.imagePosition = builder.imagePosition.clone();
        this.imageOrientation = builder.imageOrientation.clone();
        this.pixelSpacing = builder.pixelSpacing.clone();
        this.rows = builder.rows;
        this.columns = builder.columns;
        this.sliceThickness = builder.sliceThickness;
        this.spacingBetweenSlices = builder.spacingBetweenSlices;
        this.rescaleSlope = builder.rescaleSlope;
        this.rescaleIntercept = builder.rescaleIntercept;
    }

    /**
     * Read slice geometry from a header dataset. Returns null when the dataset carries no image plane geometry.
     */
    public static SliceHeader fromAttributes(File file, Attributes attrs) {
        double[] position = attrs.getDoubles(Tag.ImagePositionPatient);
        double[] orientation = attrs.getDoubles(Tag.ImageOrientationPatient);
        double[] spacing = attrs.getDoubles(Tag.PixelSpacing);
        int rows = attrs.getInt(Tag.Rows, 0);
        int columns = attrs.getInt(Tag.Columns, 0);

        if (position == null || position.length < 3
                || orientation == null || orientation.length < 6
                || rows <= 0 || columns <= 0) {
            return null;
        }
        if (spacing == null || spacing.length < 2) {
            spacing = attrs.getDoubles(Tag.ImagerPixelSpacing);
        }
        if (spacing == null || spacing.length < 2) {
            spacing = new double[]{1.0, 1.0};
        }

        return builder()
                .file(file)
                .sopInstanceUid(attrs.getString(Tag.SOPInstanceUID))
                .sopClassUid(attrs.getString(Tag.SOPClassUID))
                .instanceNumber(attrs.getInt(Tag.InstanceNumber, 0))
                .imagePosition(position)
                .imageOrientation(orientation)
                .pixelSpacing(spacing)
                .dimensions(rows, columns)
                .sliceThickness(attrs.getDouble(Tag.SliceThickness, 0.0))
                .spacingBetweenSlices(attrs.getDouble(Tag.SpacingBetweenSlices, 0.0))
                .rescale(attrs.getDouble(Tag.RescaleSlope, 1.0), attrs.getDouble(Tag.RescaleIntercept, 0.0))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public File getFile() {
        return file;
    }

    public String getSopInstanceUid() {
        return sopInstanceUid;
    }

    public String getSopClassUid() {
        return sopClassUid;
    }

    public int getInstanceNumber() {
        return instanceNumber;
    }

    public double[] getImagePosition() {
        return imagePosition.clone();
    }

    public double[] getImageOrientation() {
        return imageOrientation.clone();
    }

    /**
     * Pixel spacing in DICOM order: spacing between rows, then between columns.
     */
    public double[] getPixelSpacing() {
        return pixelSpacing.clone();
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public double getSliceThickness() {
        return sliceThickness;
    }

    public double getSpacingBetweenSlices() {
        return spacingBetweenSlices;
    }

    public double getRescaleSlope() {
        return rescaleSlope;
    }

    public double getRescaleIntercept() {
        return rescaleIntercept;
    }

    @Override
    public String toString() {
        return "SliceHeader[" + sopInstanceUid + " at " + Arrays.toString(imagePosition) + "]";
    }

    public static final class Builder {
        private File file;
        private String sopInstanceUid;
        private String sopClassUid;
        private int instanceNumber;
        private double[] imagePosition = new double[3];
        private double[] imageOrientation = {1, 0, 0, 0, 1, 0};
        private double[] pixelSpacing = {1.0, 1.0};
        private int rows;
        private int columns;
        private double sliceThickness;
        private double spacingBetweenSlices;
        private double rescaleSlope = 1.0;
        private double rescaleIntercept;

        private Builder() {
        }

        public Builder file(File file) {
            this.file = file;
            return this;
        }

        public Builder sopInstanceUid(String sopInstanceUid) {
            this.sopInstanceUid = sopInstanceUid;
            return this;
        }

        public Builder sopClassUid(String sopClassUid) {
            this.sopClassUid = sopClassUid;
            return this;
        }

        public Builder instanceNumber(int instanceNumber) {
            this.instanceNumber = instanceNumber;
            return this;
        }

        public Builder imagePosition(double... imagePosition) {
            this.imagePosition = Arrays.copyOf(imagePosition, 3);
            return this;
        }

        public Builder imageOrientation(double... imageOrientation) {
            this.imageOrientation = Arrays.copyOf(imageOrientation, 6);
            return this;
        }

        public Builder pixelSpacing(double... pixelSpacing) {
            this.pixelSpacing = Arrays.copyOf(pixelSpacing, 2);
            return this;
        }

        public Builder dimensions(int rows, int columns) {
            this.rows = rows;
            this.columns = columns;
            return this;
        }

        public Builder sliceThickness(double sliceThickness) {
            this.sliceThickness = sliceThickness;
            return this;
        }

        public Builder spacingBetweenSlices(double spacingBetweenSlices) {
            this.spacingBetweenSlices = spacingBetweenSlices;
            return this;
        }

        public Builder rescale(double slope, double intercept) {
            this.rescaleSlope = slope;
            this.rescaleIntercept = intercept;
            return this;
        }

        public SliceHeader build() {
            return new SliceHeader(this);
        }
    }
}
