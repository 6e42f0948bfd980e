package org.nrg.xnat.rtconvert.volume;

import org.nrg.xnat.rtconvert.config.ConversionSettings;
import org.nrg.xnat.rtconvert.dicom.PixelDataReader;
import org.nrg.xnat.rtconvert.exception.ConversionCancelledException;
import org.nrg.xnat.rtconvert.exception.InconsistentGeometryException;
import org.nrg.xnat.rtconvert.geometry.VoxelTransform;
import org.nrg.xnat.rtconvert.model.ImageSeries;
import org.nrg.xnat.rtconvert.model.SliceHeader;
import org.nrg.xnat.rtconvert.model.VoxelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the slices of a series in space, checks that they form a regular grid and loads them into a
 * {@link VoxelGrid}.
 */
public class VolumeAssembler {

    private static final Logger logger = LoggerFactory.getLogger(VolumeAssembler.class);

    private final ConversionSettings settings;
    private final PixelDataReader pixelReader;

    public VolumeAssembler() {
        this(ConversionSettings.defaults(), new PixelDataReader());
    }

    public VolumeAssembler(ConversionSettings settings, PixelDataReader pixelReader) {
        this.settings = settings;
        this.pixelReader = pixelReader;
    }

    /**
     * Validate geometry and load pixel data for every slice of the series.
     */
    public VoxelGrid assemble(ImageSeries series)
            throws InconsistentGeometryException, ConversionCancelledException, IOException {
        SeriesGeometry geometry = computeGeometry(series);
        List<SliceHeader> ordered = geometry.getOrderedSlices();
        int rows = geometry.getRows();
        int columns = geometry.getColumns();
        int sliceSize = rows * columns;

        float[] data = new float[ordered.size() * sliceSize];
        List<String> sopUids = new ArrayList<>(ordered.size());
        for (int k = 0; k < ordered.size(); k++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ConversionCancelledException("Assembly of series " + series.getSeriesInstanceUid()
                        + " cancelled at slice " + k);
            }
            SliceHeader slice = ordered.get(k);
            float[] pixels = pixelReader.readSlice(slice);
            if (pixels.length != sliceSize) {
                throw new InconsistentGeometryException(series.getSeriesInstanceUid(),
                        "slice " + slice.getSopInstanceUid() + " decoded to " + pixels.length
                                + " pixels, expected " + sliceSize);
            }
            System.arraycopy(pixels, 0, data, k * sliceSize, sliceSize);
            sopUids.add(slice.getSopInstanceUid());
        }

        VoxelGrid grid = new VoxelGrid(ordered.size(), rows, columns, data, geometry.getTransform(),
                series.getSeriesInstanceUid(), series.getFrameOfReferenceUid(), sopUids);
        logger.info("Assembled series {} into {} (slice spacing {} mm)",
                series.getSeriesInstanceUid(), grid, geometry.getSliceSpacing());
        return grid;
    }

    /**
     * Sort slices along the normal and derive the voxel transform, without reading Pixel Data.
     */
    public SeriesGeometry computeGeometry(ImageSeries series) throws InconsistentGeometryException {
        String seriesUid = series.getSeriesInstanceUid();
        List<SliceHeader> slices = series.getSlices();
        if (slices.isEmpty()) {
            throw new InconsistentGeometryException(seriesUid, "series has no slices");
        }

        SliceHeader reference = slices.get(0);
        double tolerance = settings.getGeometryTolerance();
        for (SliceHeader slice : slices) {
            if (slice.getRows() != reference.getRows() || slice.getColumns() != reference.getColumns()) {
                throw new InconsistentGeometryException(seriesUid, "slice " + slice.getSopInstanceUid()
                        + " is " + slice.getRows() + "x" + slice.getColumns() + ", expected "
                        + reference.getRows() + "x" + reference.getColumns());
            }
            if (!nearlyEqual(slice.getPixelSpacing(), reference.getPixelSpacing(), tolerance)) {
                throw new InconsistentGeometryException(seriesUid, "pixel spacing of slice "
                        + slice.getSopInstanceUid() + " differs from the rest of the series");
            }
            if (!nearlyEqual(slice.getImageOrientation(), reference.getImageOrientation(), tolerance)) {
                throw new InconsistentGeometryException(seriesUid, "orientation of slice "
                        + slice.getSopInstanceUid() + " differs from the rest of the series");
            }
        }

        double[] orientation = reference.getImageOrientation();
        final double[] normal = cross(orientation);
        double length = Math.sqrt(normal[0] * normal[0] + normal[1] * normal[1] + normal[2] * normal[2]);
        if (length < 1e-6) {
            throw new InconsistentGeometryException(seriesUid, "row and column directions are parallel");
        }

        List<SliceHeader> ordered = new ArrayList<>(slices);
        ordered.sort(Comparator.comparingDouble(slice -> project(slice, normal)));

        double sliceSpacing;
        if (ordered.size() == 1) {
            sliceSpacing = fallbackSpacing(reference);
        } else {
            double[] positions = new double[ordered.size()];
            for (int k = 0; k < positions.length; k++) {
                positions[k] = project(ordered.get(k), normal) / length;
            }
            for (int k = 1; k < positions.length; k++) {
                if (positions[k] - positions[k - 1] <= settings.getSpacingTolerance()) {
                    throw new InconsistentGeometryException(seriesUid, "duplicate slice position at index " + k
                            + " (" + ordered.get(k).getSopInstanceUid() + ")");
                }
            }
            sliceSpacing = (positions[positions.length - 1] - positions[0]) / (positions.length - 1);
            for (int k = 1; k < positions.length; k++) {
                double gap = positions[k] - positions[k - 1];
                if (Math.abs(gap - sliceSpacing) > settings.getSpacingTolerance()) {
                    throw new InconsistentGeometryException(seriesUid, String.format(
                            "non-uniform slice spacing: gap %.4f mm at index %d, mean %.4f mm", gap, k, sliceSpacing));
                }
            }
        }

        VoxelTransform transform = VoxelTransform.fromSliceGeometry(
                ordered.get(0).getImagePosition(), orientation, reference.getPixelSpacing(), sliceSpacing);
        return new SeriesGeometry(ordered, reference.getRows(), reference.getColumns(), sliceSpacing, transform);
    }

    private static double fallbackSpacing(SliceHeader slice) {
        if (slice.getSpacingBetweenSlices() > 0) {
            return slice.getSpacingBetweenSlices();
        }
        if (slice.getSliceThickness() > 0) {
            return slice.getSliceThickness();
        }
        return 1.0;
    }

    private static double project(SliceHeader slice, double[] normal) {
        double[] p = slice.getImagePosition();
        return p[0] * normal[0] + p[1] * normal[1] + p[2] * normal[2];
    }

    private static double[] cross(double[] orientation) {
        return new double[]{
                orientation[1] * orientation[5] - orientation[2] * orientation[4],
                orientation[2] * orientation[3] - orientation[0] * orientation[5],
                orientation[0] * orientation[4] - orientation[1] * orientation[3]
        };
    }

    private static boolean nearlyEqual(double[] a, double[] b, double tolerance) {
        if (a.length != b.length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            if (Math.abs(a[i] - b[i]) > tolerance) {
                return false;
            }
        }
        return true;
    }
}
