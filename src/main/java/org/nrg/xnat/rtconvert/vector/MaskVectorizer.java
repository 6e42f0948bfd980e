package org.nrg.xnat.rtconvert.vector;

import org.nrg.xnat.rtconvert.dicom.StructureSetWriter;
import org.nrg.xnat.rtconvert.exception.ConversionCancelledException;
import org.nrg.xnat.rtconvert.geometry.Contour;
import org.nrg.xnat.rtconvert.geometry.PatientPoint;
import org.nrg.xnat.rtconvert.geometry.VoxelTransform;
import org.nrg.xnat.rtconvert.model.LabeledMask;
import org.nrg.xnat.rtconvert.model.Region;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.nrg.xnat.rtconvert.model.VoxelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns a label mask back into planar contours, one region per label.
 *
 * Contour vertices sit on voxel boundaries (half-integer voxel coordinates), so filling the produced
 * contours at voxel centres gives back the original mask exactly.
 */
public class MaskVectorizer {

    private static final Logger logger = LoggerFactory.getLogger(MaskVectorizer.class);

    private static final String INTERPRETED_TYPE = "ORGAN";

    public StructureSet vectorize(LabeledMask mask, VoxelTransform transform, List<String> regionLabelOrder)
            throws ConversionCancelledException {
        return vectorize(mask, transform, regionLabelOrder, null, null, null);
    }

    /**
     * Vectorize against the image volume the mask was drawn on. Contours reference the SOP instance of
     * their slice and the result carries the volume's frame of reference and series.
     */
    public StructureSet vectorize(LabeledMask mask, VoxelGrid reference, List<String> regionLabelOrder)
            throws ConversionCancelledException {
        return vectorize(mask, reference, regionLabelOrder, null);
    }

    public StructureSet vectorize(LabeledMask mask, VoxelGrid reference, List<String> regionLabelOrder, String label)
            throws ConversionCancelledException {
        if (!Arrays.equals(mask.getShape(), reference.getShape())) {
            throw new IllegalArgumentException("Mask shape " + Arrays.toString(mask.getShape())
                    + " does not match series " + reference.getSeriesInstanceUid() + " shape "
                    + Arrays.toString(reference.getShape()));
        }
        return vectorize(mask, reference.getTransform(), regionLabelOrder, reference, reference.getFrameOfReferenceUid(),
                label);
    }

    private StructureSet vectorize(LabeledMask mask, VoxelTransform transform, List<String> regionLabelOrder,
                                   VoxelGrid reference, String frameOfReferenceUid, String label)
            throws ConversionCancelledException {
        List<String> order = regionLabelOrder != null ? regionLabelOrder : mask.getLabelNames();
        int maxLabel = mask.getMaxLabel();
        if (maxLabel > order.size()) {
            throw new IllegalArgumentException("Mask contains label " + maxLabel + " but only " + order.size()
                    + " region names were given");
        }
        if (frameOfReferenceUid == null) {
            frameOfReferenceUid = mask.getFrameOfReferenceUid();
        }

        int rows = mask.getRows();
        int columns = mask.getColumns();
        int[] labels = mask.toArray();
        int sliceSize = rows * columns;

        List<List<Contour>> contoursByLabel = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            contoursByLabel.add(new ArrayList<>());
        }

        boolean[] slice = new boolean[sliceSize];
        for (int k = 0; k < mask.getSlices(); k++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ConversionCancelledException("Vectorization cancelled at slice " + k);
            }
            String sopInstanceUid = reference != null ? reference.getSliceSopInstanceUids().get(k) : null;
            int offset = k * sliceSize;
            for (int value = 1; value <= maxLabel; value++) {
                boolean any = false;
                for (int i = 0; i < sliceSize; i++) {
                    slice[i] = labels[offset + i] == value;
                    any |= slice[i];
                }
                if (!any) {
                    continue;
                }
                for (int[][] loop : new BoundaryTracer(slice, rows, columns).trace()) {
                    contoursByLabel.get(value - 1).add(toContour(loop, k, transform, sopInstanceUid));
                }
            }
        }

        List<Region> regions = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            List<Contour> contours = contoursByLabel.get(i);
            if (contours.isEmpty()) {
                logger.debug("Region '{}' (label {}) has no voxels", order.get(i), i + 1);
            }
            regions.add(new Region(i + 1, order.get(i), frameOfReferenceUid, StructureSetWriter.defaultColor(i),
                    INTERPRETED_TYPE, contours));
        }

        String referencedSeriesUid = reference != null ? reference.getSeriesInstanceUid() : null;
        StructureSet structureSet = new StructureSet(null, label, frameOfReferenceUid, referencedSeriesUid, null, regions);
        logger.info("Vectorized mask {} into {} regions", mask, regions.size());
        return structureSet;
    }

    private static Contour toContour(int[][] loop, int slice, VoxelTransform transform, String sopInstanceUid) {
        List<PatientPoint> points = new ArrayList<>(loop.length);
        for (int[] corner : loop) {
            points.add(transform.voxelToPatient(corner[0] - 0.5, corner[1] - 0.5, slice));
        }
        return new Contour(points, sopInstanceUid);
    }
}
