package org.nrg.xnat.rtconvert.raster;

import org.nrg.xnat.rtconvert.association.AssociationRegistry;
import org.nrg.xnat.rtconvert.config.ConversionSettings;
import org.nrg.xnat.rtconvert.exception.ConversionCancelledException;
import org.nrg.xnat.rtconvert.exception.FrameOfReferenceMismatchException;
import org.nrg.xnat.rtconvert.exception.InvalidConversionConfigException;
import org.nrg.xnat.rtconvert.exception.SliceAlignmentException;
import org.nrg.xnat.rtconvert.geometry.Contour;
import org.nrg.xnat.rtconvert.geometry.PatientPoint;
import org.nrg.xnat.rtconvert.geometry.VoxelTransform;
import org.nrg.xnat.rtconvert.model.LabeledMask;
import org.nrg.xnat.rtconvert.model.Region;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.nrg.xnat.rtconvert.model.VoxelGrid;
import org.nrg.xnat.rtconvert.report.ConversionWarning;
import org.nrg.xnat.rtconvert.report.ForeignFrameRegionWarning;
import org.nrg.xnat.rtconvert.report.RejectedContour;
import org.nrg.xnat.rtconvert.report.UnresolvedRegionWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Paints the wanted regions of a structure set into a label mask on the grid of an image volume.
 *
 * Every raw region is filled on its own with even-odd parity per slice, so holes drawn as nested
 * contours stay empty. Raw regions resolving to the same wanted name are unioned, and wanted names are
 * painted in the registry's paint order with later regions overwriting earlier ones.
 */
public class ContourRasterizer {

    private static final Logger logger = LoggerFactory.getLogger(ContourRasterizer.class);

    private final ConversionSettings settings;

    public ContourRasterizer() {
        this(ConversionSettings.defaults());
    }

    public ContourRasterizer(ConversionSettings settings) {
        this.settings = settings;
    }

    public RasterResult rasterize(VoxelGrid grid, StructureSet structureSet, AssociationRegistry registry)
            throws FrameOfReferenceMismatchException, ConversionCancelledException {
        if (registry == null || registry.wantedRegions().isEmpty()) {
            throw new InvalidConversionConfigException("At least one wanted region is required");
        }
        if (!structureSet.appliesTo(grid.getFrameOfReferenceUid())) {
            throw new FrameOfReferenceMismatchException(grid.getFrameOfReferenceUid(),
                    String.join(", ", structureSet.getFrameOfReferenceUids()));
        }

        List<ConversionWarning> warnings = new ArrayList<>();
        Map<String, List<Region>> contributors = new LinkedHashMap<>();
        for (String name : registry.getLabelOrder()) {
            contributors.put(name, new ArrayList<>());
        }
        for (Region region : structureSet.getRegions()) {
            Optional<String> wanted = registry.resolveWanted(region.getName());
            if (!wanted.isPresent()) {
                logger.debug("Skipping region '{}', not wanted", region.getName());
            } else if (!onGrid(region, grid)) {
                logger.warn("Skipping region '{}' drawn on frame of reference {}, series {} uses {}",
                        region.getName(), region.getFrameOfReferenceUid(), grid.getSeriesInstanceUid(),
                        grid.getFrameOfReferenceUid());
                warnings.add(new ForeignFrameRegionWarning(region.getName(), region.getFrameOfReferenceUid(),
                        grid.getFrameOfReferenceUid()));
            } else {
                contributors.get(wanted.get()).add(region);
            }
        }

        int sliceSize = grid.getRows() * grid.getColumns();
        int[] labels = new int[grid.getSlices() * sliceSize];

        for (String name : registry.getPaintOrder()) {
            List<Region> regions = contributors.get(name);
            if (regions.isEmpty()) {
                logger.warn("No region of structure set {} resolves to '{}'", structureSet.getSopInstanceUid(), name);
                warnings.add(new UnresolvedRegionWarning(name));
                continue;
            }

            boolean[] union = new boolean[labels.length];
            for (Region region : regions) {
                checkCancelled(name);
                fillRegion(region, grid, union, warnings);
            }

            int label = registry.labelOf(name);
            int painted = 0;
            int overwritten = 0;
            for (int i = 0; i < union.length; i++) {
                if (union[i]) {
                    if (labels[i] != 0 && labels[i] != label) {
                        overwritten++;
                    }
                    labels[i] = label;
                    painted++;
                }
            }
            logger.debug("Painted '{}' as label {} from {} regions: {} voxels, {} taken over from other labels",
                    name, label, regions.size(), painted, overwritten);
        }

        LabeledMask mask = new LabeledMask(grid.getSlices(), grid.getRows(), grid.getColumns(), labels,
                grid.getTransform(), grid.getFrameOfReferenceUid(), registry.getLabelOrder());
        logger.info("Rasterized {} wanted regions of structure set {} onto series {} with {} warnings",
                registry.getLabelOrder().size(), structureSet.getSopInstanceUid(), grid.getSeriesInstanceUid(),
                warnings.size());
        return new RasterResult(mask, warnings);
    }

    private static boolean onGrid(Region region, VoxelGrid grid) {
        return region.getFrameOfReferenceUid() == null || grid.getFrameOfReferenceUid() == null
                || region.getFrameOfReferenceUid().equals(grid.getFrameOfReferenceUid());
    }

    private void fillRegion(Region region, VoxelGrid grid, boolean[] union, List<ConversionWarning> warnings) {
        Map<Integer, List<double[][]>> bySlice = new TreeMap<>();
        List<Contour> contours = region.getContours();
        for (int c = 0; c < contours.size(); c++) {
            Contour contour = contours.get(c);
            if (contour.size() < 3) {
                logger.debug("Ignoring contour {} of region '{}' with {} points", c, region.getName(), contour.size());
                continue;
            }
            try {
                int slice = toVoxelPolygon(contour, grid, bySlice);
                logger.trace("Contour {} of region '{}' lies on slice {}", c, region.getName(), slice);
            } catch (SliceAlignmentException e) {
                logger.warn("Rejected contour {} of region '{}': {}", c, region.getName(), e.getMessage());
                warnings.add(new RejectedContour(region.getName(), c, e));
            }
        }

        int rows = grid.getRows();
        int columns = grid.getColumns();
        int sliceSize = rows * columns;
        boolean[] sliceMask = new boolean[sliceSize];
        for (Map.Entry<Integer, List<double[][]>> entry : bySlice.entrySet()) {
            Arrays.fill(sliceMask, false);
            ScanlineFiller.fill(entry.getValue(), rows, columns, sliceMask);
            int offset = entry.getKey() * sliceSize;
            for (int i = 0; i < sliceSize; i++) {
                if (sliceMask[i]) {
                    union[offset + i] = true;
                }
            }
        }
    }

    /**
     * Map a contour into voxel space and file it under its slice index.
     *
     * @return the slice the contour lies on
     */
    private int toVoxelPolygon(Contour contour, VoxelGrid grid, Map<Integer, List<double[][]>> bySlice)
            throws SliceAlignmentException {
        VoxelTransform transform = grid.getTransform();
        double tolerance = settings.getSliceTolerance();
        List<PatientPoint> points = contour.getPoints();
        double[] xs = new double[points.size()];
        double[] ys = new double[points.size()];
        int slice = 0;
        for (int i = 0; i < points.size(); i++) {
            double[] voxel = transform.patientToVoxel(points.get(i));
            double k = voxel[2];
            if (i == 0) {
                slice = (int) Math.round(k);
                if (slice < 0 || slice >= grid.getSlices()) {
                    throw new SliceAlignmentException(String.format(
                            "slice coordinate %.3f is outside the volume of %d slices", k, grid.getSlices()), k);
                }
            }
            if (Math.abs(k - slice) > tolerance) {
                throw new SliceAlignmentException(String.format(
                        "point %d has slice coordinate %.3f, more than %.3f from slice %d", i, k, tolerance, slice), k);
            }
            xs[i] = ScanlineFiller.snap(voxel[0]);
            ys[i] = ScanlineFiller.snap(voxel[1]);
        }
        bySlice.computeIfAbsent(slice, key -> new ArrayList<>()).add(new double[][]{xs, ys});
        return slice;
    }

    private static void checkCancelled(String regionName) throws ConversionCancelledException {
        if (Thread.currentThread().isInterrupted()) {
            throw new ConversionCancelledException("Rasterization cancelled while painting '" + regionName + "'");
        }
    }
}
