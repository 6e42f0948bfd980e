package org.nrg.xnat.rtconvert.vector;

import org.junit.Before;
import org.junit.Test;
import org.nrg.xnat.rtconvert.SyntheticDicom;
import org.nrg.xnat.rtconvert.association.AssociationRegistry;
import org.nrg.xnat.rtconvert.association.AssociationTable;
import org.nrg.xnat.rtconvert.geometry.Contour;
import org.nrg.xnat.rtconvert.geometry.PatientPoint;
import org.nrg.xnat.rtconvert.geometry.VoxelTransform;
import org.nrg.xnat.rtconvert.model.LabeledMask;
import org.nrg.xnat.rtconvert.model.Region;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.nrg.xnat.rtconvert.model.VoxelGrid;
import org.nrg.xnat.rtconvert.raster.ContourRasterizer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MaskVectorizerTest {

    private MaskVectorizer vectorizer;

    @Before
    public void setUp() {
        vectorizer = new MaskVectorizer();
    }

    @Test
    public void ringGivesOneOuterContourAndOneHole() throws Exception {
        int size = 128;
        int[][][] labels = new int[1][size][size];
        for (int j = 0; j < size; j++) {
            for (int i = 0; i < size; i++) {
                double d2 = (i - 64) * (i - 64) + (j - 64) * (j - 64);
                labels[0][j][i] = d2 <= 50 * 50 && d2 > 33 * 33 ? 1 : 0;
            }
        }
        LabeledMask mask = LabeledMask.fromArray(labels, VoxelTransform.identity(), null,
                Collections.singletonList("Ring"));

        StructureSet structureSet = vectorizer.vectorize(mask, VoxelTransform.identity(), null);

        List<Contour> contours = structureSet.getRegions().get(0).getContours();
        assertEquals(2, contours.size());
        double outer = signedArea(contours.get(0));
        double hole = signedArea(contours.get(1));
        assertTrue("Outer boundary has positive area, got " + outer, outer > 0);
        assertTrue("Hole has negative area, got " + hole, hole < 0);
        assertEquals((double) mask.countVoxels(1), outer + hole, 1e-6);

        VoxelGrid grid = new VoxelGrid(1, size, size, new float[size * size], VoxelTransform.identity(),
                "1.2.3.4", "1.2.3.5", null);
        LabeledMask restored = new ContourRasterizer().rasterize(grid, structureSet,
                new AssociationRegistry(AssociationTable.empty(), Collections.singletonList("Ring"))).getMask();
        assertArrayEquals("The hole stays empty after painting", mask.toArray(), restored.toArray());
    }

    @Test
    public void vectorizingTwiceGivesIdenticalContours() throws Exception {
        LabeledMask mask = randomMask(new Random(7), 4, 24, 20, 3, VoxelTransform.identity());

        StructureSet first = vectorizer.vectorize(mask, VoxelTransform.identity(), Arrays.asList("A", "B", "C"));
        StructureSet second = vectorizer.vectorize(mask, VoxelTransform.identity(), Arrays.asList("A", "B", "C"));

        for (int r = 0; r < 3; r++) {
            assertEquals(first.getRegions().get(r).getContours(), second.getRegions().get(r).getContours());
        }
    }

    @Test
    public void rasterizingTheContoursRestoresTheMask() throws Exception {
        VoxelTransform transform = VoxelTransform.fromSliceGeometry(new double[]{-20, 15, 7},
                SyntheticDicom.AXIAL, new double[]{0.8, 1.25}, 2.5);
        VoxelGrid grid = new VoxelGrid(5, 30, 26, new float[5 * 30 * 26], transform, "1.2.3.4", "1.2.3.5", null);
        LabeledMask mask = randomMask(new Random(42), 5, 30, 26, 3, transform);
        List<String> names = Arrays.asList("Liver", "Kidney", "Spleen");

        StructureSet structureSet = vectorizer.vectorize(mask, grid, names);
        LabeledMask restored = new ContourRasterizer().rasterize(grid, structureSet,
                new AssociationRegistry(AssociationTable.empty(), names)).getMask();

        assertArrayEquals(mask.toArray(), restored.toArray());
    }

    @Test
    public void contourVerticesSitOnVoxelBoundaries() throws Exception {
        int[][][] labels = new int[2][5][5];
        labels[1][3][2] = 1;
        LabeledMask mask = LabeledMask.fromArray(labels, VoxelTransform.identity(), null, Collections.singletonList("Dot"));

        Contour contour = vectorizer.vectorize(mask, VoxelTransform.identity(), null)
                .getRegions().get(0).getContours().get(0);

        assertEquals(Arrays.asList(
                new PatientPoint(1.5, 2.5, 1),
                new PatientPoint(2.5, 2.5, 1),
                new PatientPoint(2.5, 3.5, 1),
                new PatientPoint(1.5, 3.5, 1)), contour.getPoints());
    }

    @Test
    public void referenceVolumeSuppliesUidsAndEmptyLabelsKeepTheirRegion() throws Exception {
        VoxelGrid grid = SyntheticDicom.grid(3, 6, 6, SyntheticDicom.FRAME_OF_REFERENCE_UID);
        int[][][] labels = new int[3][6][6];
        labels[2][1][1] = 1;
        LabeledMask mask = LabeledMask.fromArray(labels, grid.getTransform(), null, Arrays.asList("Heart", "Liver"));

        StructureSet structureSet = vectorizer.vectorize(mask, grid, Arrays.asList("Heart", "Liver"), "AutoSeg");

        assertEquals(SyntheticDicom.FRAME_OF_REFERENCE_UID, structureSet.getFrameOfReferenceUid());
        assertEquals(grid.getSeriesInstanceUid(), structureSet.getReferencedSeriesUid());
        assertEquals("AutoSeg", structureSet.getLabel());
        Region heart = structureSet.getRegions().get(0);
        assertEquals(1, heart.getNumber());
        assertEquals(grid.getSliceSopInstanceUids().get(2), heart.getContours().get(0).getReferencedSopInstanceUid());
        assertEquals("Liver", structureSet.getRegions().get(1).getName());
        assertTrue(structureSet.getRegions().get(1).getContours().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void labelsBeyondTheNameListAreRejected() throws Exception {
        LabeledMask mask = LabeledMask.fromArray(new int[][][]{{{0, 3}}}, VoxelTransform.identity(), null,
                Arrays.asList("A", "B", "C"));

        vectorizer.vectorize(mask, VoxelTransform.identity(), Arrays.asList("A", "B"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void maskMustMatchReferenceShape() throws Exception {
        LabeledMask mask = LabeledMask.fromArray(new int[1][4][4], VoxelTransform.identity(), null,
                Collections.singletonList("A"));

        vectorizer.vectorize(mask, SyntheticDicom.grid(2, 4, 4, null), Collections.singletonList("A"));
    }

    private static LabeledMask randomMask(Random random, int slices, int rows, int columns, int labelCount,
                                          VoxelTransform transform) {
        int[][][] labels = new int[slices][rows][columns];
        for (int k = 0; k < slices; k++) {
            for (int j = 0; j < rows; j++) {
                for (int i = 0; i < columns; i++) {
                    labels[k][j][i] = random.nextInt(3) == 0 ? 0 : 1 + random.nextInt(labelCount);
                }
            }
        }
        return LabeledMask.fromArray(labels, transform, null, Arrays.asList("A", "B", "C").subList(0, labelCount));
    }

    private static double signedArea(Contour contour) {
        List<PatientPoint> points = contour.getPoints();
        double sum = 0;
        for (int i = 0; i < points.size(); i++) {
            PatientPoint a = points.get(i);
            PatientPoint b = points.get((i + 1) % points.size());
            sum += a.getX() * b.getY() - b.getX() * a.getY();
        }
        return sum / 2;
    }
}
