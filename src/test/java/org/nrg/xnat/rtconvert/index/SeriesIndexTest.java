package org.nrg.xnat.rtconvert.index;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.nrg.xnat.rtconvert.SyntheticDicom;
import org.nrg.xnat.rtconvert.dicom.DicomFiles;
import org.nrg.xnat.rtconvert.dicom.StructureSetWriter;
import org.nrg.xnat.rtconvert.model.ImageSeries;
import org.nrg.xnat.rtconvert.model.Region;
import org.nrg.xnat.rtconvert.model.SliceHeader;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.nrg.xnat.rtconvert.report.ScanWarning;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class SeriesIndexTest {

    private static final String CT_SERIES = "1.2.826.0.1.3680043.9.7001.100";
    private static final String MR_SERIES = "1.2.826.0.1.3680043.9.7001.200";
    private static final String MR_FRAME = "1.2.826.0.1.3680043.9.7001.201";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private SeriesIndex index;
    private File root;
    private File structureFile;
    private File orphanFile;

    @Before
    public void setUp() throws IOException {
        index = new SeriesIndex();
        root = folder.newFolder("patient");

        ImageSeries ct = SyntheticDicom.writeSeries(new File(root, "study/ct"), CT_SERIES,
                SyntheticDicom.FRAME_OF_REFERENCE_UID, 3, 4, 4, 2.5);
        SyntheticDicom.writeSeries(new File(root, "study/mr/deeper"), MR_SERIES, MR_FRAME, 2, 4, 4, 1.0);

        StructureSetWriter writer = new StructureSetWriter();
        structureFile = writer.write(new StructureSet(SyntheticDicom.FRAME_OF_REFERENCE_UID,
                Collections.<Region>emptyList()), ct, new File(root, "elsewhere/rtstruct.dcm"));
        ImageSeries unknown = new ImageSeries("9.9.9.1", "9.9.9.2", Collections.<SliceHeader>emptyList());
        orphanFile = writer.write(new StructureSet("9.9.9.2", Collections.<Region>emptyList()), unknown,
                new File(root, "elsewhere/orphan.dcm"));
    }

    @Test
    public void findsSeriesAcrossNestedDirectories() {
        ScanResult result = index.scan(root);

        assertEquals(2, result.getCandidates().size());
        assertEquals("Candidates are ordered by series UID", CT_SERIES,
                result.getCandidates().get(0).getSeriesInstanceUid());
        assertEquals(3, result.findSeries(CT_SERIES).size());
        assertEquals(2, result.findSeries(MR_SERIES).size());
        assertEquals("CT", result.findSeries(CT_SERIES).getModality());
        assertNull(result.findSeries("1.2.3.404"));
    }

    @Test
    public void pairsStructureSetsByFrameOfReference() {
        ScanResult result = index.scan(root);

        SeriesCandidate ct = result.findCandidate(CT_SERIES);
        assertTrue(ct.hasStructureSets());
        assertEquals(Collections.singletonList(structureFile), ct.getStructureSetFiles());
        assertEquals(CT_SERIES, ct.getStructureSets().get(0).getReferencedSeriesUid());
        assertFalse(result.findCandidate(MR_SERIES).hasStructureSets());
        assertTrue(result.structureSetsFor(MR_SERIES).isEmpty());
    }

    @Test
    public void structureSetWithoutImagesIsReportedAsOrphan() {
        ScanResult result = index.scan(root);

        List<ScanWarning> orphans = result.warningsOf(ScanWarning.Reason.ORPHAN_STRUCTURE_SET);
        assertEquals(1, orphans.size());
        assertEquals(orphanFile, orphans.get(0).getFile());
        assertEquals(2, result.getStructureSets().size());
    }

    @Test
    public void unusableFilesAreSkippedWithReasons() throws IOException {
        File junk = new File(root, "notes.txt");
        Files.write(junk.toPath(), "scanner export log, not an image".getBytes(StandardCharsets.UTF_8));

        Attributes noSeries = SyntheticDicom.slice(CT_SERIES, SyntheticDicom.FRAME_OF_REFERENCE_UID, "1.2.3.77", 9, 50,
                4, 4, 0);
        noSeries.remove(Tag.SeriesInstanceUID);
        DicomFiles.write(new File(root, "misc/noseries.dcm"), noSeries);

        Attributes noGeometry = SyntheticDicom.slice("1.2.3.78", SyntheticDicom.FRAME_OF_REFERENCE_UID, "1.2.3.78.1", 1,
                0, 4, 4, 0);
        noGeometry.remove(Tag.ImagePositionPatient);
        DicomFiles.write(new File(root, "misc/nogeometry.dcm"), noGeometry);

        Attributes noFrame = SyntheticDicom.slice("1.2.3.79", null, "1.2.3.79.1", 1, 0, 4, 4, 0);
        DicomFiles.write(new File(root, "misc/noframe.dcm"), noFrame);

        ScanResult result = index.scan(root);

        assertEquals(2, result.getCandidates().size());
        assertEquals(1, result.warningsOf(ScanWarning.Reason.MISSING_SERIES_UID).size());
        assertEquals(1, result.warningsOf(ScanWarning.Reason.NO_IMAGE_GEOMETRY).size());
        assertEquals(1, result.warningsOf(ScanWarning.Reason.MISSING_FRAME_OF_REFERENCE).size());
        boolean junkSkipped = false;
        for (ScanWarning warning : result.getWarnings()) {
            junkSkipped |= warning.getFile().equals(junk);
        }
        assertTrue("Non-DICOM files are reported", junkSkipped);
    }

    @Test
    public void scanningAMissingDirectoryFindsNothing() {
        ScanResult result = index.scan(new File(root, "does-not-exist"));

        assertNotNull(result);
        assertTrue(result.getCandidates().isEmpty());
        assertTrue(result.getWarnings().isEmpty());
    }
}
