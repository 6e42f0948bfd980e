package org.nrg.xnat.rtconvert.dicom;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Sequence;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.dcm4che3.data.VR;
import org.dcm4che3.util.UIDUtils;
import org.nrg.xnat.rtconvert.geometry.Contour;
import org.nrg.xnat.rtconvert.model.ImageSeries;
import org.nrg.xnat.rtconvert.model.Region;
import org.nrg.xnat.rtconvert.model.SliceHeader;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Builds RT Structure Set datasets that reference an existing image series. The binary encoding is
 * left to dcm4che.
 */
public class StructureSetWriter {

    private static final Logger logger = LoggerFactory.getLogger(StructureSetWriter.class);

    // Detached Study Management SOP Class, as referenced by RT Referenced Study Sequence items
    private static final String STUDY_COMPONENT_SOP_CLASS = "1.2.840.10008.3.1.2.3.1";
    private static final String DEFAULT_INTERPRETED_TYPE = "ORGAN";
    private static final String ROI_GENERATION_ALGORITHM = "AUTOMATIC";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmmss");

    static final int[][] PALETTE = {
            {255, 0, 0}, {0, 255, 0}, {0, 0, 255}, {255, 255, 0}, {0, 255, 255}, {255, 0, 255},
            {255, 128, 0}, {128, 0, 255}, {0, 128, 255}, {128, 255, 0}, {255, 0, 128}, {0, 255, 128}
    };

    /**
     * Display color for the region at {@code index}, cycling through a fixed palette.
     */
    public static int[] defaultColor(int index) {
        return PALETTE[Math.floorMod(index, PALETTE.length)].clone();
    }

    public File write(StructureSet structureSet, ImageSeries reference, File target) throws IOException {
        Attributes attrs = toAttributes(structureSet, reference);
        DicomFiles.write(target, attrs);
        logger.info("Wrote structure set with {} regions to {}", structureSet.getRegions().size(), target);
        return target;
    }

    public Attributes toAttributes(StructureSet structureSet, ImageSeries reference) {
        if (!structureSet.appliesTo(reference.getFrameOfReferenceUid())) {
            throw new IllegalArgumentException("Structure set frames of reference "
                    + structureSet.getFrameOfReferenceUids() + " do not include series "
                    + reference.getSeriesInstanceUid());
        }
        String frameOfReferenceUid = reference.getFrameOfReferenceUid() != null
                ? reference.getFrameOfReferenceUid()
                : structureSet.getFrameOfReferenceUid();
        LocalDateTime now = LocalDateTime.now();

        Attributes attrs = new Attributes();
        String sopInstanceUid = structureSet.getSopInstanceUid() != null
                ? structureSet.getSopInstanceUid()
                : UIDUtils.createUID();
        attrs.setString(Tag.SOPClassUID, VR.UI, UID.RTStructureSetStorage);
        attrs.setString(Tag.SOPInstanceUID, VR.UI, sopInstanceUid);
        attrs.setString(Tag.Modality, VR.CS, StructureSetReader.RTSTRUCT_MODALITY);
        attrs.setString(Tag.SeriesInstanceUID, VR.UI, UIDUtils.createUID());
        attrs.setInt(Tag.SeriesNumber, VR.IS, 1);
        attrs.setInt(Tag.InstanceNumber, VR.IS, 1);

        // Patient and study modules are copied from the referenced images
        String studyUid = reference.getStudyInstanceUid() != null ? reference.getStudyInstanceUid() : UIDUtils.createUID();
        attrs.setString(Tag.StudyInstanceUID, VR.UI, studyUid);
        attrs.setString(Tag.PatientID, VR.LO, reference.getPatientId() != null ? reference.getPatientId() : "");
        attrs.setString(Tag.PatientName, VR.PN, reference.getPatientName() != null ? reference.getPatientName() : "");
        if (frameOfReferenceUid != null) {
            attrs.setString(Tag.FrameOfReferenceUID, VR.UI, frameOfReferenceUid);
        }

        String label = structureSet.getLabel() != null ? structureSet.getLabel() : "RTstruct";
        attrs.setString(Tag.StructureSetLabel, VR.SH, label);
        attrs.setString(Tag.StructureSetName, VR.LO, label);
        attrs.setString(Tag.StructureSetDate, VR.DA, now.format(DATE));
        attrs.setString(Tag.StructureSetTime, VR.TM, now.format(TIME));
        attrs.setString(Tag.SeriesDescription, VR.LO, label);

        addReferencedFrameOfReference(attrs, reference, studyUid, frameOfReferenceUid);

        List<Region> regions = structureSet.getRegions();
        Sequence roiSeq = attrs.newSequence(Tag.StructureSetROISequence, regions.size());
        Sequence contourSeq = attrs.newSequence(Tag.ROIContourSequence, regions.size());
        Sequence observationSeq = attrs.newSequence(Tag.RTROIObservationsSequence, regions.size());

        for (int r = 0; r < regions.size(); r++) {
            Region region = regions.get(r);
            int number = region.getNumber() > 0 ? region.getNumber() : r + 1;

            Attributes roi = new Attributes();
            roi.setInt(Tag.ROINumber, VR.IS, number);
            if (frameOfReferenceUid != null) {
                roi.setString(Tag.ReferencedFrameOfReferenceUID, VR.UI, frameOfReferenceUid);
            }
            roi.setString(Tag.ROIName, VR.LO, region.getName());
            roi.setString(Tag.ROIGenerationAlgorithm, VR.CS, ROI_GENERATION_ALGORITHM);
            roiSeq.add(roi);

            Attributes roiContour = new Attributes();
            int[] color = region.getDisplayColor() != null ? region.getDisplayColor() : defaultColor(r);
            roiContour.setInt(Tag.ROIDisplayColor, VR.IS, color);
            roiContour.setInt(Tag.ReferencedROINumber, VR.IS, number);
            Sequence contours = roiContour.newSequence(Tag.ContourSequence, region.getContours().size());
            int contourNumber = 1;
            for (Contour contour : region.getContours()) {
                contours.add(createContourItem(contour, contourNumber++, reference));
            }
            contourSeq.add(roiContour);

            Attributes observation = new Attributes();
            observation.setInt(Tag.ObservationNumber, VR.IS, number);
            observation.setInt(Tag.ReferencedROINumber, VR.IS, number);
            observation.setString(Tag.RTROIInterpretedType, VR.CS,
                    region.getInterpretedType() != null ? region.getInterpretedType() : DEFAULT_INTERPRETED_TYPE);
            observation.setString(Tag.ROIInterpreter, VR.PN, "");
            observationSeq.add(observation);
        }

        logger.debug("Built structure set {} with {} regions referencing series {}",
                sopInstanceUid, regions.size(), reference.getSeriesInstanceUid());
        return attrs;
    }

    private void addReferencedFrameOfReference(Attributes attrs, ImageSeries reference, String studyUid,
                                               String frameOfReferenceUid) {
        Attributes frame = new Attributes();
        if (frameOfReferenceUid != null) {
            frame.setString(Tag.FrameOfReferenceUID, VR.UI, frameOfReferenceUid);
        }
        Attributes study = new Attributes();
        study.setString(Tag.ReferencedSOPClassUID, VR.UI, STUDY_COMPONENT_SOP_CLASS);
        study.setString(Tag.ReferencedSOPInstanceUID, VR.UI, studyUid);

        Attributes series = new Attributes();
        series.setString(Tag.SeriesInstanceUID, VR.UI, reference.getSeriesInstanceUid());
        Sequence images = series.newSequence(Tag.ContourImageSequence, reference.size());
        for (SliceHeader slice : reference.getSlices()) {
            images.add(createImageReference(slice.getSopClassUid(), slice.getSopInstanceUid()));
        }

        study.newSequence(Tag.RTReferencedSeriesSequence, 1).add(series);
        frame.newSequence(Tag.RTReferencedStudySequence, 1).add(study);
        attrs.newSequence(Tag.ReferencedFrameOfReferenceSequence, 1).add(frame);
    }

    private Attributes createContourItem(Contour contour, int contourNumber, ImageSeries reference) {
        Attributes item = new Attributes();
        String sopUid = contour.getReferencedSopInstanceUid();
        if (sopUid != null) {
            item.newSequence(Tag.ContourImageSequence, 1)
                    .add(createImageReference(findSopClass(reference, sopUid), sopUid));
        }
        item.setString(Tag.ContourGeometricType, VR.CS, StructureSetReader.CLOSED_PLANAR);
        item.setInt(Tag.NumberOfContourPoints, VR.IS, contour.size());
        item.setInt(Tag.ContourNumber, VR.IS, contourNumber);
        item.setDouble(Tag.ContourData, VR.DS, contour.toFlatCoordinates());
        return item;
    }

    private Attributes createImageReference(String sopClassUid, String sopInstanceUid) {
        Attributes ref = new Attributes();
        ref.setString(Tag.ReferencedSOPClassUID, VR.UI, sopClassUid != null ? sopClassUid : UID.CTImageStorage);
        ref.setString(Tag.ReferencedSOPInstanceUID, VR.UI, sopInstanceUid);
        return ref;
    }

    private String findSopClass(ImageSeries reference, String sopInstanceUid) {
        for (SliceHeader slice : reference.getSlices()) {
            if (sopInstanceUid.equals(slice.getSopInstanceUid())) {
                return slice.getSopClassUid();
            }
        }
        return null;
    }
}
