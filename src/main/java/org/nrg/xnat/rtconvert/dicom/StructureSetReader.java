package org.nrg.xnat.rtconvert.dicom;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Sequence;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.nrg.xnat.rtconvert.geometry.Contour;
import org.nrg.xnat.rtconvert.model.Region;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses RT Structure Set datasets into {@link StructureSet} values.
 */
public class StructureSetReader {

    private static final Logger logger = LoggerFactory.getLogger(StructureSetReader.class);

    static final String RTSTRUCT_MODALITY = "RTSTRUCT";
    static final String CLOSED_PLANAR = "CLOSED_PLANAR";

    public StructureSet read(File file) throws IOException {
        Attributes attrs = DicomFiles.readDataset(file);
        if (!isStructureSet(attrs)) {
            throw new IOException(file + " is not an RT Structure Set");
        }
        return read(attrs, file);
    }

    /**
     * Raw region names of a structure set file, in Structure Set ROI Sequence order.
     */
    public List<String> listRegionNames(File file) throws IOException {
        return read(file).getRegionNames();
    }

    public StructureSet read(Attributes attrs, File sourceFile) {
        Set<String> frames = referencedFrameOfReferences(attrs);
        // regions without their own frame inherit it only when the set references exactly one
        String defaultFrame = frames.size() == 1 ? frames.iterator().next() : null;
        if (frames.size() > 1) {
            logger.debug("Structure set {} references frames of reference {}",
                    attrs.getString(Tag.SOPInstanceUID), frames);
        }

        Map<Integer, Attributes> roiContours = new HashMap<>();
        Sequence contourSeq = attrs.getSequence(Tag.ROIContourSequence);
        if (contourSeq != null) {
            for (Attributes item : contourSeq) {
                roiContours.put(item.getInt(Tag.ReferencedROINumber, -1), item);
            }
        }

        Map<Integer, String> interpretedTypes = new HashMap<>();
        Sequence observationSeq = attrs.getSequence(Tag.RTROIObservationsSequence);
        if (observationSeq != null) {
            for (Attributes item : observationSeq) {
                interpretedTypes.put(item.getInt(Tag.ReferencedROINumber, -1), item.getString(Tag.RTROIInterpretedType));
            }
        }

        List<Region> regions = new ArrayList<>();
        Sequence roiSeq = attrs.getSequence(Tag.StructureSetROISequence);
        if (roiSeq != null) {
            for (Attributes roi : roiSeq) {
                int number = roi.getInt(Tag.ROINumber, -1);
                String name = roi.getString(Tag.ROIName, "ROI-" + number);
                String regionFrame = roi.getString(Tag.ReferencedFrameOfReferenceUID, defaultFrame);

                Attributes roiContour = roiContours.get(number);
                int[] color = null;
                List<Contour> contours = new ArrayList<>();
                if (roiContour != null) {
                    color = roiContour.getInts(Tag.ROIDisplayColor);
                    contours = readContours(roiContour, name);
                } else {
                    logger.debug("Region {} ({}) has no ROI Contour item", name, number);
                }
                regions.add(new Region(number, name, regionFrame, color, interpretedTypes.get(number), contours));
            }
        }

        StructureSet structureSet = new StructureSet(
                attrs.getString(Tag.SOPInstanceUID),
                attrs.getString(Tag.StructureSetLabel),
                frames,
                referencedSeriesUid(attrs),
                sourceFile,
                regions);
        logger.debug("Parsed {} from {}", structureSet, sourceFile);
        return structureSet;
    }

    private List<Contour> readContours(Attributes roiContour, String regionName) {
        List<Contour> contours = new ArrayList<>();
        Sequence seq = roiContour.getSequence(Tag.ContourSequence);
        if (seq == null) {
            return contours;
        }
        int skipped = 0;
        for (Attributes item : seq) {
            String type = item.getString(Tag.ContourGeometricType, CLOSED_PLANAR);
            double[] data = item.getDoubles(Tag.ContourData);
            if (!CLOSED_PLANAR.equals(type) || data == null || data.length < 9 || data.length % 3 != 0) {
                skipped++;
                continue;
            }
            String referencedSop = null;
            Sequence images = item.getSequence(Tag.ContourImageSequence);
            if (images != null && !images.isEmpty()) {
                referencedSop = images.get(0).getString(Tag.ReferencedSOPInstanceUID);
            }
            contours.add(Contour.fromFlatCoordinates(data, referencedSop));
        }
        if (skipped > 0) {
            logger.debug("Skipped {} non-polygonal contours of region {}", skipped, regionName);
        }
        return contours;
    }

    public static boolean isStructureSet(Attributes attrs) {
        return RTSTRUCT_MODALITY.equals(attrs.getString(Tag.Modality))
                || UID.RTStructureSetStorage.equals(attrs.getString(Tag.SOPClassUID));
    }

    /**
     * Frame of reference UIDs a structure set refers to, in document order.
     */
    public static Set<String> referencedFrameOfReferences(Attributes attrs) {
        Set<String> frames = new LinkedHashSet<>();
        Sequence refFrames = attrs.getSequence(Tag.ReferencedFrameOfReferenceSequence);
        if (refFrames != null) {
            for (Attributes item : refFrames) {
                String uid = item.getString(Tag.FrameOfReferenceUID);
                if (uid != null && !uid.isEmpty()) {
                    frames.add(uid);
                }
            }
        }
        Sequence roiSeq = attrs.getSequence(Tag.StructureSetROISequence);
        if (roiSeq != null) {
            for (Attributes item : roiSeq) {
                String uid = item.getString(Tag.ReferencedFrameOfReferenceUID);
                if (uid != null && !uid.isEmpty()) {
                    frames.add(uid);
                }
            }
        }
        String own = attrs.getString(Tag.FrameOfReferenceUID);
        if (own != null && !own.isEmpty()) {
            frames.add(own);
        }
        return frames;
    }

    /**
     * Series Instance UID named in the RT Referenced Series Sequence, or null.
     */
    public static String referencedSeriesUid(Attributes attrs) {
        Sequence refFrames = attrs.getSequence(Tag.ReferencedFrameOfReferenceSequence);
        if (refFrames == null) {
            return null;
        }
        for (Attributes frame : refFrames) {
            Sequence studies = frame.getSequence(Tag.RTReferencedStudySequence);
            if (studies == null) {
                continue;
            }
            for (Attributes study : studies) {
                Sequence series = study.getSequence(Tag.RTReferencedSeriesSequence);
                if (series == null) {
                    continue;
                }
                for (Attributes item : series) {
                    String uid = item.getString(Tag.SeriesInstanceUID);
                    if (uid != null && !uid.isEmpty()) {
                        return uid;
                    }
                }
            }
        }
        return null;
    }
}
