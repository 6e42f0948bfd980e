package org.nrg.xnat.rtconvert.index;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;
import org.nrg.xnat.rtconvert.dicom.DicomFiles;
import org.nrg.xnat.rtconvert.dicom.StructureSetReader;
import org.nrg.xnat.rtconvert.model.ImageSeries;
import org.nrg.xnat.rtconvert.model.SliceHeader;
import org.nrg.xnat.rtconvert.report.ScanWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Scans a directory tree for image series and RT Structure Sets and pairs them by frame of reference.
 *
 * Only headers are read; Pixel Data is left for the volume assembler. Files that cannot be used are
 * reported as {@link ScanWarning}s and never fail the scan.
 */
public class SeriesIndex {

    private static final Logger logger = LoggerFactory.getLogger(SeriesIndex.class);

    public ScanResult scan(File root) {
        List<ScanWarning> warnings = new ArrayList<>();
        Map<String, SeriesAccumulator> series = new TreeMap<>();
        List<StructureSetEntry> structureSets = new ArrayList<>();

        List<File> files = new ArrayList<>();
        collectFiles(root, files);
        files.sort(Comparator.comparing(File::getPath));
        logger.debug("Scanning {} files under {}", files.size(), root);

        for (File file : files) {
            if (!file.canRead()) {
                warnings.add(new ScanWarning(file, ScanWarning.Reason.UNREADABLE, null));
                continue;
            }
            Attributes attrs;
            try {
                attrs = DicomFiles.readHeader(file);
            } catch (Exception e) {
                logger.debug("Error reading DICOM candidate {}", file.getAbsolutePath(), e);
                warnings.add(new ScanWarning(file, ScanWarning.Reason.NOT_DICOM, e.getMessage()));
                continue;
            }
            if (!attrs.containsValue(Tag.SOPClassUID) && !attrs.containsValue(Tag.SOPInstanceUID)) {
                warnings.add(new ScanWarning(file, ScanWarning.Reason.NOT_DICOM, "no SOP identifiers"));
                continue;
            }

            if (StructureSetReader.isStructureSet(attrs)) {
                indexStructureSet(file, attrs, structureSets, warnings);
            } else {
                indexImage(file, attrs, series, warnings);
            }
        }

        List<SeriesCandidate> candidates = new ArrayList<>();
        List<StructureSetEntry> matched = new ArrayList<>();
        for (SeriesAccumulator acc : series.values()) {
            ImageSeries imageSeries = acc.build();
            List<StructureSetEntry> pairs = new ArrayList<>();
            for (StructureSetEntry entry : structureSets) {
                if (entry.references(imageSeries.getFrameOfReferenceUid())) {
                    pairs.add(entry);
                    matched.add(entry);
                }
            }
            candidates.add(new SeriesCandidate(imageSeries, pairs));
        }
        for (StructureSetEntry entry : structureSets) {
            if (!matched.contains(entry)) {
                warnings.add(new ScanWarning(entry.getFile(), ScanWarning.Reason.ORPHAN_STRUCTURE_SET,
                        "no image series with frame of reference " + entry.getFrameOfReferenceUids()));
            }
        }

        ScanResult result = new ScanResult(root, candidates, structureSets, warnings);
        logger.info("Scan of {} found {} series and {} structure sets ({} files skipped)",
                root, candidates.size(), structureSets.size(), warnings.size());
        return result;
    }

    private void indexStructureSet(File file, Attributes attrs, List<StructureSetEntry> structureSets,
                                   List<ScanWarning> warnings) {
        Set<String> frames = StructureSetReader.referencedFrameOfReferences(attrs);
        if (frames.isEmpty()) {
            warnings.add(new ScanWarning(file, ScanWarning.Reason.MISSING_FRAME_OF_REFERENCE, "structure set"));
            return;
        }
        structureSets.add(new StructureSetEntry(file,
                attrs.getString(Tag.SOPInstanceUID),
                attrs.getString(Tag.StructureSetLabel),
                frames,
                StructureSetReader.referencedSeriesUid(attrs)));
        logger.debug("Indexed structure set {} for frames {}", file.getName(), frames);
    }

    private void indexImage(File file, Attributes attrs, Map<String, SeriesAccumulator> series,
                            List<ScanWarning> warnings) {
        String seriesUid = attrs.getString(Tag.SeriesInstanceUID);
        if (seriesUid == null || seriesUid.isEmpty()) {
            warnings.add(new ScanWarning(file, ScanWarning.Reason.MISSING_SERIES_UID, null));
            return;
        }
        SliceHeader slice = SliceHeader.fromAttributes(file, attrs);
        if (slice == null) {
            warnings.add(new ScanWarning(file, ScanWarning.Reason.NO_IMAGE_GEOMETRY,
                    "modality " + attrs.getString(Tag.Modality, "unknown")));
            return;
        }
        String frameOfReferenceUid = attrs.getString(Tag.FrameOfReferenceUID);
        if (frameOfReferenceUid == null || frameOfReferenceUid.isEmpty()) {
            warnings.add(new ScanWarning(file, ScanWarning.Reason.MISSING_FRAME_OF_REFERENCE, null));
            return;
        }

        SeriesAccumulator acc = series.get(seriesUid);
        if (acc == null) {
            acc = new SeriesAccumulator(seriesUid, frameOfReferenceUid, attrs);
            series.put(seriesUid, acc);
        } else if (!acc.frameOfReferenceUid.equals(frameOfReferenceUid)) {
            logger.warn("Slice {} of series {} has frame of reference {}, expected {}",
                    file.getName(), seriesUid, frameOfReferenceUid, acc.frameOfReferenceUid);
            warnings.add(new ScanWarning(file, ScanWarning.Reason.MISSING_FRAME_OF_REFERENCE,
                    "frame of reference differs from the rest of series " + seriesUid));
            return;
        }
        acc.slices.add(slice);
    }

    private void collectFiles(File root, List<File> sink) {
        if (root == null || !root.exists()) {
            return;
        }
        if (root.isFile()) {
            sink.add(root);
            return;
        }

        File[] children = root.listFiles();
        if (children == null) {
            return;
        }
        Arrays.sort(children);
        for (File child : children) {
            collectFiles(child, sink);
        }
    }

    private static final class SeriesAccumulator {
        private final String seriesUid;
        private final String frameOfReferenceUid;
        private final String studyUid;
        private final String modality;
        private final String patientId;
        private final String patientName;
        private final String description;
        private final List<SliceHeader> slices = new ArrayList<>();

        SeriesAccumulator(String seriesUid, String frameOfReferenceUid, Attributes first) {
            this.seriesUid = seriesUid;
            this.frameOfReferenceUid = frameOfReferenceUid;
            this.studyUid = first.getString(Tag.StudyInstanceUID);
            this.modality = first.getString(Tag.Modality);
            this.patientId = first.getString(Tag.PatientID);
            this.patientName = first.getString(Tag.PatientName);
            this.description = first.getString(Tag.SeriesDescription);
        }

        ImageSeries build() {
            return new ImageSeries(seriesUid, frameOfReferenceUid, studyUid, modality, patientId, patientName,
                    description, slices);
        }
    }
}
