package org.nrg.xnat.rtconvert.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Slice headers belonging to one image acquisition, keyed by series and frame of reference.
 * Slices are kept in discovery order; spatial ordering happens at assembly.
 */
public final class ImageSeries {

    private final String seriesInstanceUid;
    private final String frameOfReferenceUid;
    private final String studyInstanceUid;
    private final String modality;
    private final String patientId;
    private final String patientName;
    private final String seriesDescription;
    private final List<SliceHeader> slices;

    public ImageSeries(String seriesInstanceUid, String frameOfReferenceUid, String studyInstanceUid,
                       String modality, String patientId, String patientName, String seriesDescription,
                       List<SliceHeader> slices) {
        if (seriesInstanceUid == null || seriesInstanceUid.isEmpty()) {
            throw new IllegalArgumentException("Series Instance UID is required");
        }
        this.seriesInstanceUid = seriesInstanceUid;
        this.frameOfReferenceUid = frameOfReferenceUid;
        this.studyInstanceUid = studyInstanceUid;
        this.modality = modality;
        this.patientId = patientId;
        this.patientName = patientName;
        this.seriesDescription = seriesDescription;
        this.slices = Collections.unmodifiableList(new ArrayList<>(slices));
    }

    public ImageSeries(String seriesInstanceUid, String frameOfReferenceUid, List<SliceHeader> slices) {
        this(seriesInstanceUid, frameOfReferenceUid, null, null, null, null, null, slices);
    }

    public String getSeriesInstanceUid() {
        return seriesInstanceUid;
    }

    public String getFrameOfReferenceUid() {
        return frameOfReferenceUid;
    }

    public String getStudyInstanceUid() {
        return studyInstanceUid;
    }

    public String getModality() {
        return modality;
    }

    public String getPatientId() {
        return patientId;
    }

    public String getPatientName() {
        return patientName;
    }

    public String getSeriesDescription() {
        return seriesDescription;
    }

    public List<SliceHeader> getSlices() {
        return slices;
    }

    public int size() {
        return slices.size();
    }

    @Override
    public String toString() {
        return "ImageSeries[" + seriesInstanceUid + ", " + modality + ", " + slices.size() + " slices]";
    }
}
