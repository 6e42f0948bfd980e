package org.nrg.xnat.rtconvert.index;

import java.io.File;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Header-level summary of a structure set file found during a scan.
 */
public final class StructureSetEntry {

    private final File file;
    private final String sopInstanceUid;
    private final String label;
    private final Set<String> frameOfReferenceUids;
    private final String referencedSeriesUid;

    public StructureSetEntry(File file, String sopInstanceUid, String label, Set<String> frameOfReferenceUids,
                             String referencedSeriesUid) {
        this.file = file;
        this.sopInstanceUid = sopInstanceUid;
        this.label = label;
        this.frameOfReferenceUids = Collections.unmodifiableSet(new LinkedHashSet<>(frameOfReferenceUids));
        this.referencedSeriesUid = referencedSeriesUid;
    }

    public File getFile() {
        return file;
    }

    public String getSopInstanceUid() {
        return sopInstanceUid;
    }

    public String getLabel() {
        return label;
    }

    public Set<String> getFrameOfReferenceUids() {
        return frameOfReferenceUids;
    }

    public String getReferencedSeriesUid() {
        return referencedSeriesUid;
    }

    public boolean references(String frameOfReferenceUid) {
        return frameOfReferenceUid != null && frameOfReferenceUids.contains(frameOfReferenceUid);
    }

    @Override
    public String toString() {
        return "StructureSetEntry[" + file.getName() + ", label=" + label + "]";
    }
}
