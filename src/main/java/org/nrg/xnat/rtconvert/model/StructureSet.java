package org.nrg.xnat.rtconvert.model;

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Regions of one RT Structure Set, tied to the frames of reference it references.
 *
 * The first referenced frame is the primary one; it is what a written structure set declares.
 */
public final class StructureSet {

    private final String sopInstanceUid;
    private final String label;
    private final Set<String> frameOfReferenceUids;
    private final String referencedSeriesUid;
    private final File sourceFile;
    private final List<Region> regions;

    public StructureSet(String sopInstanceUid, String label, Collection<String> frameOfReferenceUids,
                        String referencedSeriesUid, File sourceFile, List<Region> regions) {
        this.sopInstanceUid = sopInstanceUid;
        this.label = label;
        this.frameOfReferenceUids = Collections.unmodifiableSet(new LinkedHashSet<>(frameOfReferenceUids));
        this.referencedSeriesUid = referencedSeriesUid;
        this.sourceFile = sourceFile;
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
    }

    public StructureSet(String sopInstanceUid, String label, String frameOfReferenceUid,
                        String referencedSeriesUid, File sourceFile, List<Region> regions) {
        this(sopInstanceUid, label, singleFrame(frameOfReferenceUid), referencedSeriesUid, sourceFile, regions);
    }

    public StructureSet(String frameOfReferenceUid, List<Region> regions) {
        this(null, null, frameOfReferenceUid, null, null, regions);
    }

    private static Set<String> singleFrame(String frameOfReferenceUid) {
        return frameOfReferenceUid == null
                ? Collections.<String>emptySet()
                : Collections.singleton(frameOfReferenceUid);
    }

    public String getSopInstanceUid() {
        return sopInstanceUid;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Primary frame of reference, or null when the structure set references none.
     */
    public String getFrameOfReferenceUid() {
        return frameOfReferenceUids.isEmpty() ? null : frameOfReferenceUids.iterator().next();
    }

    /**
     * Every referenced frame of reference, in document order.
     */
    public Set<String> getFrameOfReferenceUids() {
        return frameOfReferenceUids;
    }

    public String getReferencedSeriesUid() {
        return referencedSeriesUid;
    }

    /**
     * File the structure set was parsed from, or null for generated structure sets.
     */
    public File getSourceFile() {
        return sourceFile;
    }

    public List<Region> getRegions() {
        return regions;
    }

    public List<String> getRegionNames() {
        List<String> names = new ArrayList<>(regions.size());
        for (Region region : regions) {
            names.add(region.getName());
        }
        return names;
    }

    /**
     * True when this structure set references the series' frame of reference.
     * A missing frame of reference on either side is treated as compatible.
     */
    public boolean appliesTo(String seriesFrameOfReferenceUid) {
        if (frameOfReferenceUids.isEmpty() || seriesFrameOfReferenceUid == null) {
            return true;
        }
        return frameOfReferenceUids.contains(seriesFrameOfReferenceUid);
    }

    @Override
    public String toString() {
        return "StructureSet[" + (label != null ? label : sopInstanceUid) + ", " + regions.size() + " regions]";
    }
}
