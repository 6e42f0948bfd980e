package org.nrg.xnat.rtconvert.index;

import org.nrg.xnat.rtconvert.model.ImageSeries;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An image series and the structure sets that share its frame of reference.
 */
public final class SeriesCandidate {

    private final ImageSeries series;
    private final List<StructureSetEntry> structureSets;

    public SeriesCandidate(ImageSeries series, List<StructureSetEntry> structureSets) {
        this.series = series;
        this.structureSets = Collections.unmodifiableList(new ArrayList<>(structureSets));
    }

    public ImageSeries getSeries() {
        return series;
    }

    public String getSeriesInstanceUid() {
        return series.getSeriesInstanceUid();
    }

    public String getFrameOfReferenceUid() {
        return series.getFrameOfReferenceUid();
    }

    public List<StructureSetEntry> getStructureSets() {
        return structureSets;
    }

    public List<File> getStructureSetFiles() {
        List<File> files = new ArrayList<>(structureSets.size());
        for (StructureSetEntry entry : structureSets) {
            files.add(entry.getFile());
        }
        return files;
    }

    public boolean hasStructureSets() {
        return !structureSets.isEmpty();
    }

    @Override
    public String toString() {
        return "SeriesCandidate[" + series + ", " + structureSets.size() + " structure sets]";
    }
}
