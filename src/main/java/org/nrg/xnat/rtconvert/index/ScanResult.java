package org.nrg.xnat.rtconvert.index;

import org.nrg.xnat.rtconvert.model.ImageSeries;
import org.nrg.xnat.rtconvert.report.ScanWarning;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of scanning a directory tree: candidate pairs plus every file that was skipped.
 */
public final class ScanResult {

    private final File root;
    private final List<SeriesCandidate> candidates;
    private final List<StructureSetEntry> structureSets;
    private final List<ScanWarning> warnings;

    public ScanResult(File root, List<SeriesCandidate> candidates, List<StructureSetEntry> structureSets,
                      List<ScanWarning> warnings) {
        this.root = root;
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.structureSets = Collections.unmodifiableList(new ArrayList<>(structureSets));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public File getRoot() {
        return root;
    }

    public List<SeriesCandidate> getCandidates() {
        return candidates;
    }

    /**
     * Every structure set found, including ones that match no image series.
     */
    public List<StructureSetEntry> getStructureSets() {
        return structureSets;
    }

    public List<ScanWarning> getWarnings() {
        return warnings;
    }

    public SeriesCandidate findCandidate(String seriesInstanceUid) {
        for (SeriesCandidate candidate : candidates) {
            if (candidate.getSeriesInstanceUid().equals(seriesInstanceUid)) {
                return candidate;
            }
        }
        return null;
    }

    public ImageSeries findSeries(String seriesInstanceUid) {
        SeriesCandidate candidate = findCandidate(seriesInstanceUid);
        return candidate != null ? candidate.getSeries() : null;
    }

    public List<StructureSetEntry> structureSetsFor(String seriesInstanceUid) {
        SeriesCandidate candidate = findCandidate(seriesInstanceUid);
        return candidate != null ? candidate.getStructureSets() : Collections.<StructureSetEntry>emptyList();
    }

    public List<ScanWarning> warningsOf(ScanWarning.Reason reason) {
        List<ScanWarning> result = new ArrayList<>();
        for (ScanWarning warning : warnings) {
            if (warning.getReason() == reason) {
                result.add(warning);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "ScanResult[" + root + ": " + candidates.size() + " series, "
                + structureSets.size() + " structure sets, " + warnings.size() + " warnings]";
    }
}
