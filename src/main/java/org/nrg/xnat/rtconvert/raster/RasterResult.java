package org.nrg.xnat.rtconvert.raster;

import org.nrg.xnat.rtconvert.model.LabeledMask;
import org.nrg.xnat.rtconvert.report.ConversionWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A completed label mask and the warnings recorded while producing it.
 */
public final class RasterResult {

    private final LabeledMask mask;
    private final List<ConversionWarning> warnings;

    public RasterResult(LabeledMask mask, List<ConversionWarning> warnings) {
        this.mask = mask;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public LabeledMask getMask() {
        return mask;
    }

    public List<ConversionWarning> getWarnings() {
        return warnings;
    }

    public <W extends ConversionWarning> List<W> getWarnings(Class<W> type) {
        List<W> result = new ArrayList<>();
        for (ConversionWarning warning : warnings) {
            if (type.isInstance(warning)) {
                result.add(type.cast(warning));
            }
        }
        return result;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
