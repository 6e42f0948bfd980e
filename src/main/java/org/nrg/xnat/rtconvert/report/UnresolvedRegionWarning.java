package org.nrg.xnat.rtconvert.report;

/**
 * A wanted region that no raw region name in the structure set resolved to.
 */
public class UnresolvedRegionWarning extends ConversionWarning {

    private final String canonicalName;

    public UnresolvedRegionWarning(String canonicalName) {
        super("No structure resolved to wanted region '" + canonicalName + "'");
        this.canonicalName = canonicalName;
    }

    public String getCanonicalName() {
        return canonicalName;
    }
}
