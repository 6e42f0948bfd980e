package org.nrg.xnat.rtconvert.report;

/**
 * A wanted region left out of the mask because it is drawn on another frame of reference than the series.
 */
public class ForeignFrameRegionWarning extends ConversionWarning {

    private final String regionName;
    private final String regionFrameOfReferenceUid;
    private final String seriesFrameOfReferenceUid;

    public ForeignFrameRegionWarning(String regionName, String regionFrameOfReferenceUid,
                                     String seriesFrameOfReferenceUid) {
        super("Region '" + regionName + "' is on frame of reference " + regionFrameOfReferenceUid
                + ", series is on " + seriesFrameOfReferenceUid);
        this.regionName = regionName;
        this.regionFrameOfReferenceUid = regionFrameOfReferenceUid;
        this.seriesFrameOfReferenceUid = seriesFrameOfReferenceUid;
    }

    public String getRegionName() {
        return regionName;
    }

    public String getRegionFrameOfReferenceUid() {
        return regionFrameOfReferenceUid;
    }

    public String getSeriesFrameOfReferenceUid() {
        return seriesFrameOfReferenceUid;
    }
}
