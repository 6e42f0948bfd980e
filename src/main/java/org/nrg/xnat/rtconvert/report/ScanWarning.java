package org.nrg.xnat.rtconvert.report;

import java.io.File;

/**
 * A file the series index skipped, with the reason.
 */
public class ScanWarning extends ConversionWarning {

    public enum Reason {
        UNREADABLE,
        NOT_DICOM,
        MISSING_SERIES_UID,
        MISSING_FRAME_OF_REFERENCE,
        NO_IMAGE_GEOMETRY,
        ORPHAN_STRUCTURE_SET
    }

    private final File file;
    private final Reason reason;

    public ScanWarning(File file, Reason reason, String detail) {
        super(file.getPath() + " skipped (" + reason + ")" + (detail != null ? ": " + detail : ""));
        this.file = file;
        this.reason = reason;
    }

    public File getFile() {
        return file;
    }

    public Reason getReason() {
        return reason;
    }
}
