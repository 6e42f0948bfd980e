package org.nrg.xnat.rtconvert.dicom;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.dcm4che3.io.DicomInputStream;
import org.dcm4che3.io.DicomOutputStream;

import java.io.File;
import java.io.IOException;

/**
 * File-level DICOM read and write helpers.
 */
public final class DicomFiles {

    private DicomFiles() {
    }

    /**
     * Read the dataset up to, but not including, Pixel Data.
     */
    public static Attributes readHeader(File file) throws IOException {
        try (DicomInputStream dis = new DicomInputStream(file)) {
            return dis.readDataset(-1, Tag.PixelData);
        }
    }

    /**
     * Read the complete dataset, including Pixel Data.
     */
    public static Attributes readDataset(File file) throws IOException {
        try (DicomInputStream dis = new DicomInputStream(file)) {
            return dis.readDataset(-1, -1);
        }
    }

    /**
     * Write a dataset as a Part 10 file in Explicit VR Little Endian.
     */
    public static void write(File file, Attributes dataset) throws IOException {
        write(file, dataset, UID.ExplicitVRLittleEndian);
    }

    /**
     * Write a dataset as a Part 10 file whose meta information names the given transfer syntax. Pixel Data
     * must already be encoded for it.
     */
    public static void write(File file, Attributes dataset, String transferSyntaxUid) throws IOException {
        File parent = file.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Unable to create directory " + parent.getAbsolutePath());
        }
        Attributes fmi = dataset.createFileMetaInformation(transferSyntaxUid);
        try (DicomOutputStream dos = new DicomOutputStream(file)) {
            dos.writeDataset(fmi, dataset);
        }
    }

    static boolean isReadableFile(File file) {
        return file != null && file.exists() && file.isFile() && file.canRead();
    }
}
