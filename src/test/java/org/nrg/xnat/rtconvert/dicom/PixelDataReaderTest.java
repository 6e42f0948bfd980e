package org.nrg.xnat.rtconvert.dicom;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Fragments;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.dcm4che3.data.VR;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.nrg.xnat.rtconvert.SyntheticDicom;
import org.nrg.xnat.rtconvert.model.SliceHeader;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class PixelDataReaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private PixelDataReader reader;

    @Before
    public void setUp() {
        reader = new PixelDataReader();
    }

    @Test
    public void readsUnsignedSixteenBitSlice() throws Exception {
        Attributes attrs = SyntheticDicom.slice("1.2.3.1", "1.2.3.2", "1.2.3.1.1", 1, 0, 2, 3, 2);

        float[] pixels = reader.readSlice(write("slice.dcm", attrs, UID.ExplicitVRLittleEndian));

        assertArrayEquals(new float[]{2000, 2001, 2002, 2003, 2004, 2005}, pixels, 0f);
    }

    @Test
    public void appliesRescaleAndSignExtension() throws Exception {
        Attributes attrs = SyntheticDicom.slice("1.2.3.1", "1.2.3.2", "1.2.3.1.2", 1, 0, 1, 2, 0);
        attrs.setInt(Tag.BitsStored, VR.US, 12);
        attrs.setInt(Tag.HighBit, VR.US, 11);
        attrs.setInt(Tag.PixelRepresentation, VR.US, 1);
        // 0x0FFF is -1 in 12-bit two's complement, high nibble is overlay garbage
        attrs.setBytes(Tag.PixelData, VR.OW, new byte[]{(byte) 0xFF, (byte) 0xFF, 0x10, 0x00});
        attrs.setDouble(Tag.RescaleSlope, VR.DS, 2.0);
        attrs.setDouble(Tag.RescaleIntercept, VR.DS, -1024.0);

        float[] pixels = reader.readSlice(write("signed.dcm", attrs, UID.ExplicitVRLittleEndian));

        assertEquals(-1026f, pixels[0], 0f);
        assertEquals(-992f, pixels[1], 0f);
    }

    @Test
    public void readsEightBitSamples() throws Exception {
        Attributes attrs = SyntheticDicom.slice("1.2.3.1", "1.2.3.2", "1.2.3.1.3", 1, 0, 1, 4, 0);
        attrs.setInt(Tag.BitsAllocated, VR.US, 8);
        attrs.setInt(Tag.BitsStored, VR.US, 8);
        attrs.setInt(Tag.HighBit, VR.US, 7);
        attrs.setBytes(Tag.PixelData, VR.OB, new byte[]{0, 127, (byte) 200, (byte) 255});

        float[] pixels = reader.readSlice(write("byte.dcm", attrs, UID.ExplicitVRLittleEndian));

        assertArrayEquals(new float[]{0, 127, 200, 255}, pixels, 0f);
    }

    @Test
    public void decodesRleLosslessSlice() throws Exception {
        Attributes attrs = SyntheticDicom.slice("1.2.3.1", "1.2.3.2", "1.2.3.1.4", 1, 0, 2, 2, 0);
        attrs.remove(Tag.PixelData);
        Fragments fragments = attrs.newFragments(Tag.PixelData, VR.OB, 2);
        fragments.add(new byte[0]);
        // pixels 1, 2, 300, 4000 split into a high-byte and a low-byte segment
        fragments.add(rleFrame(
                new byte[]{3, 0, 0, 0x01, 0x0F},
                new byte[]{3, 0x01, 0x02, 0x2C, (byte) 0xA0}));
        attrs.setDouble(Tag.RescaleIntercept, VR.DS, -1000.0);

        float[] pixels = reader.readSlice(write("rle.dcm", attrs, UID.RLELossless));

        assertArrayEquals(new float[]{-999, -998, -700, 3000}, pixels, 0f);
    }

    @Test
    public void storedValueMaskingKeepsLowBits() {
        assertEquals(0x0FFF, PixelDataReader.toStoredValue(0xFFFF, 12, false));
        assertEquals(-1, PixelDataReader.toStoredValue(0xFFFF, 12, true));
        assertEquals(-32768, PixelDataReader.toStoredValue(0x8000, 16, true));
    }

    @Test(expected = IOException.class)
    public void colorImagesAreRejected() throws Exception {
        Attributes attrs = SyntheticDicom.slice("1.2.3.1", "1.2.3.2", "1.2.3.1.5", 1, 0, 1, 2, 0);
        attrs.setInt(Tag.SamplesPerPixel, VR.US, 3);
        attrs.setString(Tag.PhotometricInterpretation, VR.CS, "RGB");
        attrs.setInt(Tag.PlanarConfiguration, VR.US, 0);
        attrs.setInt(Tag.BitsAllocated, VR.US, 8);
        attrs.setInt(Tag.BitsStored, VR.US, 8);
        attrs.setInt(Tag.HighBit, VR.US, 7);
        attrs.setBytes(Tag.PixelData, VR.OB, new byte[]{1, 2, 3, 4, 5, 6});

        reader.readSlice(write("rgb.dcm", attrs, UID.ExplicitVRLittleEndian));
    }

    @Test(expected = IOException.class)
    public void missingFileIsReported() throws Exception {
        Attributes attrs = SyntheticDicom.slice("1.2.3.1", "1.2.3.2", "1.2.3.1.6", 1, 0, 2, 2, 0);

        reader.readSlice(SliceHeader.fromAttributes(new File(folder.getRoot(), "gone.dcm"), attrs));
    }

    private SliceHeader write(String name, Attributes attrs, String transferSyntaxUid) throws IOException {
        File file = new File(folder.getRoot(), name);
        DicomFiles.write(file, attrs, transferSyntaxUid);
        return SliceHeader.fromAttributes(file, attrs);
    }

    /**
     * RLE frame with a 64-byte segment table; every segment is a PackBits literal run padded to even length.
     */
    private static byte[] rleFrame(byte[]... segments) {
        int length = 64;
        for (byte[] segment : segments) {
            length += segment.length + (segment.length % 2);
        }
        ByteBuffer buffer = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(segments.length);
        int offset = 64;
        for (int i = 0; i < 15; i++) {
            if (i < segments.length) {
                buffer.putInt(offset);
                offset += segments[i].length + (segments[i].length % 2);
            } else {
                buffer.putInt(0);
            }
        }
        for (byte[] segment : segments) {
            buffer.put(segment);
            if (segment.length % 2 != 0) {
                buffer.put((byte) 0);
            }
        }
        return buffer.array();
    }
}
