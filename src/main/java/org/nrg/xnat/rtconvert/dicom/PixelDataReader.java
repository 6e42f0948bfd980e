package org.nrg.xnat.rtconvert.dicom;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;
import org.dcm4che3.imageio.plugins.dcm.DicomImageReadParam;
import org.dcm4che3.imageio.plugins.dcm.DicomMetaData;
import org.nrg.xnat.rtconvert.model.SliceHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.Raster;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;

/**
 * Decodes the first frame of a single-sample slice into rescaled float values through the dcm4che
 * DICOM {@link ImageReader}, so native and compressed transfer syntaxes go through the same path.
 */
public class PixelDataReader {

    private static final Logger logger = LoggerFactory.getLogger(PixelDataReader.class);

    /**
     * Read one slice as {@code rows * columns} values in row-major order, with the header's
     * Rescale Slope/Intercept applied.
     */
    public float[] readSlice(SliceHeader slice) throws IOException {
        File file = slice.getFile();
        if (!DicomFiles.isReadableFile(file)) {
            throw new IOException("Slice file is not readable: " + file);
        }

        ImageReader reader = dicomReader();
        try (ImageInputStream iis = ImageIO.createImageInputStream(file)) {
            if (iis == null) {
                throw new IOException("Could not create ImageInputStream for " + file);
            }
            reader.setInput(iis, false);

            Attributes attrs = ((DicomMetaData) reader.getStreamMetadata()).getAttributes();
            int samplesPerPixel = attrs.getInt(Tag.SamplesPerPixel, 1);
            if (samplesPerPixel != 1) {
                throw new IOException("Only single-sample grayscale images are supported, found "
                        + samplesPerPixel + " samples per pixel in " + file.getName());
            }
            int bitsAllocated = attrs.getInt(Tag.BitsAllocated, 16);
            int bitsStored = attrs.getInt(Tag.BitsStored, bitsAllocated);
            boolean signed = attrs.getInt(Tag.PixelRepresentation, 0) == 1;

            DicomImageReadParam param = (DicomImageReadParam) reader.getDefaultReadParam();
            Raster raster = reader.readRaster(0, param);
            if (raster.getWidth() != slice.getColumns() || raster.getHeight() != slice.getRows()) {
                throw new IOException("Decoded frame of " + file.getName() + " is " + raster.getHeight() + "x"
                        + raster.getWidth() + ", header says " + slice.getRows() + "x" + slice.getColumns());
            }

            float[] pixels = toValues(raster, bitsStored, signed,
                    slice.getRescaleSlope(), slice.getRescaleIntercept());
            logger.debug("Decoded {} pixels from {}", pixels.length, file.getName());
            return pixels;
        } finally {
            reader.dispose();
        }
    }

    private static ImageReader dicomReader() throws IOException {
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("DICOM");
        if (!readers.hasNext()) {
            throw new IOException("No DICOM ImageReader found");
        }
        return readers.next();
    }

    /**
     * Convert the samples of a raw raster to modality values.
     */
    static float[] toValues(Raster raster, int bitsStored, boolean signed, double slope, double intercept) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        int minX = raster.getMinX();
        int minY = raster.getMinY();
        float[] values = new float[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                long raw = raster.getSample(minX + x, minY + y, 0) & 0xFFFFFFFFL;
                long stored = toStoredValue(raw, bitsStored, signed);
                values[y * width + x] = (float) (stored * slope + intercept);
            }
        }
        return values;
    }

    /**
     * Keep the low {@code bitsStored} bits, sign-extending when the representation is signed.
     */
    static long toStoredValue(long raw, int bitsStored, boolean signed) {
        if (bitsStored <= 0 || bitsStored >= 64) {
            return raw;
        }
        long mask = (1L << bitsStored) - 1;
        long value = raw & mask;
        if (signed && (value & (1L << (bitsStored - 1))) != 0) {
            value -= (1L << bitsStored);
        }
        return value;
    }
}
