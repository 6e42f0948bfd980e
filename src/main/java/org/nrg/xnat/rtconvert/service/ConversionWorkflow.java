package org.nrg.xnat.rtconvert.service;

import org.nrg.xnat.rtconvert.association.AssociationRegistry;
import org.nrg.xnat.rtconvert.dicom.StructureSetReader;
import org.nrg.xnat.rtconvert.exception.ConversionCancelledException;
import org.nrg.xnat.rtconvert.exception.FrameOfReferenceMismatchException;
import org.nrg.xnat.rtconvert.exception.InconsistentGeometryException;
import org.nrg.xnat.rtconvert.exception.RtConversionException;
import org.nrg.xnat.rtconvert.index.ScanResult;
import org.nrg.xnat.rtconvert.index.SeriesIndex;
import org.nrg.xnat.rtconvert.model.ImageSeries;
import org.nrg.xnat.rtconvert.model.LabeledMask;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.nrg.xnat.rtconvert.model.VoxelGrid;
import org.nrg.xnat.rtconvert.raster.ContourRasterizer;
import org.nrg.xnat.rtconvert.raster.RasterResult;
import org.nrg.xnat.rtconvert.report.ProgressLog;
import org.nrg.xnat.rtconvert.vector.MaskVectorizer;
import org.nrg.xnat.rtconvert.volume.VolumeAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Drives one series through indexing, assembly and conversion.
 *
 * <pre>
 * UNINDEXED -&gt; INDEXED -&gt; ASSEMBLED -&gt; MASK_READY | STRUCTURE_READY
 * </pre>
 * Once assembled, further mask or structure requests may follow in any order. A failing step moves the
 * workflow to a terminal error state and every later call is refused. Not thread safe; each worker owns
 * its workflow.
 */
public class ConversionWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(ConversionWorkflow.class);

    private final String requestId;
    private final SeriesIndex seriesIndex;
    private final VolumeAssembler assembler;
    private final StructureSetReader structureSetReader;
    private final ContourRasterizer rasterizer;
    private final MaskVectorizer vectorizer;
    private final ProgressLog progressLog;

    private ConversionState state = ConversionState.UNINDEXED;
    private ScanResult scanResult;
    private ImageSeries series;
    private VoxelGrid grid;
    private StructureSet structureSet;

    public ConversionWorkflow(String requestId, SeriesIndex seriesIndex, VolumeAssembler assembler,
                              StructureSetReader structureSetReader, ContourRasterizer rasterizer,
                              MaskVectorizer vectorizer, ProgressLog progressLog) {
        this.requestId = requestId;
        this.seriesIndex = seriesIndex;
        this.assembler = assembler;
        this.structureSetReader = structureSetReader;
        this.rasterizer = rasterizer;
        this.vectorizer = vectorizer;
        this.progressLog = progressLog;
    }

    public ScanResult index(File root) {
        expect(state == ConversionState.UNINDEXED, "index");
        try {
            scanResult = seriesIndex.scan(root);
        } catch (RuntimeException e) {
            state = ConversionState.FAILED;
            throw e;
        }
        state = ConversionState.INDEXED;
        progressLog.append(requestId, "indexed " + scanResult.getCandidates().size() + " series under " + root);
        return scanResult;
    }

    /**
     * Assemble a series found by {@link #index(File)}.
     */
    public VoxelGrid assemble(String seriesInstanceUid)
            throws RtConversionException, IOException {
        expect(state == ConversionState.INDEXED, "assemble");
        ImageSeries found = scanResult.findSeries(seriesInstanceUid);
        if (found == null) {
            state = ConversionState.FAILED;
            throw new RtConversionException("Series " + seriesInstanceUid + " was not found under "
                    + scanResult.getRoot());
        }
        return doAssemble(found);
    }

    /**
     * Assemble a series the caller already holds, skipping the directory scan.
     */
    public VoxelGrid assemble(ImageSeries imageSeries)
            throws InconsistentGeometryException, ConversionCancelledException, IOException {
        expect(state == ConversionState.UNINDEXED || state == ConversionState.INDEXED, "assemble");
        return doAssemble(imageSeries);
    }

    private VoxelGrid doAssemble(ImageSeries imageSeries)
            throws InconsistentGeometryException, ConversionCancelledException, IOException {
        try {
            grid = assembler.assemble(imageSeries);
        } catch (InconsistentGeometryException e) {
            state = ConversionState.GEOMETRY_ERROR;
            throw e;
        } catch (ConversionCancelledException e) {
            state = ConversionState.CANCELLED;
            throw e;
        } catch (IOException | RuntimeException e) {
            state = ConversionState.FAILED;
            throw e;
        }
        series = imageSeries;
        state = ConversionState.ASSEMBLED;
        progressLog.append(requestId, "assembled series " + imageSeries.getSeriesInstanceUid());
        return grid;
    }

    public RasterResult rasterize(File structureSetFile, AssociationRegistry registry)
            throws FrameOfReferenceMismatchException, ConversionCancelledException, IOException {
        expect(state.acceptsRequest(), "rasterize");
        StructureSet parsed;
        try {
            parsed = structureSetReader.read(structureSetFile);
        } catch (IOException | RuntimeException e) {
            state = ConversionState.FAILED;
            throw e;
        }
        return rasterize(parsed, registry);
    }

    public RasterResult rasterize(StructureSet source, AssociationRegistry registry)
            throws FrameOfReferenceMismatchException, ConversionCancelledException {
        expect(state.acceptsRequest(), "rasterize");
        RasterResult result;
        try {
            result = rasterizer.rasterize(grid, source, registry);
        } catch (FrameOfReferenceMismatchException e) {
            state = ConversionState.ALIGNMENT_ERROR;
            throw e;
        } catch (ConversionCancelledException e) {
            state = ConversionState.CANCELLED;
            throw e;
        } catch (RuntimeException e) {
            state = ConversionState.FAILED;
            throw e;
        }
        structureSet = source;
        state = ConversionState.MASK_READY;
        progressLog.append(requestId, "painted " + registry.getLabelOrder().size() + " regions with "
                + result.getWarnings().size() + " warnings");
        return result;
    }

    public StructureSet vectorize(LabeledMask mask, List<String> regionLabelOrder, String label)
            throws ConversionCancelledException {
        expect(state.acceptsRequest(), "vectorize");
        StructureSet traced;
        try {
            traced = vectorizer.vectorize(mask, grid, regionLabelOrder, label);
        } catch (ConversionCancelledException e) {
            state = ConversionState.CANCELLED;
            throw e;
        } catch (RuntimeException e) {
            state = ConversionState.FAILED;
            throw e;
        }
        state = ConversionState.STRUCTURE_READY;
        progressLog.append(requestId, "traced " + traced.getRegions().size() + " regions");
        return traced;
    }

    private void expect(boolean allowed, String step) {
        if (!allowed) {
            throw new IllegalStateException("Cannot " + step + " request " + requestId + " in state " + state);
        }
        logger.debug("Request {}: {} from state {}", requestId, step, state);
    }

    public String getRequestId() {
        return requestId;
    }

    public ConversionState getState() {
        return state;
    }

    public ScanResult getScanResult() {
        return scanResult;
    }

    public ImageSeries getSeries() {
        return series;
    }

    public VoxelGrid getGrid() {
        return grid;
    }

    /**
     * Structure set painted by the last successful {@code rasterize} call.
     */
    public StructureSet getStructureSet() {
        return structureSet;
    }
}
