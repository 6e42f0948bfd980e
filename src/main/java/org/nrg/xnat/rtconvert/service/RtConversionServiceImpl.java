package org.nrg.xnat.rtconvert.service;

import org.nrg.xnat.rtconvert.config.ConversionSettings;
import org.nrg.xnat.rtconvert.dicom.PixelDataReader;
import org.nrg.xnat.rtconvert.dicom.StructureSetReader;
import org.nrg.xnat.rtconvert.dicom.StructureSetWriter;
import org.nrg.xnat.rtconvert.exception.ConversionCancelledException;
import org.nrg.xnat.rtconvert.exception.InvalidConversionConfigException;
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
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Conversion service running each request on a fixed pool of workers.
 *
 * Requests share nothing but the read-only registries they carry and the {@link ProgressLog}.
 */
@Service
public class RtConversionServiceImpl implements RtConversionService, DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(RtConversionServiceImpl.class);

    private final ConversionSettings settings;
    private final SeriesIndex seriesIndex;
    private final VolumeAssembler assembler;
    private final StructureSetReader structureSetReader;
    private final StructureSetWriter structureSetWriter;
    private final ContourRasterizer rasterizer;
    private final MaskVectorizer vectorizer;
    private final ProgressLog progressLog = new ProgressLog();
    private final ExecutorService workers;

    public RtConversionServiceImpl() {
        this(ConversionSettings.fromSystemProperties());
    }

    public RtConversionServiceImpl(ConversionSettings settings) {
        this(settings, new SeriesIndex(), new VolumeAssembler(settings, new PixelDataReader()),
                new StructureSetReader(), new StructureSetWriter(), new ContourRasterizer(settings),
                new MaskVectorizer());
    }

    public RtConversionServiceImpl(ConversionSettings settings, SeriesIndex seriesIndex, VolumeAssembler assembler,
                                   StructureSetReader structureSetReader, StructureSetWriter structureSetWriter,
                                   ContourRasterizer rasterizer, MaskVectorizer vectorizer) {
        this.settings = settings;
        this.seriesIndex = seriesIndex;
        this.assembler = assembler;
        this.structureSetReader = structureSetReader;
        this.structureSetWriter = structureSetWriter;
        this.rasterizer = rasterizer;
        this.vectorizer = vectorizer;

        final AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.getWorkers(), runnable -> {
            Thread thread = new Thread(runnable, "rtconvert-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        logger.info("Conversion service started with {}", settings);
    }

    @Override
    public ScanResult scan(File root) {
        return seriesIndex.scan(root);
    }

    @Override
    public List<String> listRegionNames(File structureSetFile) throws IOException {
        return structureSetReader.listRegionNames(structureSetFile);
    }

    @Override
    public MaskConversion convertToMask(ConversionRequest request) throws RtConversionException, IOException {
        return run(newWorkflow(request.getId()), request);
    }

    @Override
    public StructureSet convertToStructureSet(LabeledMask mask, VoxelGrid reference, List<String> regionLabelOrder,
                                              String label) throws ConversionCancelledException {
        return vectorizer.vectorize(mask, reference, regionLabelOrder, label);
    }

    @Override
    public File writeStructureSet(StructureSet structureSet, ImageSeries reference, File target) throws IOException {
        return structureSetWriter.write(structureSet, reference, target);
    }

    @Override
    public List<ConversionOutcome> convertAll(List<ConversionRequest> requests) {
        for (ConversionRequest request : requests) {
            validate(request);
        }
        List<Future<ConversionOutcome>> futures = new ArrayList<>(requests.size());
        for (ConversionRequest request : requests) {
            futures.add(submit(request));
        }

        List<ConversionOutcome> outcomes = new ArrayList<>(requests.size());
        for (int i = 0; i < futures.size(); i++) {
            String requestId = requests.get(i).getId();
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Batch interrupted, cancelling {} outstanding requests", futures.size() - i);
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    outcomes.add(ConversionOutcome.failed(requests.get(j).getId(), ConversionState.CANCELLED,
                            "batch interrupted"));
                }
                break;
            } catch (CancellationException e) {
                outcomes.add(ConversionOutcome.failed(requestId, ConversionState.CANCELLED, "cancelled"));
            } catch (ExecutionException e) {
                if (e.getCause() instanceof InvalidConversionConfigException) {
                    for (int j = i + 1; j < futures.size(); j++) {
                        futures.get(j).cancel(true);
                    }
                    throw (InvalidConversionConfigException) e.getCause();
                }
                logger.error("Error converting request " + requestId, e.getCause());
                outcomes.add(ConversionOutcome.failed(requestId, ConversionState.FAILED, e.getCause().getMessage()));
            }
        }

        int failed = 0;
        for (ConversionOutcome outcome : outcomes) {
            if (!outcome.isSuccessful()) {
                failed++;
            }
        }
        logger.info("Batch of {} requests finished, {} failed", requests.size(), failed);
        return outcomes;
    }

    @Override
    public Future<ConversionOutcome> submit(ConversionRequest request) {
        progressLog.append(request.getId(), "queued");
        return workers.submit(() -> execute(request));
    }

    @Override
    public ProgressLog getProgressLog() {
        return progressLog;
    }

    ConversionOutcome execute(ConversionRequest request) {
        ConversionWorkflow workflow = newWorkflow(request.getId());
        try {
            MaskConversion result = run(workflow, request);
            progressLog.append(request.getId(), "completed with " + result.getWarnings().size() + " warnings");
            return ConversionOutcome.completed(result, workflow.getState());
        } catch (InvalidConversionConfigException e) {
            progressLog.append(request.getId(), "rejected: " + e.getMessage());
            throw e;
        } catch (ConversionCancelledException e) {
            logger.warn("Request {} cancelled: {}", request.getId(), e.getMessage());
            progressLog.append(request.getId(), "cancelled");
            return ConversionOutcome.failed(request.getId(), ConversionState.CANCELLED, e.getMessage());
        } catch (Exception e) {
            logger.error("Error converting request " + request.getId(), e);
            progressLog.append(request.getId(), "failed: " + e.getMessage());
            ConversionState state = workflow.getState().isFailure() ? workflow.getState() : ConversionState.FAILED;
            return ConversionOutcome.failed(request.getId(), state, e.getMessage());
        }
    }

    /**
     * Reject a request whose configuration can never convert, before any work is queued.
     */
    static void validate(ConversionRequest request) {
        if (request.getRegistry().wantedRegions().isEmpty()) {
            throw new InvalidConversionConfigException("Request " + request.getId() + " wants no regions");
        }
    }

    private MaskConversion run(ConversionWorkflow workflow, ConversionRequest request)
            throws RtConversionException, IOException {
        logger.debug("Starting {}", request);
        if (request.getSeries() != null) {
            workflow.assemble(request.getSeries());
        } else {
            workflow.index(request.getScanRoot());
            workflow.assemble(request.getSeriesInstanceUid());
        }
        RasterResult raster = workflow.rasterize(request.getStructureSetFile(), request.getRegistry());
        logger.info("Request {} produced {} with {} warnings", request.getId(), raster.getMask(),
                raster.getWarnings().size());
        return new MaskConversion(request.getId(), workflow.getGrid(), raster.getMask(), workflow.getStructureSet(),
                raster.getWarnings());
    }

    ConversionWorkflow newWorkflow(String requestId) {
        return new ConversionWorkflow(requestId, seriesIndex, assembler, structureSetReader, rasterizer, vectorizer,
                progressLog);
    }

    public ConversionSettings getSettings() {
        return settings;
    }

    @Override
    public void destroy() {
        workers.shutdownNow();
        logger.info("Conversion service stopped");
    }
}
