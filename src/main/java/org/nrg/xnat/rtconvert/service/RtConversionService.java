package org.nrg.xnat.rtconvert.service;

import org.nrg.xnat.rtconvert.exception.ConversionCancelledException;
import org.nrg.xnat.rtconvert.exception.InvalidConversionConfigException;
import org.nrg.xnat.rtconvert.exception.RtConversionException;
import org.nrg.xnat.rtconvert.index.ScanResult;
import org.nrg.xnat.rtconvert.model.ImageSeries;
import org.nrg.xnat.rtconvert.model.LabeledMask;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.nrg.xnat.rtconvert.model.VoxelGrid;
import org.nrg.xnat.rtconvert.report.ProgressLog;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Future;

/**
 * Converts between RT Structure Sets and label masks for series found on disk
 */
public interface RtConversionService {

    /**
     * Index a directory tree for image series and structure sets
     */
    ScanResult scan(File root);

    /**
     * Raw region names of a structure set, for choosing the wanted regions
     */
    List<String> listRegionNames(File structureSetFile) throws IOException;

    /**
     * Assemble the requested series and paint its wanted regions into a label mask
     */
    MaskConversion convertToMask(ConversionRequest request) throws RtConversionException, IOException;

    /**
     * Trace a label mask drawn on {@code reference} into a structure set
     */
    StructureSet convertToStructureSet(LabeledMask mask, VoxelGrid reference, List<String> regionLabelOrder,
                                       String label) throws ConversionCancelledException;

    /**
     * Write a structure set referencing the slices of {@code reference}
     */
    File writeStructureSet(StructureSet structureSet, ImageSeries reference, File target) throws IOException;

    /**
     * Convert every request on the worker pool. A failing request yields an error outcome and does not
     * affect the others. Outcomes are returned in request order.
     *
     * @throws InvalidConversionConfigException if any request is misconfigured; nothing is converted then
     */
    List<ConversionOutcome> convertAll(List<ConversionRequest> requests);

    /**
     * Queue one request; cancelling the returned future interrupts its worker
     */
    Future<ConversionOutcome> submit(ConversionRequest request);

    ProgressLog getProgressLog();
}
