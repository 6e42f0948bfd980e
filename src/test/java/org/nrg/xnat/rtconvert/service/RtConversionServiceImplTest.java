package org.nrg.xnat.rtconvert.service;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.nrg.xnat.rtconvert.SyntheticDicom;
import org.nrg.xnat.rtconvert.association.AssociationRegistry;
import org.nrg.xnat.rtconvert.association.AssociationTable;
import org.nrg.xnat.rtconvert.config.ConversionSettings;
import org.nrg.xnat.rtconvert.dicom.StructureSetReader;
import org.nrg.xnat.rtconvert.dicom.StructureSetWriter;
import org.nrg.xnat.rtconvert.exception.ConversionCancelledException;
import org.nrg.xnat.rtconvert.exception.InconsistentGeometryException;
import org.nrg.xnat.rtconvert.exception.InvalidConversionConfigException;
import org.nrg.xnat.rtconvert.geometry.Contour;
import org.nrg.xnat.rtconvert.index.SeriesIndex;
import org.nrg.xnat.rtconvert.model.ImageSeries;
import org.nrg.xnat.rtconvert.model.Region;
import org.nrg.xnat.rtconvert.model.SliceHeader;
import org.nrg.xnat.rtconvert.model.StructureSet;
import org.nrg.xnat.rtconvert.raster.ContourRasterizer;
import org.nrg.xnat.rtconvert.report.ProgressLog;
import org.nrg.xnat.rtconvert.report.UnresolvedRegionWarning;
import org.nrg.xnat.rtconvert.vector.MaskVectorizer;
import org.nrg.xnat.rtconvert.volume.VolumeAssembler;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.when;

public class RtConversionServiceImplTest {

    private static final String SERIES_A = "1.2.826.0.1.3680043.9.7001.500";
    private static final String SERIES_B = "1.2.826.0.1.3680043.9.7001.600";
    private static final String FRAME_A = SyntheticDicom.FRAME_OF_REFERENCE_UID;
    private static final String FRAME_B = "1.2.826.0.1.3680043.9.7001.3";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Mock
    private VolumeAssembler mockAssembler;

    private RtConversionServiceImpl service;
    private ImageSeries seriesA;
    private File structureA;
    private File structureB;
    private AssociationRegistry registry;

    @Before
    public void setUp() throws IOException {
        MockitoAnnotations.initMocks(this);
        service = new RtConversionServiceImpl(ConversionSettings.builder().workers(2).build());

        seriesA = SyntheticDicom.writeSeries(folder.newFolder("ct-a"), SERIES_A, FRAME_A, 3, 10, 10, 2.0);
        ImageSeries seriesB = SyntheticDicom.writeSeries(folder.newFolder("ct-b"), SERIES_B, FRAME_B, 3, 10, 10, 2.0);
        File structures = folder.newFolder("rtstruct");
        structureA = writeSquare(seriesA, FRAME_A, new File(structures, "a.dcm"));
        structureB = writeSquare(seriesB, FRAME_B, new File(structures, "b.dcm"));

        registry = new AssociationRegistry(
                AssociationTable.builder().synonyms("Tumor", "GTV").build(),
                Collections.singletonList("Tumor"));
    }

    @After
    public void tearDown() {
        service.destroy();
    }

    @Test
    public void convertsSeriesFoundByScanning() throws Exception {
        MaskConversion result = service.convertToMask(scanned("mask-1", SERIES_A, structureA, registry));

        assertEquals(SERIES_A, result.getGrid().getSeriesInstanceUid());
        assertEquals(16, result.getMask().countVoxels(1));
        assertEquals(Collections.singletonList("Tumor"), result.getMask().getLabelNames());
        assertEquals(Collections.singletonList("GTV"), result.getStructureSet().getRegionNames());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    public void batchReportsEachRequestOnItsOwn() {
        List<ConversionOutcome> outcomes = service.convertAll(Arrays.asList(
                scanned("ok-a", SERIES_A, structureA, registry),
                scanned("wrong-frame", SERIES_B, structureA, registry),
                scanned("missing", "9.9.9", structureA, registry),
                scanned("ok-b", SERIES_B, structureB, registry)));

        assertEquals(4, outcomes.size());
        assertEquals("ok-a", outcomes.get(0).getRequestId());
        assertEquals(ConversionOutcome.Status.SUCCESS, outcomes.get(0).getStatus());
        assertEquals(16, outcomes.get(0).getResult().getMask().countVoxels(1));

        assertEquals(ConversionOutcome.Status.ERROR, outcomes.get(1).getStatus());
        assertEquals(ConversionState.ALIGNMENT_ERROR, outcomes.get(1).getState());
        assertNull(outcomes.get(1).getResult());

        assertEquals(ConversionOutcome.Status.ERROR, outcomes.get(2).getStatus());
        assertEquals(ConversionState.FAILED, outcomes.get(2).getState());
        assertNotNull(outcomes.get(2).getErrorMessage());

        assertEquals("ok-b", outcomes.get(3).getRequestId());
        assertEquals(ConversionOutcome.Status.SUCCESS, outcomes.get(3).getStatus());
        assertEquals(ConversionState.MASK_READY, outcomes.get(3).getState());
    }

    @Test
    public void emptyWantedListFailsTheWholeBatch() {
        AssociationRegistry nothingWanted = new AssociationRegistry(AssociationTable.empty(),
                Collections.<String>emptyList());

        try {
            service.convertAll(Arrays.asList(
                    scanned("ok-a", SERIES_A, structureA, registry),
                    scanned("empty", SERIES_A, structureA, nothingWanted)));
            fail("Expected InvalidConversionConfigException");
        } catch (InvalidConversionConfigException e) {
            assertTrue(e.getMessage().contains("empty"));
        }
        assertTrue("No request is queued", service.getProgressLog().entriesFor("ok-a").isEmpty());
    }

    @Test
    public void submittedRequestWithoutWantedRegionsIsNotAnOutcome() throws Exception {
        AssociationRegistry nothingWanted = new AssociationRegistry(AssociationTable.empty(),
                Collections.<String>emptyList());

        Future<ConversionOutcome> future = service.submit(scanned("empty", SERIES_A, structureA, nothingWanted));

        try {
            future.get(30, TimeUnit.SECONDS);
            fail("Expected the configuration error to propagate");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof InvalidConversionConfigException);
        }
    }

    @Test
    public void geometryFailureOfOneSeriesLeavesTheOthersAlone() throws Exception {
        ImageSeries broken = new ImageSeries("1.2.3.700", FRAME_A, Collections.<SliceHeader>emptyList());
        ImageSeries healthy = new ImageSeries("1.2.3.800", FRAME_A, Collections.<SliceHeader>emptyList());
        when(mockAssembler.assemble(broken)).thenThrow(new InconsistentGeometryException("1.2.3.700", "gap"));
        when(mockAssembler.assemble(healthy)).thenReturn(SyntheticDicom.grid(3, 10, 10, FRAME_A));
        RtConversionServiceImpl mocked = withAssembler(mockAssembler);

        try {
            List<ConversionOutcome> outcomes = mocked.convertAll(Arrays.asList(
                    direct("broken", broken), direct("healthy", healthy)));

            assertEquals(ConversionState.GEOMETRY_ERROR, outcomes.get(0).getState());
            assertEquals(ConversionOutcome.Status.ERROR, outcomes.get(0).getStatus());
            assertEquals(ConversionOutcome.Status.SUCCESS, outcomes.get(1).getStatus());
            assertEquals(16, outcomes.get(1).getResult().getMask().countVoxels(1));
        } finally {
            mocked.destroy();
        }
    }

    @Test
    public void unresolvedRegionDowngradesToWarning() throws Exception {
        AssociationRegistry withLiver = new AssociationRegistry(AssociationTable.empty(),
                Arrays.asList("GTV", "Liver"));

        ConversionOutcome outcome = service.submit(scanned("warn", SERIES_A, structureA, withLiver))
                .get(30, TimeUnit.SECONDS);

        assertEquals(ConversionOutcome.Status.WARNING, outcome.getStatus());
        assertTrue(outcome.isSuccessful());
        assertEquals(1, outcome.getWarnings().size());
        assertEquals("Liver", ((UnresolvedRegionWarning) outcome.getWarnings().get(0)).getCanonicalName());
        assertEquals(16, outcome.getResult().getMask().countVoxels(1));
        assertEquals(0, outcome.getResult().getMask().countVoxels(2));
    }

    @Test
    public void cancelledRequestIsRecorded() throws Exception {
        final CountDownLatch started = new CountDownLatch(1);
        ImageSeries slow = new ImageSeries("1.2.3.900", FRAME_A, Collections.<SliceHeader>emptyList());
        when(mockAssembler.assemble(slow)).thenAnswer(invocation -> {
            started.countDown();
            while (!Thread.currentThread().isInterrupted()) {
                LockSupport.parkNanos(1000000L);
            }
            throw new ConversionCancelledException("interrupted while assembling");
        });
        RtConversionServiceImpl mocked = withAssembler(mockAssembler);

        try {
            Future<ConversionOutcome> future = mocked.submit(direct("slow", slow));
            assertTrue("worker never started", started.await(10, TimeUnit.SECONDS));
            future.cancel(true);

            assertTrue(future.isCancelled());
            assertTrue("cancellation was not logged", awaitMessage(mocked.getProgressLog(), "slow", "cancelled"));
        } finally {
            mocked.destroy();
        }
    }

    @Test
    public void progressIsLoggedPerRequest() {
        service.convertAll(Collections.singletonList(scanned("logged", SERIES_A, structureA, registry)));

        List<ProgressLog.Entry> entries = service.getProgressLog().entriesFor("logged");
        assertEquals("queued", entries.get(0).getMessage());
        assertTrue(entries.get(entries.size() - 1).getMessage().startsWith("completed"));
        assertTrue(entries.get(entries.size() - 1).getWorker().startsWith("rtconvert-worker-"));
    }

    @Test
    public void tracedStructureSetPaintsTheSameMask() throws Exception {
        MaskConversion first = service.convertToMask(scanned("first", SERIES_A, structureA, registry));

        StructureSet traced = service.convertToStructureSet(first.getMask(), first.getGrid(), null, "Traced");
        File written = service.writeStructureSet(traced, seriesA, new File(folder.getRoot(), "traced/rtstruct.dcm"));

        assertEquals(Collections.singletonList("Tumor"), service.listRegionNames(written));
        MaskConversion second = service.convertToMask(scanned("second", SERIES_A, written, registry));
        assertArrayEquals(first.getMask().toArray(), second.getMask().toArray());
    }

    private RtConversionServiceImpl withAssembler(VolumeAssembler assembler) {
        ConversionSettings settings = ConversionSettings.builder().workers(2).build();
        return new RtConversionServiceImpl(settings, new SeriesIndex(), assembler, new StructureSetReader(),
                new StructureSetWriter(), new ContourRasterizer(settings), new MaskVectorizer());
    }

    private ConversionRequest scanned(String id, String seriesUid, File structureSet, AssociationRegistry registry) {
        return ConversionRequest.builder()
                .id(id)
                .scanRoot(folder.getRoot())
                .seriesInstanceUid(seriesUid)
                .structureSetFile(structureSet)
                .registry(registry)
                .build();
    }

    private ConversionRequest direct(String id, ImageSeries series) {
        return ConversionRequest.builder()
                .id(id)
                .series(series)
                .structureSetFile(structureA)
                .registry(registry)
                .build();
    }

    private static File writeSquare(ImageSeries series, String frameOfReferenceUid, File target) throws IOException {
        Contour square = new Contour(SyntheticDicom.rectangle(1.5, 1.5, 5.5, 5.5, 2.0).getPoints(),
                SyntheticDicom.sopUid(series.getSeriesInstanceUid(), 1));
        Region gtv = new Region(1, "GTV", frameOfReferenceUid, null, "GTV", Collections.singletonList(square));
        StructureSet structureSet = new StructureSet(null, "Plan", frameOfReferenceUid,
                series.getSeriesInstanceUid(), null, Collections.singletonList(gtv));
        return new StructureSetWriter().write(structureSet, series, target);
    }

    private static boolean awaitMessage(ProgressLog log, String requestId, String message) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10000;
        while (System.currentTimeMillis() < deadline) {
            for (ProgressLog.Entry entry : log.entriesFor(requestId)) {
                if (message.equals(entry.getMessage())) {
                    return true;
                }
            }
            Thread.sleep(20);
        }
        return false;
    }
}
