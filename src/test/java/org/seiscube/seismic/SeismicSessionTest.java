package org.seiscube.seismic;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.seiscube.seismic.dto.CubeDeleteResult;
import org.seiscube.seismic.dto.CubeListResult;
import org.seiscube.seismic.dto.CubeMetadataDocument;
import org.seiscube.seismic.dto.CubeSummary;
import org.seiscube.seismic.dto.LoadResult;
import org.seiscube.seismic.dto.SessionStatus;
import org.seiscube.seismic.dto.SliceResult;
import org.seiscube.seismic.segy.SegyFixtureWriter;
import org.seiscube.seismic.segy.SegySampleFormat;
import org.seiscube.seismic.store.InMemoryObjectStore;
import org.seiscube.seismic.store.ObjectStore;
import org.seiscube.seismic.store.UnavailableObjectStore;
import org.seiscube.seismic.volume.CubeBuilder;
import org.seiscube.seismic.volume.GeometryEstimator;
import org.seiscube.seismic.volume.InMemoryTraceStream;
import org.seiscube.seismic.volume.SliceAxis;
import org.seiscube.seismic.volume.SliceExtractor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeismicSessionTest {

    private static final SeismicSession.Options NO_WARMUP = new SeismicSession.Options(false, 0, 0);

    @TempDir
    Path tempDir;

    private final BackgroundWorkerPool workers = new BackgroundWorkerPool("session-test", 2, 4096);
    private SliceCache cache;

    @AfterEach
    void tearDown() {
        workers.shutdown(Duration.ofSeconds(5));
    }

    @Test
    void load_publishesCubeAndPersistsMetadata() throws InterruptedException {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SeismicSession session = session(store, NO_WARMUP);

        LoadResult result = session.load(fourTraceSurvey(), "survey.segy");

        assertThat(result.cubeInfo().shape()).containsExactly(2, 2, 3);
        assertThat(result.traceCount()).isEqualTo(4);
        assertThat(result.fallbackTraces()).isZero();
        assertThat(result.storeAvailable()).isTrue();
        assertThat(result.storeKind()).isEqualTo("memory");
        assertThat(result.warmupScheduled()).isFalse();
        assertThat(result.warnings()).anyMatch(w -> w.contains("insufficient_geometry_data"));
        assertThat(result.cubeInfo().inlineRange().min()).isEqualTo(1.0);
        assertThat(result.cubeInfo().inlineRange().count()).isEqualTo(2);
        assertThat(result.cubeInfo().geometry().hasCoordinates()).isFalse();
        assertThat(session.cubeInfo()).contains(result.cubeInfo());

        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(5))).isTrue();
        assertThat(store.exists(PersistenceBridge.metadataKey(result.cubeId()))).isTrue();
        assertThat(session.getCube(result.cubeId()).filename()).isEqualTo("survey.segy");
    }

    @Test
    void load_recoveredProblemsAreReportedWithTheirCodes() {
        SeismicSession session = session(new UnavailableObjectStore(), NO_WARMUP);
        InMemoryTraceStream stream = new InMemoryTraceStream(2)
                .add(0, 0, 1f, 2f)
                .add(0, 0, 3f, 4f)
                .add(0, 0, 5f, 6f)
                .add(0, 0, 7f, 8f);

        LoadResult result = session.load(stream, "headerless.segy");

        assertThat(result.fallbackTraces()).isEqualTo(4);
        assertThat(result.cubeInfo().shape()).containsExactly(2, 2, 2);
        assertThat(result.warnings())
                .anyMatch(w -> w.contains(ErrorKind.HEADER_FIELD_ERROR.code()))
                .anyMatch(w -> w.contains(ErrorKind.INSUFFICIENT_GEOMETRY_DATA.code()))
                .anyMatch(w -> w.contains(ErrorKind.STORE_UNAVAILABLE.code()));
    }

    @Test
    void getSlice_sampleSliceMatchesSortedGrid() {
        SeismicSession session = session(new InMemoryObjectStore(), NO_WARMUP);
        session.load(fourTraceSurvey(), "survey.segy");

        SliceResult slice = session.getSlice(SliceAxis.SAMPLE, 0).toResult(false);

        assertThat(slice.rows()).isEqualTo(2);
        assertThat(slice.columns()).isEqualTo(2);
        assertThat(slice.data()).isDeepEqualTo(new float[][]{{11f, 21f}, {31f, 41f}});
        assertThat(slice.encoding()).isEqualTo("json");
        assertThat(slice.compressedPayload()).isNull();
    }

    @Test
    void getSlice_servesMemoryThenStoreThenComputed() throws InterruptedException {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SeismicSession session = session(store, NO_WARMUP);
        String cubeId = session.load(fourTraceSurvey(), "survey.segy").cubeId();

        SeismicSession.ServedSlice first = session.getSlice(SliceAxis.INLINE, 1);
        SeismicSession.ServedSlice second = session.getSlice(SliceAxis.INLINE, 1);
        assertThat(first.source()).isEqualTo(SeismicSession.SliceSource.COMPUTED);
        assertThat(second.source()).isEqualTo(SeismicSession.SliceSource.MEMORY);

        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(5))).isTrue();
        assertThat(store.exists(PersistenceBridge.sliceJsonKey(cubeId, SliceAxis.INLINE, 1))).isTrue();
        assertThat(store.exists(PersistenceBridge.sliceNpyKey(cubeId, SliceAxis.INLINE, 1))).isTrue();

        cache.invalidateCube(cubeId);
        SeismicSession.ServedSlice third = session.getSlice(SliceAxis.INLINE, 1);

        assertThat(third.source()).isEqualTo(SeismicSession.SliceSource.STORE);
        assertThat(third.slice().payload().data()).isDeepEqualTo(first.slice().payload().data());
        assertThat(cache.get(new SliceCache.Key(cubeId, SliceAxis.INLINE, 1))).isNotNull();
    }

    @Test
    void getSlice_storedCopyWithWrongShapeIsRecomputed() {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SeismicSession session = session(store, NO_WARMUP);
        String cubeId = session.load(fourTraceSurvey(), "survey.segy").cubeId();
        store.put(PersistenceBridge.sliceJsonKey(cubeId, SliceAxis.SAMPLE, 0),
                "{\"data\":[[1.0]],\"coordinates\":{\"x\":[1],\"y\":[1]},\"amplitude_stats\":{\"min\":1,\"max\":1,\"mean\":1,\"std\":0}}"
                        .getBytes(StandardCharsets.UTF_8),
                ObjectStore.CONTENT_TYPE_JSON);

        SeismicSession.ServedSlice slice = session.getSlice(SliceAxis.SAMPLE, 0);

        assertThat(slice.source()).isEqualTo(SeismicSession.SliceSource.COMPUTED);
        assertThat(slice.slice().payload().rows()).isEqualTo(2);
    }

    @Test
    void getSlice_compressedResultDecodesToSameJson() throws IOException {
        SeismicSession session = session(new InMemoryObjectStore(), NO_WARMUP);
        session.load(fourTraceSurvey(), "survey.segy");
        SeismicSession.ServedSlice served = session.getSlice(SliceAxis.CROSSLINE, 0);

        SliceResult result = served.toResult(true);

        assertThat(result.encoding()).isEqualTo("gzip+base64");
        assertThat(result.data()).isNull();
        byte[] json = GzipBytes.gunzip(Base64.getDecoder().decode(result.compressedPayload()));
        assertThat(json).isEqualTo(served.slice().jsonBytes());
    }

    @Test
    void getSlice_rejectsMissingCubeAndOutOfRangeIndex() {
        SeismicSession session = session(new InMemoryObjectStore(), NO_WARMUP);

        assertThatThrownBy(() -> session.getSlice(SliceAxis.INLINE, 0))
                .isInstanceOf(SeismicException.class)
                .satisfies(e -> assertThat(((SeismicException) e).kind()).isEqualTo(ErrorKind.NO_CUBE_LOADED));

        session.load(fourTraceSurvey(), "survey.segy");

        assertThatThrownBy(() -> session.getSlice(SliceAxis.SAMPLE, 3))
                .isInstanceOf(SeismicException.class)
                .hasMessageStartingWith("out_of_range_index")
                .hasMessageContaining("最大下标：2");
        assertThatThrownBy(() -> session.getSlice(SliceAxis.INLINE, -1))
                .isInstanceOf(SeismicException.class)
                .satisfies(e -> assertThat(((SeismicException) e).kind()).isEqualTo(ErrorKind.OUT_OF_RANGE_INDEX));
    }

    @Test
    void reload_swapsCubeAndInvalidatesOldSlices() {
        SeismicSession session = session(new InMemoryObjectStore(), NO_WARMUP);
        String firstId = session.load(fourTraceSurvey(), "first.segy").cubeId();
        session.getSlice(SliceAxis.INLINE, 0);
        session.getSlice(SliceAxis.SAMPLE, 2);
        assertThat(cache.size()).isEqualTo(2);

        InMemoryTraceStream bigger = new InMemoryTraceStream(2)
                .add(5, 1, 1f, 1f)
                .add(6, 1, 2f, 2f)
                .add(7, 1, 3f, 3f);
        LoadResult second = session.load(bigger, "second.segy");

        assertThat(second.cubeId()).isNotEqualTo(firstId);
        assertThat(cache.keys()).noneMatch(k -> k.cubeId().equals(firstId));
        assertThat(session.cubeInfo().orElseThrow().shape()).containsExactly(3, 1, 2);
        assertThat(session.getSlice(SliceAxis.INLINE, 2).cubeId()).isEqualTo(second.cubeId());
    }

    @Test
    void failedLoadKeepsPreviousCube() {
        SeismicSession session = session(new InMemoryObjectStore(), NO_WARMUP);
        String cubeId = session.load(fourTraceSurvey(), "good.segy").cubeId();

        assertThatThrownBy(() -> session.load(new InMemoryTraceStream(3), "empty.segy"))
                .isInstanceOf(SeismicException.class)
                .satisfies(e -> assertThat(((SeismicException) e).kind()).isEqualTo(ErrorKind.FORMAT_ERROR));

        assertThat(session.status().cubeId()).isEqualTo(cubeId);
        assertThat(session.cubeInfo().orElseThrow().shape()).containsExactly(2, 2, 3);
    }

    @Test
    void loadPath_readsSegyFileAndRejectsCorruptFileWithoutReplacingCube() throws IOException {
        SeismicSession session = session(new InMemoryObjectStore(), NO_WARMUP);
        Path segy = new SegyFixtureWriter(SegySampleFormat.IBM_FLOAT32, 3)
                .trace(1, 1, 11f, 12f, 13f)
                .trace(1, 2, 21f, 22f, 23f)
                .trace(2, 1, 31f, 32f, 33f)
                .trace(2, 2, 41f, 42f, 43f)
                .writeTo(tempDir.resolve("line.sgy"));

        LoadResult result = session.load(segy);

        assertThat(result.filename()).isEqualTo("line.sgy");
        assertThat(result.cubeInfo().sampleRange().max()).isEqualTo(4.0);
        assertThat(session.getSlice(SliceAxis.SAMPLE, 2).slice().payload().data())
                .isDeepEqualTo(new float[][]{{13f, 23f}, {33f, 43f}});

        Path corrupt = Files.write(tempDir.resolve("corrupt.segy"), new byte[100]);
        assertThatThrownBy(() -> session.load(corrupt))
                .isInstanceOf(SeismicException.class)
                .hasMessageStartingWith("format_error");
        assertThat(session.status().cubeId()).isEqualTo(result.cubeId());
    }

    @Test
    void warmup_persistsEverySliceOfSmallCube() throws InterruptedException {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SeismicSession session = session(store, SeismicSession.Options.defaults());

        LoadResult result = session.load(fourTraceSurvey(), "survey.segy");

        assertThat(result.warmupScheduled()).isTrue();
        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(10))).isTrue();
        // (2 + 2 + 3) 个切片，每个切片 JSON + .npy
        assertThat(store.list(PersistenceBridge.cubePrefix(result.cubeId()) + "slices/")).hasSize(14);
        assertThat(session.getSlice(SliceAxis.SAMPLE, 1).source()).isEqualTo(SeismicSession.SliceSource.MEMORY);
    }

    @Test
    void warmup_largeCubeOnlyCoversCentreWindow() throws InterruptedException {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SeismicSession session = session(store, new SeismicSession.Options(true, 0, 1));
        InMemoryTraceStream stream = new InMemoryTraceStream(9);
        for (int il = 1; il <= 6; il++) {
            stream.add(il, 1, 1f, 2f, 3f, 4f, 5f, 6f, 7f, 8f, 9f);
        }

        String cubeId = session.load(stream, "wide.segy").cubeId();
        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(10))).isTrue();

        String slices = PersistenceBridge.cubePrefix(cubeId) + "slices/";
        assertThat(store.list(slices + "inline_")).extracting(k -> k.substring(slices.length()))
                .containsExactly("inline_2.json", "inline_2.npy", "inline_3.json", "inline_3.npy", "inline_4.json", "inline_4.npy");
        assertThat(store.list(slices + "crossline_")).hasSize(2);
        assertThat(store.list(slices + "sample_")).hasSize(6);
    }

    @Test
    void unavailableStoreStillServesSlicesFromMemory() {
        SeismicSession session = session(new UnavailableObjectStore(), SeismicSession.Options.defaults());

        LoadResult result = session.load(fourTraceSurvey(), "survey.segy");

        assertThat(result.storeAvailable()).isFalse();
        assertThat(result.warmupScheduled()).isFalse();
        assertThat(result.warnings()).anyMatch(w -> w.contains("store_unavailable"));
        assertThat(session.getSlice(SliceAxis.INLINE, 0).source()).isEqualTo(SeismicSession.SliceSource.COMPUTED);
        assertThat(session.getSlice(SliceAxis.INLINE, 0).source()).isEqualTo(SeismicSession.SliceSource.MEMORY);
        assertThatThrownBy(() -> session.getCube(result.cubeId()))
                .isInstanceOf(SeismicException.class)
                .satisfies(e -> assertThat(((SeismicException) e).kind()).isEqualTo(ErrorKind.STORE_UNAVAILABLE));
        assertThatThrownBy(() -> session.delete(result.cubeId()))
                .isInstanceOf(SeismicException.class)
                .satisfies(e -> assertThat(((SeismicException) e).kind()).isEqualTo(ErrorKind.STORE_UNAVAILABLE));

        CubeListResult list = session.listCubes();
        assertThat(list.storeAvailable()).isFalse();
        assertThat(list.cubes()).extracting(CubeSummary::cubeId).containsExactly(result.cubeId());
    }

    @Test
    void delete_removesPersistedObjectsAndCachedSlices() throws InterruptedException {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SeismicSession session = session(store, NO_WARMUP);
        String cubeId = session.load(fourTraceSurvey(), "survey.segy").cubeId();
        session.getSlice(SliceAxis.INLINE, 0);
        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(5))).isTrue();

        CubeDeleteResult deleted = session.delete(cubeId);

        assertThat(deleted.deletedObjectsCount()).isEqualTo(3);
        assertThat(deleted.evictedCacheEntries()).isEqualTo(1);
        assertThat(store.list(PersistenceBridge.cubePrefix(cubeId))).isEmpty();
        assertThat(session.status().cubeLoaded()).isTrue();
        assertThatThrownBy(() -> session.delete(cubeId))
                .isInstanceOf(SeismicException.class)
                .satisfies(e -> assertThat(((SeismicException) e).kind()).isEqualTo(ErrorKind.NOT_FOUND));
        assertThatThrownBy(() -> session.getCube(cubeId))
                .isInstanceOf(SeismicException.class)
                .hasMessageStartingWith("not_found");
    }

    @Test
    void deletedCubeKeepsServingSlicesWithoutWritingToStore() throws InterruptedException {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SeismicSession session = session(store, NO_WARMUP);
        String cubeId = session.load(fourTraceSurvey(), "survey.segy").cubeId();
        session.getSlice(SliceAxis.INLINE, 0);
        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(5))).isTrue();

        session.delete(cubeId);
        SeismicSession.ServedSlice again = session.getSlice(SliceAxis.INLINE, 0);
        session.getSlice(SliceAxis.SAMPLE, 1);
        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(5))).isTrue();

        assertThat(again.source()).isEqualTo(SeismicSession.SliceSource.COMPUTED);
        assertThat(store.list(PersistenceBridge.cubePrefix(cubeId))).isEmpty();
        assertThat(session.listCubes().cubes()).isEmpty();
        assertThat(session.status().cubeLoaded()).isTrue();
    }

    @Test
    void deletingFreshCubeStopsQueuedMetadataAndWarmupWrites() throws InterruptedException {
        InMemoryObjectStore store = new InMemoryObjectStore();
        BackgroundWorkerPool busy = new BackgroundWorkerPool("session-busy", 1, 64);
        busy.start();
        CountDownLatch release = new CountDownLatch(1);
        busy.submit("blocker", () -> awaitQuietly(release));
        cache = new SliceCache(8);
        SeismicSession session = new SeismicSession(SeismicSession.Options.defaults(), new CubeBuilder(),
                new GeometryEstimator(), new SliceExtractor(), cache, new PersistenceBridge(store, busy), busy);

        LoadResult loaded = session.load(fourTraceSurvey(), "survey.segy");
        assertThat(loaded.warmupScheduled()).isTrue();
        assertThatThrownBy(() -> session.delete(loaded.cubeId()))
                .isInstanceOf(SeismicException.class)
                .hasMessageStartingWith("not_found");
        release.countDown();

        try {
            assertThat(busy.drain(Duration.ofSeconds(10))).isTrue();
            assertThat(store.list(PersistenceBridge.cubePrefix(loaded.cubeId()))).isEmpty();
            assertThat(session.listCubes().cubes()).isEmpty();
        } finally {
            busy.shutdown(Duration.ofSeconds(5));
        }
    }

    @Test
    void getSlice_fallsBackToNpyCopyWhenJsonIsMissing() throws InterruptedException {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SeismicSession session = session(store, NO_WARMUP);
        String cubeId = session.load(fourTraceSurvey(), "survey.segy").cubeId();
        SeismicSession.ServedSlice computed = session.getSlice(SliceAxis.CROSSLINE, 1);
        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(5))).isTrue();

        store.deletePrefix(PersistenceBridge.sliceJsonKey(cubeId, SliceAxis.CROSSLINE, 1));
        cache.invalidateCube(cubeId);
        SeismicSession.ServedSlice restored = session.getSlice(SliceAxis.CROSSLINE, 1);

        assertThat(restored.source()).isEqualTo(SeismicSession.SliceSource.STORE);
        assertThat(restored.slice().payload().data()).isDeepEqualTo(computed.slice().payload().data());
        assertThat(restored.slice().payload().coordinates()).isEqualTo(computed.slice().payload().coordinates());
        assertThat(restored.slice().payload().amplitudeStats()).isEqualTo(computed.slice().payload().amplitudeStats());
    }

    @Test
    void sliceResultDataCanBeModifiedWithoutTouchingCache() {
        SeismicSession session = session(new InMemoryObjectStore(), NO_WARMUP);
        session.load(fourTraceSurvey(), "survey.segy");

        SliceResult first = session.getSlice(SliceAxis.SAMPLE, 0).toResult(false);
        first.data()[0][0] = 999f;
        SliceResult second = session.getSlice(SliceAxis.SAMPLE, 0).toResult(false);

        assertThat(second.source()).isEqualTo("memory");
        assertThat(second.data()).isDeepEqualTo(new float[][]{{11f, 21f}, {31f, 41f}});
    }

    @Test
    void cubeIdsWithPathCharactersAreRejected() {
        SeismicSession session = session(new InMemoryObjectStore(), NO_WARMUP);

        assertThatThrownBy(() -> session.delete("../other"))
                .isInstanceOf(SeismicException.class)
                .satisfies(e -> assertThat(((SeismicException) e).kind()).isEqualTo(ErrorKind.INVALID_REQUEST));
        assertThatThrownBy(() -> session.getCube(" "))
                .isInstanceOf(SeismicException.class)
                .hasMessageStartingWith("invalid_request");
    }

    @Test
    void listCubes_sortsByCreationTimeDescendingAndMarksActive() throws InterruptedException {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SeismicSession session = session(store, NO_WARMUP);
        putMetadata(store, "old", Instant.parse("2023-01-01T00:00:00Z"));
        putMetadata(store, "mid", Instant.parse("2024-01-01T00:00:00Z"));
        String activeId = session.load(fourTraceSurvey(), "active.segy").cubeId();
        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(5))).isTrue();

        CubeListResult list = session.listCubes();

        assertThat(list.count()).isEqualTo(3);
        assertThat(list.cubes()).extracting(CubeSummary::cubeId).containsExactly(activeId, "mid", "old");
        assertThat(list.cubes()).extracting(CubeSummary::active).containsExactly(true, false, false);
        assertThat(list.warnings()).isEmpty();
    }

    @Test
    void status_reportsCacheAndWorkerCounters() throws InterruptedException {
        SeismicSession session = session(new InMemoryObjectStore(), NO_WARMUP);
        SessionStatus empty = session.status();
        assertThat(empty.cubeLoaded()).isFalse();
        assertThat(empty.cacheCapacity()).isEqualTo(8);

        session.load(fourTraceSurvey(), "survey.segy");
        session.getSlice(SliceAxis.SAMPLE, 0);
        assertThat(session.awaitBackgroundWork(Duration.ofSeconds(5))).isTrue();
        SessionStatus status = session.status();

        assertThat(status.cubeLoaded()).isTrue();
        assertThat(status.filename()).isEqualTo("survey.segy");
        assertThat(status.storeKind()).isEqualTo("memory");
        assertThat(status.cacheSize()).isEqualTo(1);
        assertThat(status.completedTasks()).isEqualTo(2);
        assertThat(status.pendingTasks()).isZero();
    }

    @Test
    void sessionsDoNotShareState() {
        SeismicSession first = session(new InMemoryObjectStore(), NO_WARMUP);
        SliceCache firstCache = cache;
        SeismicSession second = session(new InMemoryObjectStore(), NO_WARMUP);

        first.load(fourTraceSurvey(), "first.segy");
        first.getSlice(SliceAxis.INLINE, 0);

        assertThat(second.cubeInfo()).isEmpty();
        assertThat(firstCache.size()).isEqualTo(1);
        assertThat(cache.size()).isZero();
    }

    private SeismicSession session(ObjectStore store, SeismicSession.Options options) {
        workers.start();
        cache = new SliceCache(8);
        return new SeismicSession(
                options,
                new CubeBuilder(),
                new GeometryEstimator(),
                new SliceExtractor(),
                cache,
                new PersistenceBridge(store, workers),
                workers
        );
    }

    private static InMemoryTraceStream fourTraceSurvey() {
        return new InMemoryTraceStream(3)
                .add(1, 1, 11f, 12f, 13f)
                .add(1, 2, 21f, 22f, 23f)
                .add(2, 1, 31f, 32f, 33f)
                .add(2, 2, 41f, 42f, 43f);
    }

    private static void putMetadata(InMemoryObjectStore store, String cubeId, Instant createdAt) {
        CubeMetadataDocument document = new CubeMetadataDocument(cubeId + ".segy", cubeId, null, createdAt, createdAt);
        store.put(PersistenceBridge.metadataKey(cubeId), SeismicJson.toBytes(document), ObjectStore.CONTENT_TYPE_JSON);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
