package org.seiscube.seismic;

import org.seiscube.seismic.dto.AmplitudeRange;
import org.seiscube.seismic.dto.AxisRange;
import org.seiscube.seismic.dto.CubeDeleteResult;
import org.seiscube.seismic.dto.CubeInfo;
import org.seiscube.seismic.dto.CubeListResult;
import org.seiscube.seismic.dto.CubeMetadataDocument;
import org.seiscube.seismic.dto.CubeSummary;
import org.seiscube.seismic.dto.LoadResult;
import org.seiscube.seismic.dto.SessionStatus;
import org.seiscube.seismic.dto.SlicePayload;
import org.seiscube.seismic.dto.SliceResult;
import org.seiscube.seismic.segy.SegyFile;
import org.seiscube.seismic.segy.SegyInput;
import org.seiscube.seismic.volume.CubeBuildResult;
import org.seiscube.seismic.volume.CubeBuilder;
import org.seiscube.seismic.volume.GeometryEstimator;
import org.seiscube.seismic.volume.SeismicCube;
import org.seiscube.seismic.volume.SliceAxis;
import org.seiscube.seismic.volume.SliceExtractor;
import org.seiscube.seismic.volume.SurveyGeometry;
import org.seiscube.seismic.volume.TraceStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * 地震数据体会话：持有当前数据体、切片缓存与持久化桥接。
 * <p>
 * 规则：
 * <ul>
 *   <li>加载在旁路完成构建，成功后一次原子替换发布新数据体，并清除旧数据体的缓存切片；失败时旧数据体保持不变。</li>
 *   <li>切片请求顺序：是否已加载 -> 下标校验 -> 内存缓存 -> 持久化副本 -> 现算（并在后台写入持久化副本）。</li>
 *   <li>持久化失败只记录日志，不影响内存中的加载与切片。</li>
 * </ul>
 * 会话之间不共享可变状态，可以在同一进程中创建多个。
 */
public class SeismicSession {

    private static final Logger log = LoggerFactory.getLogger(SeismicSession.class);

    private static final Pattern CUBE_ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,127}");

    private final Options options;
    private final CubeBuilder cubeBuilder;
    private final GeometryEstimator geometryEstimator;
    private final SliceExtractor sliceExtractor;
    private final SliceCache cache;
    private final PersistenceBridge persistence;
    private final BackgroundWorkerPool workers;

    private final AtomicReference<LoadedCube> current = new AtomicReference<>();

    public SeismicSession(Options options,
                          CubeBuilder cubeBuilder,
                          GeometryEstimator geometryEstimator,
                          SliceExtractor sliceExtractor,
                          SliceCache cache,
                          PersistenceBridge persistence,
                          BackgroundWorkerPool workers) {
        this.options = options;
        this.cubeBuilder = cubeBuilder;
        this.geometryEstimator = geometryEstimator;
        this.sliceExtractor = sliceExtractor;
        this.cache = cache;
        this.persistence = persistence;
        this.workers = workers;
    }

    /**
     * 从本地文件加载（.segy/.sgy，或包含 SEG-Y 成员的 .zip）。
     */
    public LoadResult load(Path file) {
        try (SegyInput input = SegyInput.open(file);
             SegyFile segy = SegyFile.open(input.path())) {
            return load(segy, input.displayName());
        } catch (IOException e) {
            throw new SeismicException(ErrorKind.FORMAT_ERROR,
                    "无法解析 SEG-Y 文件：" + file.getFileName() + "（" + e.getMessage() + "）", e);
        }
    }

    /**
     * 从任意道数据流加载，构建成功后原子替换当前数据体。
     */
    public LoadResult load(TraceStream stream, String filename) {
        long start = System.nanoTime();
        log.info("开始加载数据体：{}（{} 道，每道 {} 个采样）", filename, stream.traceCount(), stream.sampleCount());

        CubeBuildResult built = cubeBuilder.build(stream);
        SeismicCube cube = built.cube();
        SurveyGeometry geometry = geometryEstimator.estimate(built.mapping().resolvedHeaders());
        CubeInfo info = describe(cube, geometry);

        String cubeId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        LoadedCube loaded = new LoadedCube(cubeId, filename, cube, geometry, info, now);

        LoadedCube previous = current.getAndSet(loaded);
        if (previous != null) {
            int evicted = cache.invalidateCube(previous.cubeId());
            log.info("已替换数据体 {} -> {}，清除 {} 个旧缓存切片", previous.cubeId(), cubeId, evicted);
        }

        List<String> warnings = new ArrayList<>();
        if (built.mapping().fallbackTraces() > 0) {
            warnings.add(built.mapping().fallbackTraces() + " 条道缺少有效的 inline/crossline，已使用合成网格位置（"
                    + ErrorKind.HEADER_FIELD_ERROR.code() + "）");
        }
        if (built.mapping().duplicateTraces() > 0) {
            warnings.add(built.mapping().duplicateTraces() + " 条道的 (inline, crossline) 重复，后出现的道覆盖先出现的道");
        }
        if (built.skippedTraces() > 0) {
            warnings.add(built.skippedTraces() + " 条道读取失败已跳过，对应网格位置以 0 填充");
        }
        if (!geometry.hasCoordinates()) {
            warnings.add("有效坐标记录不足，测网方向为缺省值（" + ErrorKind.INSUFFICIENT_GEOMETRY_DATA.code() + "）");
        }
        if (!persistence.isStoreAvailable()) {
            warnings.add("持久化存储不可用（" + ErrorKind.STORE_UNAVAILABLE.code() + "），切片只在内存中提供");
        }

        persistence.saveMetadataAsync(new CubeMetadataDocument(filename, cubeId, info, now, now));
        boolean warmupScheduled = scheduleWarmup(loaded);

        long elapsedMillis = (System.nanoTime() - start) / 1_000_000L;
        log.info("数据体加载完成：{} id={} shape={} 用时 {} ms", filename, cubeId, info.shape(), elapsedMillis);
        return new LoadResult(
                cubeId,
                filename,
                stream.traceCount(),
                built.mapping().fallbackTraces(),
                built.mapping().duplicateTraces(),
                built.skippedTraces(),
                info,
                persistence.storeKind(),
                persistence.isStoreAvailable(),
                warmupScheduled,
                elapsedMillis,
                List.copyOf(warnings)
        );
    }

    public Optional<CubeInfo> cubeInfo() {
        LoadedCube loaded = current.get();
        return loaded == null ? Optional.empty() : Optional.of(loaded.cubeInfo());
    }

    public Optional<LoadedCube> currentCube() {
        return Optional.ofNullable(current.get());
    }

    /**
     * 获取切片。
     *
     * @throws SeismicException {@link ErrorKind#NO_CUBE_LOADED} / {@link ErrorKind#OUT_OF_RANGE_INDEX}
     */
    public ServedSlice getSlice(SliceAxis axis, int index) {
        LoadedCube loaded = current.get();
        if (loaded == null) {
            throw new SeismicException(ErrorKind.NO_CUBE_LOADED, "尚未加载数据体，请先调用 seismic_load");
        }
        int length = axis.length(loaded.cube());
        if (index < 0 || index >= length) {
            throw new SeismicException(ErrorKind.OUT_OF_RANGE_INDEX,
                    axis.label() + " 下标越界：" + index + "（最大下标：" + (length - 1) + "）");
        }

        SliceCache.Key key = new SliceCache.Key(loaded.cubeId(), axis, index);
        CachedSlice cached = cache.get(key);
        if (cached != null) {
            return new ServedSlice(loaded.cubeId(), axis, index, SliceSource.MEMORY, cached);
        }

        Optional<SlicePayload> stored = readStored(loaded, axis, index);
        if (stored.isPresent()) {
            CachedSlice slice = CachedSlice.of(stored.get());
            publish(loaded, key, slice);
            return new ServedSlice(loaded.cubeId(), axis, index, SliceSource.STORE, slice);
        }

        CachedSlice computed = computeSlice(loaded, axis, index);
        publish(loaded, key, computed);
        persistence.saveSliceAsync(loaded.cubeId(), axis, index, computed);
        return new ServedSlice(loaded.cubeId(), axis, index, SliceSource.COMPUTED, computed);
    }

    /**
     * 删除数据体的持久化副本，并清除其缓存切片。当前会话中的数据体不会被卸载，但之后不再写入存储，也不再出现在列表中。
     *
     * @throws SeismicException {@link ErrorKind#STORE_UNAVAILABLE} / {@link ErrorKind#NOT_FOUND}
     */
    public CubeDeleteResult delete(String cubeId) {
        String id = requireCubeId(cubeId);
        if (!persistence.isStoreAvailable()) {
            throw new SeismicException(ErrorKind.STORE_UNAVAILABLE, "持久化存储不可用（" + persistence.storeKind() + "）");
        }
        List<String> deleted = persistence.deleteCube(id);
        int evicted = cache.invalidateCube(id);
        if (deleted.isEmpty()) {
            throw new SeismicException(ErrorKind.NOT_FOUND, "未找到数据体：" + id);
        }
        log.info("已删除数据体 {}：{} 个持久化对象，{} 个缓存切片", id, deleted.size(), evicted);
        return new CubeDeleteResult(id, deleted.size(), evicted);
    }

    /**
     * 列出已持久化的数据体（按创建时间倒序）；当前数据体即使尚未写入存储也会出现在列表中。
     */
    public CubeListResult listCubes() {
        LoadedCube active = current.get();
        List<String> warnings = new ArrayList<>();
        List<CubeSummary> cubes = new ArrayList<>();
        boolean storeAvailable = persistence.isStoreAvailable();
        if (!storeAvailable) {
            warnings.add("持久化存储不可用（" + ErrorKind.STORE_UNAVAILABLE.code() + "），只列出当前会话中的数据体");
        }
        boolean activeListed = false;
        for (CubeMetadataDocument document : persistence.listMetadata()) {
            boolean isActive = active != null && active.cubeId().equals(document.cubeId());
            activeListed |= isActive;
            cubes.add(new CubeSummary(
                    document.cubeId(),
                    document.filename(),
                    document.cubeInfo() == null ? List.of() : document.cubeInfo().shape(),
                    document.createdAt(),
                    document.updatedAt(),
                    isActive
            ));
        }
        if (active != null && !activeListed && !persistence.isDeleted(active.cubeId())) {
            cubes.add(new CubeSummary(
                    active.cubeId(),
                    active.filename(),
                    active.cubeInfo().shape(),
                    active.createdAt(),
                    active.createdAt(),
                    true
            ));
        }
        cubes.sort(Comparator.comparing(CubeSummary::createdAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return new CubeListResult(List.copyOf(cubes), cubes.size(), storeAvailable, List.copyOf(warnings));
    }

    /**
     * 读取持久化的元数据文档。
     *
     * @throws SeismicException {@link ErrorKind#STORE_UNAVAILABLE} / {@link ErrorKind#NOT_FOUND}
     */
    public CubeMetadataDocument getCube(String cubeId) {
        String id = requireCubeId(cubeId);
        if (!persistence.isStoreAvailable()) {
            throw new SeismicException(ErrorKind.STORE_UNAVAILABLE, "持久化存储不可用（" + persistence.storeKind() + "）");
        }
        return persistence.readMetadata(id)
                .orElseThrow(() -> new SeismicException(ErrorKind.NOT_FOUND, "未找到数据体：" + id));
    }

    public SessionStatus status() {
        LoadedCube loaded = current.get();
        return new SessionStatus(
                loaded != null,
                loaded == null ? null : loaded.cubeId(),
                loaded == null ? null : loaded.filename(),
                persistence.storeKind(),
                persistence.isStoreAvailable(),
                cache.size(),
                cache.capacity(),
                workers.pendingTasks(),
                workers.completedTasks(),
                workers.failedTasks(),
                workers.droppedTasks()
        );
    }

    /**
     * 等待已提交的后台任务（元数据/切片写入、预热）全部完成。
     */
    public boolean awaitBackgroundWork(Duration timeout) throws InterruptedException {
        return workers.drain(timeout);
    }

    static CubeInfo describe(SeismicCube cube, SurveyGeometry geometry) {
        int[] inlines = cube.inlineValues();
        int[] crosslines = cube.crosslineValues();
        double[] samples = cube.samplePositions();
        return new CubeInfo(
                List.of(cube.inlineCount(), cube.crosslineCount(), cube.sampleCount()),
                new AxisRange(inlines[0], inlines[inlines.length - 1], inlines.length),
                new AxisRange(crosslines[0], crosslines[crosslines.length - 1], crosslines.length),
                sampleRange(samples),
                AmplitudeRange.of(cube.stats()),
                cube.sizeInBytes() / (1024.0 * 1024.0),
                geometry
        );
    }

    private static AxisRange sampleRange(double[] samples) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double sample : samples) {
            min = Math.min(min, sample);
            max = Math.max(max, sample);
        }
        return new AxisRange(min, max, samples.length);
    }

    private CachedSlice computeSlice(LoadedCube loaded, SliceAxis axis, int index) {
        return CachedSlice.of(SlicePayload.of(sliceExtractor.extract(loaded.cube(), axis, index)));
    }

    private void publish(LoadedCube loaded, SliceCache.Key key, CachedSlice slice) {
        cache.put(key, slice);
        // 计算期间数据体已被替换：旧数据体的条目不再有效
        if (current.get() != loaded) {
            cache.invalidateCube(loaded.cubeId());
        }
    }

    /**
     * 回源顺序：JSON 副本 -> .npy 副本（坐标取自当前数据体，统计量重算）。形状不符的副本一律忽略。
     */
    private Optional<SlicePayload> readStored(LoadedCube loaded, SliceAxis axis, int index) {
        Optional<SlicePayload> json = persistence.readSlice(loaded.cubeId(), axis, index)
                .filter(payload -> matchesShape(loaded.cube(), axis, payload.rows(), payload.columns()));
        if (json.isPresent()) {
            return json;
        }
        return persistence.readSliceArray(loaded.cubeId(), axis, index)
                .filter(data -> matchesShape(loaded.cube(), axis, data.length, data.length == 0 ? 0 : data[0].length))
                .map(data -> SlicePayload.of(sliceExtractor.restore(loaded.cube(), axis, index, data)));
    }

    private static boolean matchesShape(SeismicCube cube, SliceAxis axis, int rows, int columns) {
        int expectedRows = switch (axis) {
            case INLINE, CROSSLINE -> cube.sampleCount();
            case SAMPLE -> cube.inlineCount();
        };
        int expectedColumns = switch (axis) {
            case INLINE -> cube.crosslineCount();
            case CROSSLINE -> cube.inlineCount();
            case SAMPLE -> cube.crosslineCount();
        };
        boolean matches = rows == expectedRows && columns == expectedColumns;
        if (!matches) {
            log.warn("持久化切片形状不匹配（{}x{}，期望 {}x{}），忽略该副本",
                    rows, columns, expectedRows, expectedColumns);
        }
        return matches;
    }

    private boolean scheduleWarmup(LoadedCube loaded) {
        if (!options.warmupEnabled()) {
            return false;
        }
        if (!persistence.isStoreAvailable()) {
            log.info("持久化存储不可用，跳过切片预热");
            return false;
        }
        boolean full = loaded.cube().sizeInBytes() <= options.warmupFullCacheMaxBytes();
        return workers.submit("预热切片 " + loaded.cubeId(), () -> warmup(loaded, full));
    }

    private void warmup(LoadedCube loaded, boolean full) {
        int produced = 0;
        for (SliceAxis axis : SliceAxis.values()) {
            int length = axis.length(loaded.cube());
            int from = 0;
            int to = length - 1;
            if (!full) {
                int centre = length / 2;
                from = Math.max(0, centre - options.warmupCenterRadius());
                to = Math.min(length - 1, centre + options.warmupCenterRadius());
            }
            for (int index = from; index <= to; index++) {
                if (current.get() != loaded) {
                    log.info("数据体 {} 已被替换，停止预热（已完成 {} 个切片）", loaded.cubeId(), produced);
                    return;
                }
                if (persistence.isDeleted(loaded.cubeId())) {
                    log.info("数据体 {} 已删除，停止预热（已完成 {} 个切片）", loaded.cubeId(), produced);
                    return;
                }
                SliceCache.Key key = new SliceCache.Key(loaded.cubeId(), axis, index);
                CachedSlice slice = cache.get(key);
                if (slice == null) {
                    slice = computeSlice(loaded, axis, index);
                    publish(loaded, key, slice);
                }
                persistence.saveSlice(loaded.cubeId(), axis, index, slice);
                produced++;
            }
        }
        log.info("数据体 {} 预热完成：{} 个切片（{}）", loaded.cubeId(), produced, full ? "全部" : "中心窗口");
    }

    private static String requireCubeId(String cubeId) {
        if (cubeId == null || cubeId.isBlank()) {
            throw new SeismicException(ErrorKind.INVALID_REQUEST, "cube_id 不能为空");
        }
        String id = cubeId.trim();
        if (!CUBE_ID_PATTERN.matcher(id).matches()) {
            throw new SeismicException(ErrorKind.INVALID_REQUEST, "cube_id 格式非法：" + cubeId);
        }
        return id;
    }

    /**
     * 切片来源。
     */
    public enum SliceSource {
        MEMORY("memory"),
        STORE("store"),
        COMPUTED("computed");

        private final String label;

        SliceSource(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    /**
     * 一次切片请求的结果。
     */
    public record ServedSlice(String cubeId, SliceAxis axis, int index, SliceSource source, CachedSlice slice) {

        /**
         * 返回的 data 是缓存数组的副本，调用方修改它不会影响缓存。
         *
         * @param compressed true 时返回 gzip + Base64 编码的完整 JSON 载荷，data 字段留空
         */
        public SliceResult toResult(boolean compressed) {
            SlicePayload payload = slice.payload();
            return new SliceResult(
                    cubeId,
                    axis.label(),
                    index,
                    source.label(),
                    payload.rows(),
                    payload.columns(),
                    compressed ? null : payload.copyOfData(),
                    payload.coordinates(),
                    payload.amplitudeStats(),
                    compressed ? "gzip+base64" : "json",
                    compressed ? Base64.getEncoder().encodeToString(slice.gzipBytes()) : null
            );
        }
    }

    /**
     * 会话选项。
     *
     * @param warmupEnabled            加载后是否预热切片
     * @param warmupFullCacheMaxBytes  数据体不超过该字节数时预热全部切片，否则只预热中心窗口
     * @param warmupCenterRadius       中心窗口半径（中心下标 ± radius）
     */
    public record Options(boolean warmupEnabled, long warmupFullCacheMaxBytes, int warmupCenterRadius) {

        public static Options defaults() {
            return new Options(true, 200L * 1024 * 1024, 2);
        }
    }
}
