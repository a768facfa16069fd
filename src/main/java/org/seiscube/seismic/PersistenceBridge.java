package org.seiscube.seismic;

import org.seiscube.seismic.dto.CubeMetadataDocument;
import org.seiscube.seismic.dto.SlicePayload;
import org.seiscube.seismic.store.ObjectStore;
import org.seiscube.seismic.volume.NpyArrays;
import org.seiscube.seismic.volume.SliceAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 元数据与切片的持久化镜像（写入尽力而为，读取用于缓存未命中时的回源）。
 * <p>
 * key 规则：
 * <ul>
 *   <li>{@code cubes/{cubeId}/metadata.json}</li>
 *   <li>{@code cubes/{cubeId}/slices/{axis}_{index}.json}</li>
 *   <li>{@code cubes/{cubeId}/slices/{axis}_{index}.npy}</li>
 * </ul>
 * 任何存储失败都只记录日志，不影响内存中的操作。
 * <p>
 * 已删除的数据体不再写入：即使仍在内存中提供切片，后续的切片/元数据写入与预热都会被跳过，
 * 避免在 {@code cubes/{cubeId}/} 下留下没有元数据的孤儿对象。
 */
public class PersistenceBridge {

    private static final Logger log = LoggerFactory.getLogger(PersistenceBridge.class);

    private static final String CUBES_PREFIX = "cubes/";
    private static final String METADATA_FILE = "metadata.json";

    private final ObjectStore store;
    private final BackgroundWorkerPool workers;
    private final Set<String> deletedCubes = ConcurrentHashMap.newKeySet();

    public PersistenceBridge(ObjectStore store, BackgroundWorkerPool workers) {
        this.store = store;
        this.workers = workers;
    }

    public static String cubePrefix(String cubeId) {
        return CUBES_PREFIX + cubeId + "/";
    }

    public static String metadataKey(String cubeId) {
        return cubePrefix(cubeId) + METADATA_FILE;
    }

    public static String sliceJsonKey(String cubeId, SliceAxis axis, int index) {
        return sliceBaseKey(cubeId, axis, index) + ".json";
    }

    public static String sliceNpyKey(String cubeId, SliceAxis axis, int index) {
        return sliceBaseKey(cubeId, axis, index) + ".npy";
    }

    private static String sliceBaseKey(String cubeId, SliceAxis axis, int index) {
        return cubePrefix(cubeId) + "slices/" + axis.label() + "_" + index;
    }

    public boolean isStoreAvailable() {
        return store.isAvailable();
    }

    public String storeKind() {
        return store.kind();
    }

    public boolean isDeleted(String cubeId) {
        return deletedCubes.contains(cubeId);
    }

    /**
     * 在后台写入元数据文档。
     *
     * @return 是否成功入队
     */
    public boolean saveMetadataAsync(CubeMetadataDocument document) {
        String cubeId = document.cubeId();
        if (!store.isAvailable() || isDeleted(cubeId)) {
            return false;
        }
        byte[] bytes = SeismicJson.toBytes(document);
        String key = metadataKey(cubeId);
        return workers.submit("写入元数据 " + key, () -> {
            if (isDeleted(cubeId)) {
                log.debug("数据体 {} 已删除，跳过元数据写入", cubeId);
                return;
            }
            if (!store.put(key, bytes, ObjectStore.CONTENT_TYPE_JSON)) {
                log.warn("元数据写入失败：{}", key);
            }
            purgeIfDeleted(cubeId);
        });
    }

    /**
     * 同步写入切片的 JSON 与 .npy 副本（在后台线程中调用）。
     *
     * @return 两个副本是否都写入成功
     */
    public boolean saveSlice(String cubeId, SliceAxis axis, int index, CachedSlice slice) {
        if (!store.isAvailable()) {
            return false;
        }
        if (isDeleted(cubeId)) {
            log.debug("数据体 {} 已删除，跳过切片写入：{}_{}", cubeId, axis.label(), index);
            return false;
        }
        String jsonKey = sliceJsonKey(cubeId, axis, index);
        boolean jsonSaved = store.put(jsonKey, slice.jsonBytes(), ObjectStore.CONTENT_TYPE_JSON);
        if (!jsonSaved) {
            log.warn("切片 JSON 写入失败：{}", jsonKey);
        }
        String npyKey = sliceNpyKey(cubeId, axis, index);
        boolean npySaved = store.put(npyKey, NpyArrays.writeFloat32(slice.payload().data()), ObjectStore.CONTENT_TYPE_BINARY);
        if (!npySaved) {
            log.warn("切片 .npy 写入失败：{}", npyKey);
        }
        if (purgeIfDeleted(cubeId)) {
            return false;
        }
        return jsonSaved && npySaved;
    }

    public boolean saveSliceAsync(String cubeId, SliceAxis axis, int index, CachedSlice slice) {
        if (!store.isAvailable() || isDeleted(cubeId)) {
            return false;
        }
        return workers.submit("写入切片 " + sliceBaseKey(cubeId, axis, index),
                () -> saveSlice(cubeId, axis, index, slice));
    }

    /**
     * 读取持久化的切片 JSON 副本；不存在或解析失败时返回空。
     */
    public Optional<SlicePayload> readSlice(String cubeId, SliceAxis axis, int index) {
        if (!store.isAvailable()) {
            return Optional.empty();
        }
        String key = sliceJsonKey(cubeId, axis, index);
        Optional<byte[]> bytes = store.get(key);
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(SeismicJson.readSlicePayload(bytes.get()));
        } catch (IOException e) {
            log.warn("持久化切片无法解析，忽略：{}（{}）", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 读取持久化的切片 .npy 副本（JSON 副本缺失或损坏时使用）；不存在或格式不符时返回空。
     */
    public Optional<float[][]> readSliceArray(String cubeId, SliceAxis axis, int index) {
        if (!store.isAvailable()) {
            return Optional.empty();
        }
        String key = sliceNpyKey(cubeId, axis, index);
        Optional<byte[]> bytes = store.get(key);
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(NpyArrays.readFloat32(bytes.get()));
        } catch (IOException e) {
            log.warn("持久化 .npy 切片无法解析，忽略：{}（{}）", key, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<CubeMetadataDocument> readMetadata(String cubeId) {
        if (!store.isAvailable()) {
            return Optional.empty();
        }
        String key = metadataKey(cubeId);
        Optional<byte[]> bytes = store.get(key);
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(SeismicJson.readMetadata(bytes.get()));
        } catch (IOException e) {
            log.warn("元数据无法解析，忽略：{}（{}）", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 列出存储中的全部元数据文档（无法解析的跳过）。
     */
    public List<CubeMetadataDocument> listMetadata() {
        List<CubeMetadataDocument> documents = new ArrayList<>();
        if (!store.isAvailable()) {
            return documents;
        }
        for (String key : store.list(CUBES_PREFIX)) {
            if (!isMetadataKey(key)) {
                continue;
            }
            String cubeId = key.substring(CUBES_PREFIX.length(), key.length() - METADATA_FILE.length() - 1);
            readMetadata(cubeId).ifPresent(documents::add);
        }
        return documents;
    }

    /**
     * 删除数据体的全部持久化对象，并停止该数据体后续的写入。
     *
     * @return 实际删除的 key
     */
    public List<String> deleteCube(String cubeId) {
        if (!store.isAvailable()) {
            return List.of();
        }
        deletedCubes.add(cubeId);
        return store.deletePrefix(cubePrefix(cubeId));
    }

    /**
     * 写入与删除并发时，写入可能落在删除之后：写完再检查一次，已删除则清掉前缀下的对象。
     */
    private boolean purgeIfDeleted(String cubeId) {
        if (!isDeleted(cubeId)) {
            return false;
        }
        List<String> purged = store.deletePrefix(cubePrefix(cubeId));
        if (!purged.isEmpty()) {
            log.info("数据体 {} 已删除，清除删除期间写入的 {} 个对象", cubeId, purged.size());
        }
        return true;
    }

    private static boolean isMetadataKey(String key) {
        if (!key.startsWith(CUBES_PREFIX) || !key.endsWith("/" + METADATA_FILE)) {
            return false;
        }
        String middle = key.substring(CUBES_PREFIX.length(), key.length() - METADATA_FILE.length() - 1);
        return !middle.isEmpty() && middle.indexOf('/') < 0;
    }
}
