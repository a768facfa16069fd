package org.seiscube.seismic.store;

import java.util.List;
import java.util.Optional;

/**
 * 持久化对象存储（key -> bytes）。
 * <p>
 * 约定：所有方法都不抛异常；存储不可达或操作失败时记录日志并返回 {@code false}/空结果，
 * 这样上层的内存操作永远不会因为持久化失败而失败。
 * key 统一使用 {@code /} 分隔，例如 {@code cubes/{cubeId}/metadata.json}。
 */
public interface ObjectStore {

    String CONTENT_TYPE_JSON = "application/json";
    String CONTENT_TYPE_BINARY = "application/octet-stream";

    /**
     * 存储类别（filesystem/s3/memory/none），用于状态展示。
     */
    String kind();

    /**
     * 存储是否可用；不可用时其余操作都是返回失败的空操作。
     */
    boolean isAvailable();

    boolean put(String key, byte[] bytes, String contentType);

    Optional<byte[]> get(String key);

    /**
     * @return 以 prefix 开头的全部 key（升序）
     */
    List<String> list(String prefix);

    /**
     * @return 实际删除的 key
     */
    List<String> deletePrefix(String prefix);

    boolean exists(String key);
}
