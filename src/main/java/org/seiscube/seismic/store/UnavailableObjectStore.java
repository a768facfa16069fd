package org.seiscube.seismic.store;

import java.util.List;
import java.util.Optional;

/**
 * 未配置持久化存储时使用：所有操作都是返回失败的空操作。
 */
public final class UnavailableObjectStore implements ObjectStore {

    private final String kind;

    public UnavailableObjectStore() {
        this("none");
    }

    public UnavailableObjectStore(String kind) {
        this.kind = kind;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public boolean put(String key, byte[] bytes, String contentType) {
        return false;
    }

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.empty();
    }

    @Override
    public List<String> list(String prefix) {
        return List.of();
    }

    @Override
    public List<String> deletePrefix(String prefix) {
        return List.of();
    }

    @Override
    public boolean exists(String key) {
        return false;
    }
}
