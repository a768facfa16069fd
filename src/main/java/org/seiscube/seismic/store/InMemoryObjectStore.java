package org.seiscube.seismic.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 内存版对象存储（单进程，重启即丢失）。用于测试与 {@code store.type=memory}。
 */
public class InMemoryObjectStore implements ObjectStore {

    private final ConcurrentSkipListMap<String, StoredObject> objects = new ConcurrentSkipListMap<>();

    @Override
    public String kind() {
        return "memory";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public boolean put(String key, byte[] bytes, String contentType) {
        if (key == null || key.isBlank() || bytes == null) {
            return false;
        }
        objects.put(key, new StoredObject(bytes.clone(), contentType));
        return true;
    }

    @Override
    public Optional<byte[]> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        StoredObject stored = objects.get(key);
        return stored == null ? Optional.empty() : Optional.of(stored.bytes().clone());
    }

    @Override
    public List<String> list(String prefix) {
        String p = prefix == null ? "" : prefix;
        List<String> keys = new ArrayList<>();
        for (String key : objects.tailMap(p, true).keySet()) {
            if (!key.startsWith(p)) {
                break;
            }
            keys.add(key);
        }
        return keys;
    }

    @Override
    public List<String> deletePrefix(String prefix) {
        List<String> deleted = new ArrayList<>();
        for (String key : list(prefix)) {
            if (objects.remove(key) != null) {
                deleted.add(key);
            }
        }
        return deleted;
    }

    @Override
    public boolean exists(String key) {
        return key != null && objects.containsKey(key);
    }

    /**
     * @return 写入时的 content type；对象不存在返回 null
     */
    public String contentType(String key) {
        StoredObject stored = objects.get(key);
        return stored == null ? null : stored.contentType();
    }

    private record StoredObject(byte[] bytes, String contentType) {
    }
}
