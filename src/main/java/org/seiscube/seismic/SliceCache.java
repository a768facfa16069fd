package org.seiscube.seismic;

import org.seiscube.seismic.volume.SliceAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 切片 LRU 缓存（内存版，按条目数限流）。
 * <p>
 * 规则：
 * <ul>
 *   <li>{@link #get} 命中会把条目提升为“最近使用”；{@link #put} 覆盖已有 key 同样会提升。</li>
 *   <li>写入后条目数超过容量时淘汰最久未使用的条目，容量上限同时限制了序列化载荷的内存占用。</li>
 *   <li>删除/替换数据体时通过 {@link #invalidateCube(String)} 批量清除该数据体的全部条目。</li>
 * </ul>
 * 请求线程与后台线程都会访问；所有读写都在同一把锁内完成（条目很小，锁粒度足够）。
 */
public class SliceCache {

    private static final Logger log = LoggerFactory.getLogger(SliceCache.class);

    private final int maxEntries;
    private final Object lock = new Object();

    // accessOrder=true：get/put 都会把条目移到末尾，头部即最久未使用
    private final LinkedHashMap<Key, CachedSlice> map = new LinkedHashMap<>(256, 0.75f, true);

    public SliceCache(int maxEntries) {
        this.maxEntries = Math.max(1, maxEntries);
    }

    public CachedSlice get(Key key) {
        if (key == null) {
            return null;
        }
        synchronized (lock) {
            return map.get(key);
        }
    }

    public void put(Key key, CachedSlice value) {
        if (key == null || value == null) {
            return;
        }
        synchronized (lock) {
            map.put(key, value);
            while (map.size() > maxEntries) {
                Iterator<Map.Entry<Key, CachedSlice>> it = map.entrySet().iterator();
                if (!it.hasNext()) {
                    break;
                }
                it.next();
                it.remove();
            }
        }
    }

    /**
     * 清除某个数据体的全部缓存条目。
     *
     * @return 清除的条目数
     */
    public int invalidateCube(String cubeId) {
        if (cubeId == null) {
            return 0;
        }
        int removed = 0;
        synchronized (lock) {
            Iterator<Key> it = map.keySet().iterator();
            while (it.hasNext()) {
                if (cubeId.equals(it.next().cubeId())) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("已清除数据体 {} 的 {} 个缓存切片", cubeId, removed);
        }
        return removed;
    }

    public int size() {
        synchronized (lock) {
            return map.size();
        }
    }

    public int capacity() {
        return maxEntries;
    }

    /**
     * 从最久未使用到最近使用的 key 快照。
     */
    public List<Key> keys() {
        synchronized (lock) {
            return new ArrayList<>(map.keySet());
        }
    }

    /**
     * 缓存 key：(数据体 ID, 方向, 下标)。
     */
    public record Key(String cubeId, SliceAxis axis, int index) {
    }
}
