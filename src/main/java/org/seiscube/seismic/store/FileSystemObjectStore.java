package org.seiscube.seismic.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 本地目录版对象存储：key 映射为 {@code root} 下的相对路径。
 * <p>
 * 写入采用“同目录临时文件 + 原子 move”，读到的要么是旧内容要么是完整的新内容；
 * 文件系统不支持 ATOMIC_MOVE 时降级为普通 move。
 * 越出 root 的 key（例如包含 {@code ..}）一律拒绝。
 */
public class FileSystemObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStore.class);

    private final Path root;
    private final boolean available;

    public FileSystemObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.available = initRoot(this.root);
    }

    public Path root() {
        return root;
    }

    @Override
    public String kind() {
        return "filesystem";
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public boolean put(String key, byte[] bytes, String contentType) {
        if (!available || bytes == null) {
            return false;
        }
        Path target = resolve(key);
        if (target == null) {
            return false;
        }
        try {
            Files.createDirectories(target.getParent());
            writeAtomically(target, bytes);
            return true;
        } catch (IOException e) {
            log.warn("写入对象失败：{}（{}）", key, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        if (!available) {
            return Optional.empty();
        }
        Path target = resolve(key);
        if (target == null || !Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (IOException e) {
            log.warn("读取对象失败：{}（{}）", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<String> list(String prefix) {
        if (!available) {
            return List.of();
        }
        String p = prefix == null ? "" : prefix;
        List<String> keys = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(root)) {
            stream.filter(f -> Files.isRegularFile(f, LinkOption.NOFOLLOW_LINKS))
                    .map(this::toKey)
                    .filter(k -> !isTempName(k) && k.startsWith(p))
                    .sorted()
                    .forEach(keys::add);
        } catch (IOException e) {
            log.warn("列出对象失败：prefix={}（{}）", p, e.getMessage());
            return List.of();
        }
        return keys;
    }

    @Override
    public List<String> deletePrefix(String prefix) {
        List<String> deleted = new ArrayList<>();
        for (String key : list(prefix)) {
            Path target = resolve(key);
            if (target == null) {
                continue;
            }
            try {
                if (Files.deleteIfExists(target)) {
                    deleted.add(key);
                }
            } catch (IOException e) {
                log.warn("删除对象失败：{}（{}）", key, e.getMessage());
            }
        }
        if (!deleted.isEmpty()) {
            pruneEmptyDirectories(prefix);
        }
        return deleted;
    }

    @Override
    public boolean exists(String key) {
        if (!available) {
            return false;
        }
        Path target = resolve(key);
        return target != null && Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS);
    }

    /**
     * @return key 对应的绝对路径；key 非法或越出 root 时返回 null
     */
    Path resolve(String key) {
        if (key == null || key.isBlank() || key.startsWith("/") || key.contains("\\")) {
            return null;
        }
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            log.warn("拒绝越出存储根目录的 key：{}", key);
            return null;
        }
        return target;
    }

    private String toKey(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private void pruneEmptyDirectories(String prefix) {
        int slash = prefix == null ? -1 : prefix.lastIndexOf('/');
        if (slash <= 0) {
            return;
        }
        Path dir = resolve(prefix.substring(0, slash));
        if (dir == null || !Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(dir)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(d -> Files.isDirectory(d, LinkOption.NOFOLLOW_LINKS))
                    .forEach(FileSystemObjectStore::deleteIfEmpty);
        } catch (IOException e) {
            log.debug("清理空目录失败：{}（{}）", dir, e.getMessage());
        }
    }

    private static void deleteIfEmpty(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            if (children.findAny().isEmpty()) {
                Files.deleteIfExists(dir);
            }
        } catch (IOException e) {
            log.debug("删除空目录失败：{}（{}）", dir, e.getMessage());
        }
    }

    private static boolean isTempName(String key) {
        int slash = key.lastIndexOf('/');
        String name = slash >= 0 ? key.substring(slash + 1) : key;
        return name.startsWith(".obj-") && name.endsWith(".tmp");
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), ".obj-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static boolean initRoot(Path root) {
        try {
            Files.createDirectories(root);
            return Files.isDirectory(root) && Files.isWritable(root);
        } catch (IOException e) {
            log.warn("对象存储根目录不可用，持久化将被跳过：{}（{}）", root, e.getMessage());
            return false;
        }
    }
}
