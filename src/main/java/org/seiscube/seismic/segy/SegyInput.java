package org.seiscube.seismic.segy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * 待加载的 SEG-Y 输入。
 * <p>
 * 普通 {@code .segy/.sgy} 文件直接使用；{@code .zip} 压缩包会取第一个 {@code .segy/.sgy} 成员解压到临时文件，
 * {@link #close()} 时删除临时文件。
 *
 * @param path        可直接交给 {@link SegyFile#open(Path)} 的本地文件
 * @param displayName 对外展示的文件名（压缩包内成员取成员文件名）
 * @param temporary   {@code path} 是否为需要清理的临时文件
 */
public record SegyInput(Path path, String displayName, boolean temporary) implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SegyInput.class);

    public static SegyInput open(Path file) throws IOException {
        String name = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        if (!name.toLowerCase(Locale.ROOT).endsWith(".zip")) {
            return new SegyInput(file, name, false);
        }
        try (ZipFile zip = new ZipFile(file.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory() || !isSegyName(entry.getName())) {
                    continue;
                }
                String memberName = baseName(entry.getName());
                String suffix = memberName.toLowerCase(Locale.ROOT).endsWith(".sgy") ? ".sgy" : ".segy";
                Path tmp = Files.createTempFile("seismic-load-", suffix);
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
                } catch (IOException e) {
                    Files.deleteIfExists(tmp);
                    throw e;
                }
                log.info("已从压缩包 {} 解压 {} 到临时文件 {}", name, memberName, tmp);
                return new SegyInput(tmp, memberName, true);
            }
        }
        throw new SegyFormatException("压缩包中没有 .segy/.sgy 文件：" + name);
    }

    public static boolean isSegyName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".segy") || lower.endsWith(".sgy");
    }

    @Override
    public void close() {
        if (!temporary) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("删除临时文件失败：{}（{}）", path, e.getMessage());
        }
    }

    private static String baseName(String entryName) {
        String normalized = entryName.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
