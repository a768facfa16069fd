package org.seiscube.seismic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 输入文件路径解析：把调用方传入的路径解析成白名单根目录内的真实文件。
 * <p>
 * 规则：
 * <ul>
 *   <li>绝对路径匹配层级最长的根目录；相对路径按第一个根目录解析。</li>
 *   <li>阻止 {@code ../} 路径穿越；通过 realPath 校验，防止符号链接把路径带出根目录。</li>
 *   <li>目标必须是已存在的普通文件。</li>
 * </ul>
 * 所有拒绝都以 {@link ErrorKind#INVALID_REQUEST} 抛出。
 */
public class InputPathResolver {

    private final List<Path> roots;

    public InputPathResolver(List<String> configuredRoots) {
        this.roots = normalizeRoots(configuredRoots);
    }

    public List<Path> roots() {
        return roots;
    }

    public Path resolve(String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw invalid("输入路径不能为空");
        }
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许加载的根目录（app.seismic.input-roots）");
        }

        Path rawPath;
        try {
            rawPath = Path.of(inputPath.trim());
        } catch (RuntimeException e) {
            throw invalid("输入路径非法：" + inputPath);
        }

        Path root;
        Path absolute;
        if (rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            root = roots.stream()
                    .filter(absolute::startsWith)
                    .max(Comparator.comparingInt(Path::getNameCount))
                    .orElseThrow(() -> invalid("路径不在允许加载的根目录范围内：" + inputPath));
        } else {
            root = roots.get(0);
            absolute = root.resolve(rawPath).normalize();
        }

        // 先做字符串层面的 startsWith 校验，挡掉明显的 ../ 越界
        if (!absolute.startsWith(root)) {
            throw invalid("路径不在允许加载的根目录范围内：" + inputPath);
        }
        if (!Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw invalid("文件不存在：" + inputPath);
        }

        Path realRoot;
        Path realTarget;
        try {
            realRoot = root.toRealPath();
            realTarget = absolute.toRealPath();
        } catch (IOException e) {
            throw new SeismicException(ErrorKind.INVALID_REQUEST, "路径无法解析：" + inputPath, e);
        }
        if (!realTarget.startsWith(realRoot)) {
            throw invalid("路径通过链接逃逸出根目录：" + inputPath);
        }
        if (!Files.isRegularFile(realTarget)) {
            throw invalid("不是普通文件：" + inputPath);
        }
        return realTarget;
    }

    private static SeismicException invalid(String detail) {
        return new SeismicException(ErrorKind.INVALID_REQUEST, detail);
    }

    private static List<Path> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Path> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.seismic.input-roots[" + i + "] 不能为空");
            result.add(Path.of(value).toAbsolutePath().normalize());
        }
        return List.copyOf(result);
    }
}
