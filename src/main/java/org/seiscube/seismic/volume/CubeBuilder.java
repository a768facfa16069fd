package org.seiscube.seismic.volume;

import org.seiscube.seismic.ErrorKind;
import org.seiscube.seismic.SeismicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把道数据流构建成稠密三维数据体。
 * <p>
 * 流程：
 * <ol>
 *   <li>逐道读取头信息（单道失败记为 null，交给 {@link GridMapper} 回退）。</li>
 *   <li>分配 0 填充的 (inline, crossline, sample) 数组。</li>
 *   <li>按道顺序拷贝振幅到 {@code cube[row, col, :]}，NaN/±Inf 置 0；重复位置后写覆盖先写。</li>
 *   <li>对整个数组计算振幅统计。</li>
 * </ol>
 * 单道失败只记录并跳过；数据流整体不可用（无道、无采样、体积超限）时抛出 {@link ErrorKind#FORMAT_ERROR}，
 * 不会产生部分构建的数据体。
 */
public class CubeBuilder {

    private static final Logger log = LoggerFactory.getLogger(CubeBuilder.class);

    private final GridMapper gridMapper;

    public CubeBuilder() {
        this(new GridMapper());
    }

    public CubeBuilder(GridMapper gridMapper) {
        this.gridMapper = Objects.requireNonNull(gridMapper, "gridMapper");
    }

    public CubeBuildResult build(TraceStream stream) {
        int traceCount = stream.traceCount();
        int sampleCount = stream.sampleCount();
        if (traceCount <= 0) {
            throw new SeismicException(ErrorKind.FORMAT_ERROR, "数据流中没有道");
        }
        if (sampleCount <= 0) {
            throw new SeismicException(ErrorKind.FORMAT_ERROR, "每道采样点数无效：" + sampleCount);
        }
        double[] samplePositions = stream.samplePositions();
        if (samplePositions == null || samplePositions.length != sampleCount) {
            throw new SeismicException(ErrorKind.FORMAT_ERROR, "采样轴长度与采样点数不一致");
        }

        List<TraceHeader> headers = readHeaders(stream, traceCount);
        GridMapping mapping = gridMapper.map(headers);
        GridIndex index = mapping.index();

        long cells = (long) index.inlineCount() * index.crosslineCount() * sampleCount;
        if (cells > Integer.MAX_VALUE - 8) {
            throw new SeismicException(ErrorKind.FORMAT_ERROR,
                    "数据体过大，无法在内存中构建：" + index.inlineCount() + " x " + index.crosslineCount() + " x " + sampleCount);
        }
        float[] data = new float[(int) cells];

        int skipped = 0;
        int limit = Math.min(traceCount, mapping.positions().size());
        for (int i = 0; i < limit; i++) {
            GridPosition position = mapping.positions().get(i);
            int row = index.rowOf(position.inline());
            int column = index.columnOf(position.crossline());
            if (row < 0 || column < 0) {
                skipped++;
                continue;
            }
            float[] amplitudes;
            try {
                amplitudes = stream.amplitudes(i);
            } catch (IOException | RuntimeException e) {
                log.debug("第 {} 道振幅读取失败，已跳过：{}", i, e.getMessage());
                skipped++;
                continue;
            }
            if (amplitudes == null) {
                skipped++;
                continue;
            }
            int base = (row * index.crosslineCount() + column) * sampleCount;
            int n = Math.min(sampleCount, amplitudes.length);
            for (int s = 0; s < n; s++) {
                data[base + s] = AmplitudeStatistics.sanitize(amplitudes[s]);
            }
            for (int s = n; s < sampleCount; s++) {
                data[base + s] = 0.0f;
            }
        }
        if (skipped > 0) {
            log.warn("构建数据体时跳过了 {} / {} 条道", skipped, traceCount);
        }

        AmplitudeStats stats = AmplitudeStatistics.of(data);
        SeismicCube cube = new SeismicCube(
                data,
                index.inlineValues(),
                index.crosslineValues(),
                samplePositions.clone(),
                stats
        );
        return new CubeBuildResult(cube, mapping, skipped);
    }

    private static List<TraceHeader> readHeaders(TraceStream stream, int traceCount) {
        List<TraceHeader> headers = new ArrayList<>(traceCount);
        int failed = 0;
        for (int i = 0; i < traceCount; i++) {
            try {
                headers.add(stream.header(i));
            } catch (IOException | RuntimeException e) {
                log.debug("第 {} 道头信息读取失败，将使用回退位置：{}", i, e.getMessage());
                headers.add(null);
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("{} 条道的头信息读取失败（{}），已交给回退策略处理", failed, ErrorKind.HEADER_FIELD_ERROR.code());
        }
        return headers;
    }
}
