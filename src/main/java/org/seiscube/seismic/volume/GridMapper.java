package org.seiscube.seismic.volume;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 把无序的道头 (inline, crossline) 映射到稠密的 0 基网格坐标。
 * <p>
 * 规则：
 * <ul>
 *   <li>inline/crossline 都非 0 的道直接使用头信息。</li>
 *   <li>头信息为 0、缺失或读取失败（{@code null}）的道交给 {@link HeaderFallbackPolicy} 生成合成位置。</li>
 *   <li>去重后按数值升序排序，排序顺序即稠密下标顺序。</li>
 * </ul>
 * 该过程不会失败：总能给出一份尽力而为的映射。
 */
public class GridMapper {

    private static final Logger log = LoggerFactory.getLogger(GridMapper.class);

    private final HeaderFallbackPolicy fallbackPolicy;

    public GridMapper() {
        this(SyntheticGridFallback.INSTANCE);
    }

    public GridMapper(HeaderFallbackPolicy fallbackPolicy) {
        this.fallbackPolicy = Objects.requireNonNull(fallbackPolicy, "fallbackPolicy");
    }

    /**
     * @param headers 按道顺序排列的头信息；读取失败的道以 null 占位
     */
    public GridMapping map(List<TraceHeader> headers) {
        int traceCount = headers.size();
        List<GridPosition> positions = new ArrayList<>(traceCount);
        List<TraceHeader> resolvedHeaders = new ArrayList<>(traceCount);
        Set<Integer> inlines = new HashSet<>();
        Set<Integer> crosslines = new HashSet<>();
        Set<Long> seenPairs = new HashSet<>();
        int fallbackTraces = 0;
        int duplicateTraces = 0;

        for (int i = 0; i < traceCount; i++) {
            TraceHeader header = headers.get(i);
            GridPosition position;
            TraceHeader resolved;
            if (header != null && header.hasGridPosition()) {
                position = new GridPosition(header.inline(), header.crossline(), false);
                resolved = header;
            } else {
                position = fallbackPolicy.resolve(i, traceCount, header);
                resolved = TraceHeader.withoutPosition(position.inline(), position.crossline());
                fallbackTraces++;
            }
            if (!seenPairs.add(position.packed())) {
                duplicateTraces++;
            }
            positions.add(position);
            resolvedHeaders.add(resolved);
            inlines.add(position.inline());
            crosslines.add(position.crossline());
        }

        if (fallbackTraces > 0) {
            log.warn("{} / {} 条道的 inline/crossline 缺失或无效，已使用合成网格位置（无地理意义）", fallbackTraces, traceCount);
        }
        if (duplicateTraces > 0) {
            log.warn("{} 条道与前面的道 (inline, crossline) 重复，按后写覆盖处理", duplicateTraces);
        }
        return new GridMapping(
                GridIndex.of(inlines, crosslines),
                List.copyOf(positions),
                List.copyOf(resolvedHeaders),
                fallbackTraces,
                duplicateTraces
        );
    }
}
