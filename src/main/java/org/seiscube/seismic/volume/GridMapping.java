package org.seiscube.seismic.volume;

import java.util.List;

/**
 * {@link GridMapper} 的输出。
 *
 * @param index           稠密网格索引
 * @param positions       每条道解析后的网格位置（与道顺序一一对应）
 * @param resolvedHeaders 每条道解析后的头信息：合成位置的道不携带坐标
 * @param fallbackTraces  走了回退策略的道数量
 * @param duplicateTraces 与前面某道 (inline, crossline) 重复的道数量（后写覆盖先写）
 */
public record GridMapping(
        GridIndex index,
        List<GridPosition> positions,
        List<TraceHeader> resolvedHeaders,
        int fallbackTraces,
        int duplicateTraces
) {
}
