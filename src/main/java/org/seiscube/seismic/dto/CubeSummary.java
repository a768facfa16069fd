package org.seiscube.seismic.dto;

import java.time.Instant;
import java.util.List;

/**
 * 已持久化数据体的列表项。
 *
 * @param cubeId    数据体 ID
 * @param filename  原始文件名
 * @param shape     形状 [inline, crossline, sample]
 * @param createdAt 创建时间
 * @param updatedAt 更新时间
 * @param active    是否为当前会话正在使用的数据体
 */
public record CubeSummary(
        String cubeId,
        String filename,
        List<Integer> shape,
        Instant createdAt,
        Instant updatedAt,
        boolean active
) {
}
