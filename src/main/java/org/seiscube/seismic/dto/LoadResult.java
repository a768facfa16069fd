package org.seiscube.seismic.dto;

import java.util.List;

/**
 * {@code seismic_load} 的返回结果。
 *
 * @param cubeId          新数据体 ID
 * @param filename        文件名（压缩包输入时为包内成员名）
 * @param traceCount      数据流中的道数量
 * @param fallbackTraces  使用合成网格位置的道数量
 * @param duplicateTraces (inline, crossline) 重复的道数量（后写覆盖先写）
 * @param skippedTraces   读取失败被跳过的道数量
 * @param cubeInfo        数据体概要
 * @param storeKind       持久化存储类别
 * @param storeAvailable  持久化存储是否可用
 * @param warmupScheduled 是否已安排后台预热切片
 * @param elapsedMillis   加载耗时（毫秒）
 * @param warnings        非致命告警
 */
public record LoadResult(
        String cubeId,
        String filename,
        int traceCount,
        int fallbackTraces,
        int duplicateTraces,
        int skippedTraces,
        CubeInfo cubeInfo,
        String storeKind,
        boolean storeAvailable,
        boolean warmupScheduled,
        long elapsedMillis,
        List<String> warnings
) {
}
