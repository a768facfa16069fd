package org.seiscube.seismic.volume;

/**
 * 头信息缺失/损坏时的网格位置回退策略。
 * <p>
 * 实现必须是确定性的：同样的 (traceIndex, traceCount) 总是得到同样的位置。
 */
public interface HeaderFallbackPolicy {

    /**
     * @param traceIndex 道在数据流中的位置（从 0 开始）
     * @param traceCount 数据流中的道总数
     * @param header     原始头信息；读取失败时为 null
     */
    GridPosition resolve(int traceIndex, int traceCount, TraceHeader header);
}
