package org.seiscube.seismic.volume;

/**
 * 默认回退策略：按道序号把道铺到一个近似正方形的合成网格上。
 * <p>
 * {@code gridSize = floor(sqrt(traceCount))}（至少 1），
 * {@code inline = position / gridSize + 1}，{@code crossline = position % gridSize + 1}。
 * <p>
 * 注意：这只是保证“每条道都能落进数据体”的近似处理，合成位置没有任何地球物理意义。
 */
public final class SyntheticGridFallback implements HeaderFallbackPolicy {

    public static final SyntheticGridFallback INSTANCE = new SyntheticGridFallback();

    private SyntheticGridFallback() {
    }

    @Override
    public GridPosition resolve(int traceIndex, int traceCount, TraceHeader header) {
        int gridSize = Math.max(1, (int) Math.floor(Math.sqrt(Math.max(0, traceCount))));
        return new GridPosition(traceIndex / gridSize + 1, traceIndex % gridSize + 1, true);
    }
}
