package org.seiscube.seismic.volume;

/**
 * {@link CubeBuilder#build(TraceStream)} 的结果。
 *
 * @param cube          构建好的数据体
 * @param mapping       网格映射（含解析后的道头，供几何估算使用）
 * @param skippedTraces 因振幅读取失败或网格位置缺失而跳过的道数量
 */
public record CubeBuildResult(
        SeismicCube cube,
        GridMapping mapping,
        int skippedTraces
) {
}
