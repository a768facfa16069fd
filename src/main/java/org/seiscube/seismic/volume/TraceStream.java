package org.seiscube.seismic.volume;

import java.io.IOException;

/**
 * 按道顺序访问的地震数据流（上游读取器的抽象）。
 * <p>
 * 单道读取失败以 {@link IOException} 抛出，由调用方按道处理（回退或跳过），不会中断整个构建。
 */
public interface TraceStream {

    int traceCount();

    int sampleCount();

    /**
     * 采样轴坐标（时间/深度），长度等于 {@link #sampleCount()}。
     */
    double[] samplePositions();

    TraceHeader header(int traceIndex) throws IOException;

    float[] amplitudes(int traceIndex) throws IOException;
}
