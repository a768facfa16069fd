package org.seiscube.seismic.dto;

import org.seiscube.seismic.volume.AmplitudeStats;

/**
 * 整个数据体的振幅范围与统计。
 * <p>
 * {@code displayMin/displayMax} 取 5%/95% 分位数，用作默认色标范围。
 */
public record AmplitudeRange(
        double actualMin,
        double actualMax,
        double displayMin,
        double displayMax,
        double mean,
        double std,
        double p1,
        double p5,
        double p95,
        double p99
) {

    public static AmplitudeRange of(AmplitudeStats stats) {
        return new AmplitudeRange(
                stats.actualMin(),
                stats.actualMax(),
                stats.p5(),
                stats.p95(),
                stats.mean(),
                stats.std(),
                stats.p1(),
                stats.p5(),
                stats.p95(),
                stats.p99()
        );
    }
}
