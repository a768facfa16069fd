package org.seiscube.seismic.volume;

/**
 * 振幅统计（整个数据体或单个切片）。只会重新计算，不会修改。
 *
 * @param actualMin 最小值
 * @param actualMax 最大值
 * @param mean      均值
 * @param std       总体标准差
 * @param p1        1% 分位数
 * @param p5        5% 分位数
 * @param p95       95% 分位数
 * @param p99       99% 分位数
 */
public record AmplitudeStats(
        double actualMin,
        double actualMax,
        double mean,
        double std,
        double p1,
        double p5,
        double p95,
        double p99
) {

    public static final AmplitudeStats EMPTY = new AmplitudeStats(0, 0, 0, 0, 0, 0, 0, 0);
}
