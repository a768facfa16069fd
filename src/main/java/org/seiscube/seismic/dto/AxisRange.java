package org.seiscube.seismic.dto;

/**
 * 单个坐标轴的取值范围。
 *
 * @param min   最小值
 * @param max   最大值
 * @param count 取值个数
 */
public record AxisRange(double min, double max, int count) {
}
