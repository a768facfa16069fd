package org.seiscube.seismic.dto;

import org.seiscube.seismic.volume.SurveyGeometry;

import java.util.List;

/**
 * 当前数据体的概要信息。
 *
 * @param shape          形状 [inline, crossline, sample]
 * @param inlineRange    inline 值范围
 * @param crosslineRange crossline 值范围
 * @param sampleRange    采样轴（时间/深度）范围
 * @param amplitudeRange 振幅统计
 * @param memoryUsageMb  数据体占用内存（MB）
 * @param geometry       测网方向
 */
public record CubeInfo(
        List<Integer> shape,
        AxisRange inlineRange,
        AxisRange crosslineRange,
        AxisRange sampleRange,
        AmplitudeRange amplitudeRange,
        double memoryUsageMb,
        SurveyGeometry geometry
) {
}
