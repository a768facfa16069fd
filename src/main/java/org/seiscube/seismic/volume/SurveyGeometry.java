package org.seiscube.seismic.volume;

/**
 * 测网方向信息。
 * <p>
 * {@code hasCoordinates=false} 表示这是缺省几何（inline 朝东、crossline 朝北），不是由坐标计算得到的，
 * 下游必须以该字段区分两者。
 *
 * @param inlineDirection    inline 轴方向单位向量
 * @param crosslineDirection crossline 轴方向单位向量
 * @param inlineAzimuth      inline 方位角（度，自正北顺时针）
 * @param crosslineAzimuth   crossline 方位角（度）
 * @param rotationAngle      测网旋转角，等于 crossline 方位角
 * @param coordinateSystem   坐标系类别
 * @param hasCoordinates     是否由真实坐标计算
 * @param positionRecords    参与估算的有效坐标记录数
 */
public record SurveyGeometry(
        DirectionVector inlineDirection,
        DirectionVector crosslineDirection,
        double inlineAzimuth,
        double crosslineAzimuth,
        double rotationAngle,
        CoordinateSystem coordinateSystem,
        boolean hasCoordinates,
        int positionRecords
) {

    public static SurveyGeometry assumed(int positionRecords) {
        return new SurveyGeometry(
                DirectionVector.EAST,
                DirectionVector.NORTH,
                90.0,
                0.0,
                0.0,
                CoordinateSystem.ASSUMED,
                false,
                positionRecords
        );
    }
}
