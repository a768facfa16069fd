package org.seiscube.seismic.volume;

/**
 * 单条道（trace）的位置头信息。
 * <p>
 * 道没有显式 ID，其身份就是它在数据流中的顺序。坐标字段可能缺失（{@code null}）。
 *
 * @param inline    主测线号（inline）；0 表示缺失
 * @param crossline 联络测线号（crossline）；0 表示缺失
 * @param positionX 地理 X 坐标（CDP X 或 Source X），缺失为 null
 * @param positionY 地理 Y 坐标（CDP Y 或 Source Y），缺失为 null
 */
public record TraceHeader(
        int inline,
        int crossline,
        Double positionX,
        Double positionY
) {

    public static TraceHeader withoutPosition(int inline, int crossline) {
        return new TraceHeader(inline, crossline, null, null);
    }

    /**
     * inline/crossline 是否都有效（非 0）。
     */
    public boolean hasGridPosition() {
        return inline != 0 && crossline != 0;
    }

    /**
     * 坐标是否都存在且非 0。
     */
    public boolean hasPosition() {
        return positionX != null && positionY != null
                && positionX != 0.0 && positionY != 0.0
                && Double.isFinite(positionX) && Double.isFinite(positionY);
    }
}
