package org.seiscube.seismic.dto;

/**
 * {@code seismic_get_slice} 的返回结果。
 *
 * @param cubeId            数据体 ID
 * @param axis              切片方向
 * @param index             下标
 * @param source            数据来源：memory（内存缓存）/store（持久化副本）/computed（现算）
 * @param rows              行数
 * @param columns           列数
 * @param data              二维振幅；{@code encoding=gzip+base64} 时为 null
 * @param coordinates       坐标
 * @param amplitudeStats    切片振幅统计
 * @param encoding          json 或 gzip+base64
 * @param compressedPayload gzip 压缩后 Base64 编码的完整 JSON 载荷（仅 gzip+base64 时有值）
 */
public record SliceResult(
        String cubeId,
        String axis,
        int index,
        String source,
        int rows,
        int columns,
        float[][] data,
        SliceCoordinates coordinates,
        SliceAmplitudeStats amplitudeStats,
        String encoding,
        String compressedPayload
) {
}
