package org.seiscube.seismic.volume;

/**
 * 从数据体中截取的二维剖面。
 * <p>
 * {@code data[row][col]}：inline/crossline 切片的行是采样轴、列是水平轴；sample 切片的行是 inline、列是 crossline。
 * {@code x} 对应列方向坐标，{@code y} 对应行方向坐标。
 *
 * @param axis  切片方向
 * @param index 在该方向上的下标
 * @param data  二维振幅（均为有限值）
 * @param x     列坐标
 * @param y     行坐标
 * @param stats 该切片自身的振幅统计
 */
public record SeismicSlice(
        SliceAxis axis,
        int index,
        float[][] data,
        Number[] x,
        Number[] y,
        AmplitudeStats stats
) {

    public int rows() {
        return data.length;
    }

    public int columns() {
        return data.length == 0 ? 0 : data[0].length;
    }
}
