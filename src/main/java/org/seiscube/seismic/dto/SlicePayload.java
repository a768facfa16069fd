package org.seiscube.seismic.dto;

import org.seiscube.seismic.volume.SeismicSlice;

import java.util.Arrays;

/**
 * 切片 JSON 载荷：{@code { data, coordinates: {x, y}, amplitude_stats: {min, max, mean, std} }}。
 * <p>
 * 内存缓存与持久化副本使用同一结构。
 */
public record SlicePayload(
        float[][] data,
        SliceCoordinates coordinates,
        SliceAmplitudeStats amplitudeStats
) {

    public static SlicePayload of(SeismicSlice slice) {
        return new SlicePayload(
                slice.data(),
                new SliceCoordinates(Arrays.asList(slice.x()), Arrays.asList(slice.y())),
                SliceAmplitudeStats.of(slice.stats())
        );
    }

    /**
     * 逐行复制 data；缓存中的数组不对外暴露。
     */
    public float[][] copyOfData() {
        if (data == null) {
            return null;
        }
        float[][] copy = new float[data.length][];
        for (int r = 0; r < data.length; r++) {
            copy[r] = data[r].clone();
        }
        return copy;
    }

    public int rows() {
        return data == null ? 0 : data.length;
    }

    public int columns() {
        return data == null || data.length == 0 ? 0 : data[0].length;
    }
}
