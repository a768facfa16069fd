package org.seiscube.seismic.volume;

import org.seiscube.seismic.ErrorKind;
import org.seiscube.seismic.SeismicException;

/**
 * 按方向与下标从数据体截取二维切片。
 * <ul>
 *   <li>inline：固定第一维，结果形状 (sample, crossline)；x = crossline 值，y = 采样坐标。</li>
 *   <li>crossline：固定第二维，结果形状 (sample, inline)；x = inline 值，y = 采样坐标。</li>
 *   <li>sample：固定第三维，结果形状 (inline, crossline)，不转置；x = inline 值，y = crossline 值。</li>
 * </ul>
 * 越界下标直接报错（{@link ErrorKind#OUT_OF_RANGE_INDEX}），不会被截断到边界。
 */
public class SliceExtractor {

    public SeismicSlice extract(SeismicCube cube, SliceAxis axis, int index) {
        int length = axis.length(cube);
        if (index < 0 || index >= length) {
            throw new SeismicException(ErrorKind.OUT_OF_RANGE_INDEX,
                    "下标 " + index + " 超出 " + axis.label() + " 方向范围（最大 " + (length - 1) + "）");
        }
        float[][] data;
        Number[] x;
        Number[] y;
        switch (axis) {
            case INLINE -> {
                data = new float[cube.sampleCount()][cube.crosslineCount()];
                for (int c = 0; c < cube.crosslineCount(); c++) {
                    for (int s = 0; s < cube.sampleCount(); s++) {
                        data[s][c] = AmplitudeStatistics.sanitize(cube.amplitude(index, c, s));
                    }
                }
                x = crosslineAxis(cube);
                y = sampleAxis(cube);
            }
            case CROSSLINE -> {
                data = new float[cube.sampleCount()][cube.inlineCount()];
                for (int i = 0; i < cube.inlineCount(); i++) {
                    for (int s = 0; s < cube.sampleCount(); s++) {
                        data[s][i] = AmplitudeStatistics.sanitize(cube.amplitude(i, index, s));
                    }
                }
                x = inlineAxis(cube);
                y = sampleAxis(cube);
            }
            case SAMPLE -> {
                data = new float[cube.inlineCount()][cube.crosslineCount()];
                for (int i = 0; i < cube.inlineCount(); i++) {
                    for (int c = 0; c < cube.crosslineCount(); c++) {
                        data[i][c] = AmplitudeStatistics.sanitize(cube.amplitude(i, c, index));
                    }
                }
                x = inlineAxis(cube);
                y = crosslineAxis(cube);
            }
            default -> throw new IllegalStateException("未知的切片方向：" + axis);
        }
        return new SeismicSlice(axis, index, data, x, y, AmplitudeStatistics.of(data));
    }

    /**
     * 用已保存的二维振幅（例如 .npy 副本）重建切片：坐标取自数据体，统计量重新计算。
     *
     * @throws IllegalArgumentException 数组形状与该方向的切片形状不一致
     */
    public SeismicSlice restore(SeismicCube cube, SliceAxis axis, int index, float[][] stored) {
        int rows = axis == SliceAxis.SAMPLE ? cube.inlineCount() : cube.sampleCount();
        int columns = axis == SliceAxis.INLINE || axis == SliceAxis.SAMPLE ? cube.crosslineCount() : cube.inlineCount();
        if (stored.length != rows) {
            throw new IllegalArgumentException("切片行数不匹配：" + stored.length + "，期望 " + rows);
        }
        float[][] data = new float[rows][columns];
        for (int r = 0; r < rows; r++) {
            if (stored[r].length != columns) {
                throw new IllegalArgumentException("切片第 " + r + " 行长度不匹配：" + stored[r].length);
            }
            for (int c = 0; c < columns; c++) {
                data[r][c] = AmplitudeStatistics.sanitize(stored[r][c]);
            }
        }
        Number[] x = axis == SliceAxis.INLINE ? crosslineAxis(cube) : inlineAxis(cube);
        Number[] y = axis == SliceAxis.SAMPLE ? crosslineAxis(cube) : sampleAxis(cube);
        return new SeismicSlice(axis, index, data, x, y, AmplitudeStatistics.of(data));
    }

    private static Number[] inlineAxis(SeismicCube cube) {
        Number[] out = new Number[cube.inlineCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = cube.inlineAt(i);
        }
        return out;
    }

    private static Number[] crosslineAxis(SeismicCube cube) {
        Number[] out = new Number[cube.crosslineCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = cube.crosslineAt(i);
        }
        return out;
    }

    private static Number[] sampleAxis(SeismicCube cube) {
        Number[] out = new Number[cube.sampleCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = cube.sampleAt(i);
        }
        return out;
    }
}
