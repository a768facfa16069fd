package org.seiscube.seismic.volume;

import java.util.Arrays;

/**
 * 振幅统计计算。
 * <p>
 * 分位数采用线性插值（rank = p/100 * (n-1)），与常见科学计算库的默认行为一致。
 * 输入应已清洗（非有限值已置 0）；这里仍会把非有限值按 0 处理。
 * <p>
 * 注意：数据体中未记录道的网格单元是 0 填充的，统计时会被当作振幅 0 参与计算。
 */
public final class AmplitudeStatistics {

    private AmplitudeStatistics() {
    }

    public static AmplitudeStats of(float[] values) {
        if (values == null || values.length == 0) {
            return AmplitudeStats.EMPTY;
        }
        float[] sorted = new float[values.length];
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            float v = sanitize(values[i]);
            sorted[i] = v;
            sum += v;
        }
        double mean = sum / values.length;
        double squares = 0;
        for (float v : sorted) {
            double d = v - mean;
            squares += d * d;
        }
        double std = Math.sqrt(squares / values.length);

        Arrays.sort(sorted);
        return new AmplitudeStats(
                sorted[0],
                sorted[sorted.length - 1],
                mean,
                std,
                percentile(sorted, 1),
                percentile(sorted, 5),
                percentile(sorted, 95),
                percentile(sorted, 99)
        );
    }

    public static AmplitudeStats of(float[][] values) {
        if (values == null || values.length == 0) {
            return AmplitudeStats.EMPTY;
        }
        int cols = values[0].length;
        float[] flat = new float[values.length * cols];
        for (int r = 0; r < values.length; r++) {
            System.arraycopy(values[r], 0, flat, r * cols, cols);
        }
        return of(flat);
    }

    /**
     * @param sorted 升序数组（非空）
     * @param p      百分位（0-100）
     */
    static double percentile(float[] sorted, double p) {
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - (double) sorted[lower]) * fraction;
    }

    static float sanitize(float value) {
        return Float.isFinite(value) ? value : 0.0f;
    }
}
