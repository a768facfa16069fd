package org.seiscube.seismic.volume;

/**
 * 稠密三维振幅数据体，形状 (inline, crossline, sample)，32 位浮点。
 * <p>
 * 构建完成后不可变：内部数组不对外暴露，坐标轴通过副本返回。
 */
public final class SeismicCube {

    private final float[] data;
    private final int[] inlineValues;
    private final int[] crosslineValues;
    private final double[] samplePositions;
    private final AmplitudeStats stats;

    SeismicCube(float[] data, int[] inlineValues, int[] crosslineValues, double[] samplePositions, AmplitudeStats stats) {
        long expected = (long) inlineValues.length * crosslineValues.length * samplePositions.length;
        if (data.length != expected) {
            throw new IllegalArgumentException("数据长度与形状不一致：" + data.length + " != " + expected);
        }
        this.data = data;
        this.inlineValues = inlineValues;
        this.crosslineValues = crosslineValues;
        this.samplePositions = samplePositions;
        this.stats = stats;
    }

    public int inlineCount() {
        return inlineValues.length;
    }

    public int crosslineCount() {
        return crosslineValues.length;
    }

    public int sampleCount() {
        return samplePositions.length;
    }

    public int[] shape() {
        return new int[]{inlineCount(), crosslineCount(), sampleCount()};
    }

    public float amplitude(int row, int column, int sample) {
        return data[offset(row, column, sample)];
    }

    public int[] inlineValues() {
        return inlineValues.clone();
    }

    public int[] crosslineValues() {
        return crosslineValues.clone();
    }

    public double[] samplePositions() {
        return samplePositions.clone();
    }

    public AmplitudeStats stats() {
        return stats;
    }

    public long sizeInBytes() {
        return (long) data.length * Float.BYTES;
    }

    int offset(int row, int column, int sample) {
        return (row * crosslineValues.length + column) * samplePositions.length + sample;
    }

    float[] data() {
        return data;
    }

    int inlineAt(int row) {
        return inlineValues[row];
    }

    int crosslineAt(int column) {
        return crosslineValues[column];
    }

    double sampleAt(int sample) {
        return samplePositions[sample];
    }
}
