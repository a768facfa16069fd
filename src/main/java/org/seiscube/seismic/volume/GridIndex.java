package org.seiscube.seismic.volume;

import java.util.Arrays;
import java.util.Collection;

/**
 * inline/crossline 原始值到稠密下标（从 0 开始、按值升序连续编号）的双向映射。
 */
public final class GridIndex {

    private final int[] inlineValues;
    private final int[] crosslineValues;

    private GridIndex(int[] inlineValues, int[] crosslineValues) {
        this.inlineValues = inlineValues;
        this.crosslineValues = crosslineValues;
    }

    public static GridIndex of(Collection<Integer> inlines, Collection<Integer> crosslines) {
        return new GridIndex(sortedDistinct(inlines), sortedDistinct(crosslines));
    }

    public int inlineCount() {
        return inlineValues.length;
    }

    public int crosslineCount() {
        return crosslineValues.length;
    }

    /**
     * @return 稠密行号；值不存在时返回 -1
     */
    public int rowOf(int inline) {
        int idx = Arrays.binarySearch(inlineValues, inline);
        return idx >= 0 ? idx : -1;
    }

    /**
     * @return 稠密列号；值不存在时返回 -1
     */
    public int columnOf(int crossline) {
        int idx = Arrays.binarySearch(crosslineValues, crossline);
        return idx >= 0 ? idx : -1;
    }

    public int inlineAt(int row) {
        return inlineValues[row];
    }

    public int crosslineAt(int column) {
        return crosslineValues[column];
    }

    public int[] inlineValues() {
        return inlineValues.clone();
    }

    public int[] crosslineValues() {
        return crosslineValues.clone();
    }

    private static int[] sortedDistinct(Collection<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).distinct().sorted().toArray();
    }
}
