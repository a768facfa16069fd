package org.seiscube.seismic.volume;

/**
 * 解析后的 (inline, crossline) 网格位置。
 *
 * @param inline    inline 值
 * @param crossline crossline 值
 * @param synthetic 是否来自合成回退（非真实头信息）
 */
public record GridPosition(int inline, int crossline, boolean synthetic) {

    long packed() {
        return ((long) inline << 32) | (crossline & 0xffffffffL);
    }
}
