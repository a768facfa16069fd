package org.seiscube.seismic.dto;

import org.seiscube.seismic.volume.AmplitudeStats;

/**
 * 切片振幅统计（对外载荷只带 min/max/mean/std）。
 */
public record SliceAmplitudeStats(double min, double max, double mean, double std) {

    public static SliceAmplitudeStats of(AmplitudeStats stats) {
        return new SliceAmplitudeStats(stats.actualMin(), stats.actualMax(), stats.mean(), stats.std());
    }
}
