package org.seiscube.seismic.volume;

import org.seiscube.seismic.ErrorKind;
import org.seiscube.seismic.SeismicException;

import java.util.Locale;

/**
 * 切片方向。
 */
public enum SliceAxis {

    INLINE("inline"),
    CROSSLINE("crossline"),
    SAMPLE("sample");

    private final String label;

    SliceAxis(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * 该方向上的合法下标个数。
     */
    public int length(SeismicCube cube) {
        return switch (this) {
            case INLINE -> cube.inlineCount();
            case CROSSLINE -> cube.crosslineCount();
            case SAMPLE -> cube.sampleCount();
        };
    }

    /**
     * 解析调用方传入的方向名（大小写不敏感；{@code xline} 视为 {@code crossline}）。
     */
    public static SliceAxis parse(String value) {
        if (value == null || value.isBlank()) {
            throw new SeismicException(ErrorKind.INVALID_REQUEST, "切片方向不能为空（inline/crossline/sample）");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "inline", "iline" -> INLINE;
            case "crossline", "xline" -> CROSSLINE;
            case "sample", "time", "depth" -> SAMPLE;
            default -> throw new SeismicException(ErrorKind.INVALID_REQUEST,
                    "不支持的切片方向：" + value + "（请使用 inline/crossline/sample）");
        };
    }
}
