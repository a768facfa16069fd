package org.seiscube.seismic.segy;

import java.io.IOException;

/**
 * SEG-Y 文件结构无法解析（文件头损坏、格式码不支持等）。
 */
public class SegyFormatException extends IOException {

    public SegyFormatException(String message) {
        super(message);
    }
}
