package org.seiscube.seismic.segy;

import java.nio.ByteBuffer;

/**
 * SEG-Y 二进制头中的数据采样格式码（bytes 3225-3226）。
 */
public enum SegySampleFormat {

    IBM_FLOAT32(1, 4),
    INT32(2, 4),
    INT16(3, 2),
    IEEE_FLOAT32(5, 4),
    INT8(8, 1);

    private final int code;
    private final int bytesPerSample;

    SegySampleFormat(int code, int bytesPerSample) {
        this.code = code;
        this.bytesPerSample = bytesPerSample;
    }

    public int code() {
        return code;
    }

    public int bytesPerSample() {
        return bytesPerSample;
    }

    /**
     * @return 对应格式；不支持的格式码返回 null
     */
    public static SegySampleFormat fromCode(int code) {
        for (SegySampleFormat format : values()) {
            if (format.code == code) {
                return format;
            }
        }
        return null;
    }

    /**
     * 从 buffer 当前位置读取一个采样值（大端序）。
     */
    float read(ByteBuffer buffer) {
        return switch (this) {
            case IBM_FLOAT32 -> ibmToFloat(buffer.getInt());
            case INT32 -> buffer.getInt();
            case INT16 -> buffer.getShort();
            case IEEE_FLOAT32 -> buffer.getFloat();
            case INT8 -> buffer.get();
        };
    }

    /**
     * IBM System/360 单精度浮点转 IEEE：符号 1 位、16 进制指数 7 位（偏移 64）、尾数 24 位。
     */
    static float ibmToFloat(int bits) {
        int fraction = bits & 0x00ffffff;
        if (fraction == 0) {
            return 0.0f;
        }
        int exponent = (bits >>> 24) & 0x7f;
        double value = fraction / (double) 0x01000000 * Math.pow(16.0, exponent - 64);
        return (float) ((bits < 0) ? -value : value);
    }
}
