package org.seiscube.seismic.volume;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 二维 float32 数组与 NumPy {@code .npy}（格式版本 1.0）之间的转换。
 * <p>
 * 只支持本服务写出的形式：{@code '<f4'}、C 顺序、二维 shape。
 */
public final class NpyArrays {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final int PREAMBLE_BYTES = MAGIC.length + 2 + 2;
    private static final int ALIGNMENT = 64;
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,?\\s*\\)");

    private NpyArrays() {
    }

    public static byte[] writeFloat32(float[][] data) {
        int rows = data.length;
        int cols = rows == 0 ? 0 : data[0].length;
        String dict = "{'descr': '<f4', 'fortran_order': False, 'shape': (" + rows + ", " + cols + "), }";
        // 头部（含结尾换行）补空格，使数据起始位置按 64 字节对齐
        int unpadded = PREAMBLE_BYTES + dict.length() + 1;
        int padding = (ALIGNMENT - unpadded % ALIGNMENT) % ALIGNMENT;
        String header = dict + " ".repeat(padding) + "\n";
        byte[] headerBytes = header.getBytes(StandardCharsets.ISO_8859_1);

        ByteBuffer buffer = ByteBuffer.allocate(PREAMBLE_BYTES + headerBytes.length + rows * cols * Float.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(MAGIC);
        buffer.put((byte) 1);
        buffer.put((byte) 0);
        buffer.putShort((short) headerBytes.length);
        buffer.put(headerBytes);
        for (float[] row : data) {
            for (int c = 0; c < cols; c++) {
                buffer.putFloat(row[c]);
            }
        }
        return buffer.array();
    }

    public static float[][] readFloat32(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length < PREAMBLE_BYTES) {
            throw new IOException("不是有效的 .npy 数据：长度不足");
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (bytes[i] != MAGIC[i]) {
                throw new IOException("不是有效的 .npy 数据：magic 不匹配");
            }
        }
        if (bytes[6] != 1) {
            throw new IOException("不支持的 .npy 版本：" + bytes[6]);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int headerLength = Short.toUnsignedInt(buffer.getShort(8));
        if (PREAMBLE_BYTES + headerLength > bytes.length) {
            throw new IOException("不是有效的 .npy 数据：头部长度越界");
        }
        String header = new String(bytes, PREAMBLE_BYTES, headerLength, StandardCharsets.ISO_8859_1);
        if (!header.contains("'<f4'")) {
            throw new IOException("只支持 little-endian float32（'<f4'）：" + header.trim());
        }
        if (header.contains("'fortran_order': True")) {
            throw new IOException("不支持 Fortran 顺序的数组");
        }
        Matcher matcher = SHAPE.matcher(header);
        if (!matcher.find()) {
            throw new IOException("只支持二维数组：" + header.trim());
        }
        int rows = Integer.parseInt(matcher.group(1));
        int cols = Integer.parseInt(matcher.group(2));
        int dataStart = PREAMBLE_BYTES + headerLength;
        long expected = (long) rows * cols * Float.BYTES;
        if (bytes.length - dataStart < expected) {
            throw new IOException("数据长度不足：需要 " + expected + " 字节，实际 " + (bytes.length - dataStart));
        }
        buffer.position(dataStart);
        float[][] out = new float[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                out[r][c] = buffer.getFloat();
            }
        }
        return out;
    }
}
