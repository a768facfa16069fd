package org.seiscube.seismic;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

/**
 * 测试用：解压缓存/返回结果中的 gzip 字节。
 */
public final class GzipBytes {

    private GzipBytes() {
    }

    public static byte[] gunzip(byte[] bytes) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return in.readAllBytes();
        }
    }
}
