package org.seiscube.seismic;

import org.seiscube.seismic.dto.SlicePayload;

/**
 * 缓存中的切片：逻辑载荷 + 预先序列化好的 JSON 字节 + gzip 字节，命中时无需再次编码。
 */
public record CachedSlice(SlicePayload payload, byte[] jsonBytes, byte[] gzipBytes) {

    public static CachedSlice of(SlicePayload payload) {
        byte[] json = SeismicJson.toBytes(payload);
        return new CachedSlice(payload, json, SeismicJson.gzip(json));
    }
}
