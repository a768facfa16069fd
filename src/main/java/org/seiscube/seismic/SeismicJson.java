package org.seiscube.seismic;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.seiscube.seismic.dto.CubeMetadataDocument;
import org.seiscube.seismic.dto.SlicePayload;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPOutputStream;

/**
 * 持久化/缓存载荷的 JSON 与 gzip 编解码。
 * <p>
 * 字段统一使用 snake_case（例如 {@code amplitude_stats}、{@code cube_id}），时间以 ISO-8601 字符串输出。
 */
public final class SeismicJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private SeismicJson() {
    }

    public static byte[] toBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new UncheckedIOException("JSON 序列化失败：" + value.getClass().getSimpleName(), e);
        }
    }

    public static SlicePayload readSlicePayload(byte[] bytes) throws IOException {
        SlicePayload payload = MAPPER.readValue(bytes, SlicePayload.class);
        if (payload == null || payload.data() == null) {
            throw new IOException("切片载荷缺少 data 字段");
        }
        return payload;
    }

    public static CubeMetadataDocument readMetadata(byte[] bytes) throws IOException {
        CubeMetadataDocument document = MAPPER.readValue(bytes, CubeMetadataDocument.class);
        if (document == null || document.cubeId() == null) {
            throw new IOException("元数据缺少 cube_id 字段");
        }
        return document;
    }

    public static byte[] gzip(byte[] bytes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, bytes.length / 4));
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("gzip 压缩失败", e);
        }
        return out.toByteArray();
    }
}
