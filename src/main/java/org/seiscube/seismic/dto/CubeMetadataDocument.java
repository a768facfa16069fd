package org.seiscube.seismic.dto;

import java.time.Instant;

/**
 * 持久化到 {@code cubes/{cubeId}/metadata.json} 的元数据文档。
 */
public record CubeMetadataDocument(
        String filename,
        String cubeId,
        CubeInfo cubeInfo,
        Instant createdAt,
        Instant updatedAt
) {
}
