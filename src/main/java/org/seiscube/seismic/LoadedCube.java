package org.seiscube.seismic;

import org.seiscube.seismic.dto.CubeInfo;
import org.seiscube.seismic.volume.SeismicCube;
import org.seiscube.seismic.volume.SurveyGeometry;

import java.time.Instant;

/**
 * 会话当前发布的数据体句柄（不可变，整体原子替换）。
 *
 * @param cubeId    数据体 ID
 * @param filename  文件名
 * @param cube      稠密数据体
 * @param geometry  测网方向
 * @param cubeInfo  概要信息
 * @param createdAt 加载时间
 */
public record LoadedCube(
        String cubeId,
        String filename,
        SeismicCube cube,
        SurveyGeometry geometry,
        CubeInfo cubeInfo,
        Instant createdAt
) {
}
