package org.seiscube.seismic.dto;

import java.util.List;

/**
 * {@code seismic_list_cubes} 的返回结果（按创建时间倒序）。
 */
public record CubeListResult(
        List<CubeSummary> cubes,
        int count,
        boolean storeAvailable,
        List<String> warnings
) {
}
