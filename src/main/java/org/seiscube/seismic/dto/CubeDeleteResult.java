package org.seiscube.seismic.dto;

/**
 * {@code seismic_delete_cube} 的返回结果。
 *
 * @param cubeId              数据体 ID
 * @param deletedObjectsCount 删除的持久化对象数量
 * @param evictedCacheEntries 清除的内存缓存条目数量
 */
public record CubeDeleteResult(
        String cubeId,
        int deletedObjectsCount,
        int evictedCacheEntries
) {
}
