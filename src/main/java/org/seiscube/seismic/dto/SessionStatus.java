package org.seiscube.seismic.dto;

/**
 * {@code seismic_status} 的返回结果。
 */
public record SessionStatus(
        boolean cubeLoaded,
        String cubeId,
        String filename,
        String storeKind,
        boolean storeAvailable,
        int cacheSize,
        int cacheCapacity,
        int pendingTasks,
        long completedTasks,
        long failedTasks,
        long droppedTasks
) {
}
