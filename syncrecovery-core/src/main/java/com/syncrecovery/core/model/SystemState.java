package com.syncrecovery.core.model;

import java.time.Instant;

/**
 * Point-in-time snapshot of host resources.
 *
 * @param diskSpace free disk space in bytes
 * @param memoryUsage used memory ratio in [0, 1]
 * @param cpuUsage CPU load ratio in [0, 1]
 */
public record SystemState(
    NetworkStatus networkStatus,
    long diskSpace,
    double memoryUsage,
    double cpuUsage,
    int activeConnections,
    int queueSize,
    Instant lastHealthCheck
) {
    public static final long GIGABYTE = 1024L * 1024 * 1024;

    /**
     * Healthy enough to attempt an automated retry.
     */
    public boolean isHealthy() {
        return networkStatus == NetworkStatus.ONLINE
            && memoryUsage < 0.9
            && cpuUsage < 0.9
            && diskSpace > GIGABYTE;
    }

    public SystemState withQueueSize(int newQueueSize) {
        return new SystemState(networkStatus, diskSpace, memoryUsage, cpuUsage,
            activeConnections, newQueueSize, lastHealthCheck);
    }
}
