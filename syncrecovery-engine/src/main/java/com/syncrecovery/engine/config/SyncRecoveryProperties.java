package com.syncrecovery.engine.config;

import com.syncrecovery.core.model.EventSeverity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for the change log, replay engine and recovery manager.
 *
 * <p>Example YAML:
 * <pre>{@code
 * syncrecovery:
 *   store:
 *     type: jdbc
 *   recovery:
 *     max-retries: 3
 *     failure-threshold: 3
 *     backup-interval: 24h
 *   retention:
 *     max-total-events: 10000
 *     severity-days:
 *       DEBUG: 7
 *       CRITICAL: 365
 *   replay:
 *     checkpoint-interval: 100
 * }</pre>
 */
@ConfigurationProperties(prefix = "syncrecovery")
public class SyncRecoveryProperties {

    private final Store store = new Store();
    private final Recovery recovery = new Recovery();
    private final Retention retention = new Retention();
    private final Replay replay = new Replay();
    private final Health health = new Health();

    public Store getStore() { return store; }
    public Recovery getRecovery() { return recovery; }
    public Retention getRetention() { return retention; }
    public Replay getReplay() { return replay; }
    public Health getHealth() { return health; }

    public static class Store {
        /**
         * memory or jdbc.
         */
        private String type = "memory";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    public static class Recovery {
        private int maxRetries = 3;
        private Duration initialRetryDelay = Duration.ofSeconds(1);
        private Duration maxRetryDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private boolean autoBackup = true;
        private int backupRetentionDays = 30;
        private Duration backupInterval = Duration.ofHours(24);
        private Duration healthCheckInterval = Duration.ofMinutes(5);
        private Duration cleanupInterval = Duration.ofHours(1);
        private int failureThreshold = 3;
        private int alertThreshold = 5;
        private boolean enableAutoRecovery = true;
        private Duration rollbackPointTtl = Duration.ofHours(24);
        private int eventBusCapacity = 1024;
        private int eventHistorySize = 1000;
        private int workerThreads = 4;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getInitialRetryDelay() { return initialRetryDelay; }
        public void setInitialRetryDelay(Duration initialRetryDelay) { this.initialRetryDelay = initialRetryDelay; }
        public Duration getMaxRetryDelay() { return maxRetryDelay; }
        public void setMaxRetryDelay(Duration maxRetryDelay) { this.maxRetryDelay = maxRetryDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public boolean isAutoBackup() { return autoBackup; }
        public void setAutoBackup(boolean autoBackup) { this.autoBackup = autoBackup; }
        public int getBackupRetentionDays() { return backupRetentionDays; }
        public void setBackupRetentionDays(int backupRetentionDays) { this.backupRetentionDays = backupRetentionDays; }
        public Duration getBackupInterval() { return backupInterval; }
        public void setBackupInterval(Duration backupInterval) { this.backupInterval = backupInterval; }
        public Duration getHealthCheckInterval() { return healthCheckInterval; }
        public void setHealthCheckInterval(Duration healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }
        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public int getAlertThreshold() { return alertThreshold; }
        public void setAlertThreshold(int alertThreshold) { this.alertThreshold = alertThreshold; }
        public boolean isEnableAutoRecovery() { return enableAutoRecovery; }
        public void setEnableAutoRecovery(boolean enableAutoRecovery) { this.enableAutoRecovery = enableAutoRecovery; }
        public Duration getRollbackPointTtl() { return rollbackPointTtl; }
        public void setRollbackPointTtl(Duration rollbackPointTtl) { this.rollbackPointTtl = rollbackPointTtl; }
        public int getEventBusCapacity() { return eventBusCapacity; }
        public void setEventBusCapacity(int eventBusCapacity) { this.eventBusCapacity = eventBusCapacity; }
        public int getEventHistorySize() { return eventHistorySize; }
        public void setEventHistorySize(int eventHistorySize) { this.eventHistorySize = eventHistorySize; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    public static class Retention {
        private int defaultRetentionDays = 30;
        private int maxTotalEvents = 10_000;
        private Duration cleanupInterval = Duration.ofHours(24);
        private Map<EventSeverity, Integer> severityDays = defaultSeverityDays();

        private static Map<EventSeverity, Integer> defaultSeverityDays() {
            Map<EventSeverity, Integer> days = new EnumMap<>(EventSeverity.class);
            days.put(EventSeverity.DEBUG, 7);
            days.put(EventSeverity.INFO, 30);
            days.put(EventSeverity.WARNING, 90);
            days.put(EventSeverity.ERROR, 180);
            days.put(EventSeverity.CRITICAL, 365);
            return days;
        }

        public int getDefaultRetentionDays() { return defaultRetentionDays; }
        public void setDefaultRetentionDays(int defaultRetentionDays) { this.defaultRetentionDays = defaultRetentionDays; }
        public int getMaxTotalEvents() { return maxTotalEvents; }
        public void setMaxTotalEvents(int maxTotalEvents) { this.maxTotalEvents = maxTotalEvents; }
        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
        public Map<EventSeverity, Integer> getSeverityDays() { return severityDays; }
        public void setSeverityDays(Map<EventSeverity, Integer> severityDays) { this.severityDays = severityDays; }
    }

    public static class Replay {
        private int checkpointInterval = 100;
        private int maxSafeConcurrency = 10;
        private int workerThreads = 4;

        public int getCheckpointInterval() { return checkpointInterval; }
        public void setCheckpointInterval(int checkpointInterval) { this.checkpointInterval = checkpointInterval; }
        public int getMaxSafeConcurrency() { return maxSafeConcurrency; }
        public void setMaxSafeConcurrency(int maxSafeConcurrency) { this.maxSafeConcurrency = maxSafeConcurrency; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    public static class Health {
        private String networkProbeHost;
        private int networkProbePort = 443;
        private Duration networkProbeTimeout = Duration.ofSeconds(5);
        private String diskPath = ".";
        private long minFreeDiskBytes = 1024L * 1024 * 1024;

        public String getNetworkProbeHost() { return networkProbeHost; }
        public void setNetworkProbeHost(String networkProbeHost) { this.networkProbeHost = networkProbeHost; }
        public int getNetworkProbePort() { return networkProbePort; }
        public void setNetworkProbePort(int networkProbePort) { this.networkProbePort = networkProbePort; }
        public Duration getNetworkProbeTimeout() { return networkProbeTimeout; }
        public void setNetworkProbeTimeout(Duration networkProbeTimeout) { this.networkProbeTimeout = networkProbeTimeout; }
        public String getDiskPath() { return diskPath; }
        public void setDiskPath(String diskPath) { this.diskPath = diskPath; }
        public long getMinFreeDiskBytes() { return minFreeDiskBytes; }
        public void setMinFreeDiskBytes(long minFreeDiskBytes) { this.minFreeDiskBytes = minFreeDiskBytes; }
    }
}
