package com.syncrecovery.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncrecovery.core.repository.ChangeEventRepository;
import com.syncrecovery.core.repository.ReplaySessionRepository;
import com.syncrecovery.core.repository.RollbackPointRepository;
import com.syncrecovery.core.spi.BackupManager;
import com.syncrecovery.core.spi.SystemStateProvider;
import com.syncrecovery.engine.backup.BackupSnapshotSource;
import com.syncrecovery.engine.backup.InMemoryBackupManager;
import com.syncrecovery.engine.changelog.ChangeEventStore;
import com.syncrecovery.engine.changelog.ChangeLogger;
import com.syncrecovery.engine.changelog.RetentionPolicy;
import com.syncrecovery.engine.changelog.RetentionScheduler;
import com.syncrecovery.engine.classification.FailureClassifier;
import com.syncrecovery.engine.concurrent.Sleeper;
import com.syncrecovery.engine.metrics.SyncRecoveryMetrics;
import com.syncrecovery.engine.replay.ReplayEngine;
import com.syncrecovery.engine.rollback.RollbackPointService;
import com.syncrecovery.engine.system.JvmSystemStateProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the change log, classifier, backups, rollback points and replay engine.
 * Host applications override the backup and system-state collaborators by
 * declaring their own beans.
 */
@Configuration
@EnableConfigurationProperties(SyncRecoveryProperties.class)
public class SyncRecoveryEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    // ========== Change Log ==========

    @Bean
    public ChangeEventStore changeEventStore(ChangeEventRepository repository, ObjectMapper objectMapper,
                                             Clock clock, SyncRecoveryMetrics metrics,
                                             SyncRecoveryProperties properties) {
        return new ChangeEventStore(repository, objectMapper, clock, metrics,
            RetentionPolicy.from(properties.getRetention()));
    }

    @Bean
    public ChangeLogger changeLogger(ChangeEventStore store, ObjectMapper objectMapper, Clock clock) {
        return new ChangeLogger(store, objectMapper, clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RetentionScheduler retentionScheduler(ChangeEventStore store, SyncRecoveryProperties properties) {
        return new RetentionScheduler(store, properties.getRetention().getCleanupInterval());
    }

    // ========== Classification & Backups ==========

    @Bean
    public FailureClassifier failureClassifier(SyncRecoveryProperties properties) {
        return new FailureClassifier(properties.getRecovery().getFailureThreshold());
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupSnapshotSource backupSnapshotSource() {
        return BackupSnapshotSource.noop();
    }

    @Bean
    @ConditionalOnMissingBean(BackupManager.class)
    public InMemoryBackupManager backupManager(BackupSnapshotSource snapshotSource, Clock clock,
                                               SyncRecoveryProperties properties) {
        return new InMemoryBackupManager(snapshotSource, clock, properties.getRecovery().getBackupRetentionDays());
    }

    @Bean
    public RollbackPointService rollbackPointService(RollbackPointRepository repository, BackupManager backupManager,
                                                     Clock clock, SyncRecoveryProperties properties) {
        return new RollbackPointService(repository, backupManager, clock,
            properties.getRecovery().getRollbackPointTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public SystemStateProvider systemStateProvider(Clock clock, SyncRecoveryProperties properties) {
        SyncRecoveryProperties.Health health = properties.getHealth();
        return new JvmSystemStateProvider(clock, health.getDiskPath(), health.getNetworkProbeHost(),
            health.getNetworkProbePort(), health.getNetworkProbeTimeout());
    }

    // ========== Replay ==========

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public ReplayEngine replayEngine(ChangeEventStore store, ReplaySessionRepository sessionRepository,
                                     RollbackPointService rollbackPoints, SyncRecoveryMetrics metrics,
                                     Clock clock, Sleeper sleeper, SyncRecoveryProperties properties) {
        SyncRecoveryProperties.Replay replay = properties.getReplay();
        return new ReplayEngine(store, sessionRepository, rollbackPoints, metrics, clock, sleeper,
            replay.getWorkerThreads(), replay.getMaxSafeConcurrency());
    }
}
