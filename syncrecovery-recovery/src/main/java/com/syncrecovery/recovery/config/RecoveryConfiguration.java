package com.syncrecovery.recovery.config;

import com.syncrecovery.core.model.BackoffPolicy;
import com.syncrecovery.core.spi.BackupManager;
import com.syncrecovery.core.spi.SystemStateProvider;
import com.syncrecovery.engine.changelog.ChangeLogger;
import com.syncrecovery.engine.classification.FailureClassifier;
import com.syncrecovery.engine.concurrent.Sleeper;
import com.syncrecovery.engine.config.SyncRecoveryProperties;
import com.syncrecovery.engine.metrics.SyncRecoveryMetrics;
import com.syncrecovery.engine.rollback.RollbackPointService;
import com.syncrecovery.recovery.events.RecoveryEventBus;
import com.syncrecovery.recovery.events.RecoveryObserver;
import com.syncrecovery.recovery.manager.RecoveryManager;
import com.syncrecovery.recovery.manager.RecoverySettings;
import com.syncrecovery.recovery.spi.ConflictResolver;
import com.syncrecovery.recovery.spi.CredentialProvider;
import com.syncrecovery.recovery.spi.ResourceReclaimer;
import com.syncrecovery.recovery.spi.SyncOperationExecutor;
import com.syncrecovery.recovery.strategy.RecoveryCollaborators;
import com.syncrecovery.recovery.strategy.RecoveryStrategy;
import com.syncrecovery.recovery.strategy.RecoveryStrategyFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the strategy set, event bus and recovery manager.
 *
 * The sync-side collaborators are optional beans; custom strategies and
 * observers declared as beans are registered on startup.
 */
@Configuration
public class RecoveryConfiguration {

    @Bean
    public RecoveryCollaborators recoveryCollaborators(
            BackupManager backupManager,
            SystemStateProvider systemStateProvider,
            ObjectProvider<SyncOperationExecutor> executor,
            ObjectProvider<CredentialProvider> credentials,
            ObjectProvider<ConflictResolver> conflictResolver,
            ObjectProvider<ResourceReclaimer> reclaimer,
            Sleeper sleeper,
            Clock clock,
            SyncRecoveryProperties properties) {
        SyncRecoveryProperties.Recovery recovery = properties.getRecovery();
        return RecoveryCollaborators.builder(backupManager, systemStateProvider)
            .executor(executor.getIfAvailable())
            .credentials(credentials.getIfAvailable())
            .conflictResolver(conflictResolver.getIfAvailable())
            .reclaimer(reclaimer.getIfAvailable())
            .sleeper(sleeper)
            .backoff(new BackoffPolicy(recovery.getInitialRetryDelay(), recovery.getMaxRetryDelay(),
                recovery.getBackoffMultiplier()))
            .clock(clock)
            .build();
    }

    @Bean
    public RecoveryStrategyFactory recoveryStrategyFactory(RecoveryCollaborators collaborators,
                                                           ObjectProvider<RecoveryStrategy> customStrategies) {
        RecoveryStrategyFactory factory = new RecoveryStrategyFactory(collaborators);
        customStrategies.orderedStream().forEach(factory::register);
        return factory;
    }

    @Bean
    public RecoveryEventBus recoveryEventBus(SyncRecoveryMetrics metrics, SyncRecoveryProperties properties,
                                             ObjectProvider<RecoveryObserver> observers) {
        RecoveryEventBus bus = new RecoveryEventBus(properties.getRecovery().getEventBusCapacity(), metrics);
        observers.orderedStream().forEach(bus::addObserver);
        return bus;
    }

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public RecoveryManager recoveryManager(FailureClassifier classifier, RecoveryStrategyFactory strategyFactory,
                                           RollbackPointService rollbackPoints, BackupManager backupManager,
                                           SystemStateProvider systemStateProvider, ChangeLogger changeLogger,
                                           RecoveryEventBus eventBus, SyncRecoveryMetrics metrics, Clock clock,
                                           SyncRecoveryProperties properties) {
        return new RecoveryManager(classifier, strategyFactory, rollbackPoints, backupManager, systemStateProvider,
            changeLogger, eventBus, metrics, clock, RecoverySettings.from(properties.getRecovery()));
    }
}
