package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.BackoffPolicy;
import com.syncrecovery.core.spi.BackupManager;
import com.syncrecovery.core.spi.SystemStateProvider;
import com.syncrecovery.engine.concurrent.Sleeper;
import com.syncrecovery.recovery.spi.ConflictResolver;
import com.syncrecovery.recovery.spi.CredentialProvider;
import com.syncrecovery.recovery.spi.ResourceReclaimer;
import com.syncrecovery.recovery.spi.SyncOperationExecutor;

import java.time.Clock;

/**
 * Everything the built-in strategies call out to.
 *
 * The sync-side collaborators (executor, credentials, conflict resolver,
 * reclaimer) may be null; a strategy step needing a missing one fails.
 */
public record RecoveryCollaborators(
    SyncOperationExecutor executor,
    CredentialProvider credentials,
    ConflictResolver conflictResolver,
    ResourceReclaimer reclaimer,
    BackupManager backupManager,
    SystemStateProvider systemState,
    Sleeper sleeper,
    BackoffPolicy backoff,
    Clock clock
) {
    public RecoveryCollaborators {
        if (backupManager == null || systemState == null) {
            throw new IllegalArgumentException("Backup manager and system state provider are required");
        }
        sleeper = sleeper != null ? sleeper : Sleeper.system();
        backoff = backoff != null ? backoff : BackoffPolicy.defaultPolicy();
        clock = clock != null ? clock : Clock.systemUTC();
    }

    public static Builder builder(BackupManager backupManager, SystemStateProvider systemState) {
        return new Builder(backupManager, systemState);
    }

    public static class Builder {
        private final BackupManager backupManager;
        private final SystemStateProvider systemState;
        private SyncOperationExecutor executor;
        private CredentialProvider credentials;
        private ConflictResolver conflictResolver;
        private ResourceReclaimer reclaimer;
        private Sleeper sleeper;
        private BackoffPolicy backoff;
        private Clock clock;

        private Builder(BackupManager backupManager, SystemStateProvider systemState) {
            this.backupManager = backupManager;
            this.systemState = systemState;
        }

        public Builder executor(SyncOperationExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder credentials(CredentialProvider credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder conflictResolver(ConflictResolver conflictResolver) {
            this.conflictResolver = conflictResolver;
            return this;
        }

        public Builder reclaimer(ResourceReclaimer reclaimer) {
            this.reclaimer = reclaimer;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RecoveryCollaborators build() {
            return new RecoveryCollaborators(executor, credentials, conflictResolver, reclaimer,
                backupManager, systemState, sleeper, backoff, clock);
        }
    }
}
