package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.BackupType;
import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.FailureSeverity;
import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.NetworkStatus;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.core.model.SyncDirection;
import com.syncrecovery.core.model.SyncError;
import com.syncrecovery.core.model.SyncOperation;
import com.syncrecovery.core.model.SyncOperationStatus;
import com.syncrecovery.core.model.SystemState;
import com.syncrecovery.core.spi.SystemStateProvider;
import com.syncrecovery.core.test.FailureInjector;
import com.syncrecovery.core.test.TimeController;
import com.syncrecovery.engine.backup.BackupSnapshotSource;
import com.syncrecovery.engine.backup.InMemoryBackupManager;
import com.syncrecovery.engine.concurrent.Sleeper;
import com.syncrecovery.recovery.spi.ConflictResolver;
import com.syncrecovery.recovery.spi.RecoveryStepException;
import com.syncrecovery.recovery.spi.ResolutionPolicy;
import com.syncrecovery.recovery.spi.ResourceReclaimer;
import com.syncrecovery.recovery.spi.SyncOperationExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Recovery strategies")
class RecoveryStrategiesTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private TimeController clock;
    private InMemoryBackupManager backups;
    private AtomicReference<NetworkStatus> network;
    private List<Duration> sleeps;
    private List<String> reissued;
    private FailureInjector executorFailures;

    @BeforeEach
    void setUp() {
        clock = new TimeController(NOW);
        backups = new InMemoryBackupManager(BackupSnapshotSource.noop(), clock, 30);
        network = new AtomicReference<>(NetworkStatus.ONLINE);
        sleeps = new ArrayList<>();
        reissued = new ArrayList<>();
        executorFailures = FailureInjector.neverFail();
    }

    private RecoveryCollaborators.Builder collaborators() {
        SystemStateProvider provider = new SystemStateProvider() {
            @Override
            public SystemState snapshot() {
                return healthy();
            }

            @Override
            public NetworkStatus probeNetwork() {
                return network.get();
            }
        };
        Sleeper recordingSleeper = sleeps::add;
        SyncOperationExecutor executor = operation -> {
            if (executorFailures.shouldFail()) {
                throw new RecoveryStepException("SYNC_FAILED", "remote rejected " + operation.id());
            }
            reissued.add(operation.id());
        };
        return RecoveryCollaborators.builder(backups, provider)
            .executor(executor)
            .sleeper(recordingSleeper)
            .clock(clock);
    }

    private static SystemState healthy() {
        return new SystemState(NetworkStatus.ONLINE, 50 * SystemState.GIGABYTE, 0.3, 0.2, 0, 0, NOW);
    }

    private static RecoveryContext context(FailureType type, int previousAttempts, SystemState state,
                                           BackupInfo backup) {
        return context(type, FailureSeverity.MEDIUM, previousAttempts, state, backup, "sync failed");
    }

    private static RecoveryContext context(FailureType type, FailureSeverity severity, int previousAttempts,
                                           SystemState state, BackupInfo backup, String errorMessage) {
        SyncError error = SyncError.of("E", errorMessage, NOW, true);
        SyncOperation operation = new SyncOperation("op-1", SyncDirection.LOCAL_TO_REMOTE, "tasks", "rec-1",
            SyncOperationStatus.RECOVERING, NOW, previousAttempts + 1, 3, null, error);
        FailureClassification classification = new FailureClassification("op-1", type, severity, true,
            RecoveryAction.RETRY, Duration.ofSeconds(5), Map.of());
        return new RecoveryContext(operation, classification, previousAttempts, backup, state);
    }

    // ========== Network ==========

    @Nested
    @DisplayName("Network retry")
    class Network {

        @Test
        @DisplayName("Backs off, re-probes and re-issues the operation")
        void testSuccess() {
            RecoveryStrategy strategy = new NetworkRetryStrategy(collaborators().build());

            RecoveryResult result = strategy.execute(context(FailureType.NETWORK_ERROR, 1, healthy(), null));

            assertThat(result.success()).isTrue();
            assertThat(result.action()).isEqualTo(RecoveryAction.BACKOFF_RETRY);
            assertThat(result.message()).isEqualTo("NetworkRetryStrategy executed successfully");
            assertThat(result.metadata())
                .containsEntry("attempt", 2)
                .containsEntry("delay", 2000L)
                .containsEntry("networkHealth", "ONLINE");
            assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
            assertThat(reissued).containsExactly("op-1");
        }

        @Test
        @DisplayName("Fails without re-issuing while the network is offline")
        void testStillOffline() {
            network.set(NetworkStatus.OFFLINE);
            RecoveryStrategy strategy = new NetworkRetryStrategy(collaborators().build());

            RecoveryResult result = strategy.execute(context(FailureType.NETWORK_ERROR, 0, healthy(), null));

            assertThat(result.success()).isFalse();
            assertThat(result.action()).isEqualTo(RecoveryAction.BACKOFF_RETRY);
            assertThat(result.nextAction()).isNull();
            assertThat(result.error().code()).isEqualTo(RecoveryResult.STRATEGY_FAILED);
            assertThat(result.error().message()).startsWith("NetworkRetryStrategy failed:");
            assertThat(result.error().recoverable()).isTrue();
            assertThat(reissued).isEmpty();
        }

        @Test
        @DisplayName("A failure on the last allowed attempt escalates")
        void testLastAttemptEscalates() {
            executorFailures = FailureInjector.alwaysFail();
            RecoveryStrategy strategy = new NetworkRetryStrategy(collaborators().build());

            RecoveryResult result = strategy.execute(context(FailureType.NETWORK_ERROR, 4, healthy(), null));

            assertThat(result.success()).isFalse();
            assertThat(result.nextAction()).isEqualTo(RecoveryAction.ESCALATE);
            assertThat(result.message()).contains("remote rejected op-1");
        }

        @Test
        @DisplayName("Refuses to retry on an unhealthy host")
        void testUnhealthyHost() {
            SystemState strained = new SystemState(NetworkStatus.ONLINE, 50 * SystemState.GIGABYTE, 0.95, 0.2,
                0, 0, NOW);
            RecoveryStrategy strategy = new NetworkRetryStrategy(collaborators().build());

            RecoveryResult result = strategy.execute(context(FailureType.NETWORK_ERROR, 0, strained, null));

            assertThat(result.success()).isFalse();
            assertThat(result.action()).isEqualTo(RecoveryAction.MANUAL_INTERVENTION);
            assertThat(result.nextAction()).isEqualTo(RecoveryAction.ESCALATE);
            assertThat(result.message()).contains("Max retry attempts exceeded or system unhealthy");
            assertThat(result.error().recoverable()).isFalse();
            assertThat(result.requiresManualIntervention()).isTrue();
            assertThat(sleeps).isEmpty();
        }
    }

    // ========== Auth ==========

    @Test
    @DisplayName("Auth recovery refreshes credentials before retrying")
    void testAuthRecovery() {
        Instant expiry = NOW.plus(Duration.ofHours(1));
        RecoveryStrategy strategy = new AuthRecoveryStrategy(collaborators().credentials(() -> expiry).build());

        RecoveryResult result = strategy.execute(context(FailureType.AUTHENTICATION_ERROR, 0, healthy(), null));

        assertThat(result.success()).isTrue();
        assertThat(result.action()).isEqualTo(RecoveryAction.RETRY);
        assertThat(result.metadata())
            .containsEntry("tokenRefreshed", true)
            .containsEntry("newTokenExpiry", expiry.toString());
        assertThat(reissued).containsExactly("op-1");
    }

    @Test
    @DisplayName("Auth recovery without a credential provider escalates")
    void testAuthRecoveryWithoutProvider() {
        RecoveryStrategy strategy = new AuthRecoveryStrategy(collaborators().build());

        RecoveryResult result = strategy.execute(context(FailureType.AUTHENTICATION_ERROR, 0, healthy(), null));

        assertThat(result.success()).isFalse();
        assertThat(result.action()).isEqualTo(RecoveryAction.RETRY);
        assertThat(result.nextAction()).isEqualTo(RecoveryAction.ESCALATE);
        assertThat(result.message()).contains("No CredentialProvider configured");
        assertThat(reissued).isEmpty();
    }

    // ========== Data Corruption ==========

    @Nested
    @DisplayName("Data corruption recovery")
    class DataCorruption {

        @Test
        @DisplayName("Escalates without touching anything when no backup exists")
        void testNoBackup() {
            RecoveryStrategy strategy = new DataCorruptionRecoveryStrategy(collaborators().build());

            RecoveryResult result = strategy.execute(context(FailureType.DATA_CORRUPTION, 0, healthy(), null));

            assertThat(result.success()).isFalse();
            assertThat(result.action()).isEqualTo(RecoveryAction.MANUAL_INTERVENTION);
            assertThat(result.nextAction()).isEqualTo(RecoveryAction.ESCALATE);
            assertThat(result.message()).contains("No backup available for recovery");
        }

        @Test
        @DisplayName("Verifies, restores and validates the backup")
        void testRestore() {
            BackupInfo backup = backups.createBackup(BackupType.FULL, List.of());
            RecoveryStrategy strategy = new DataCorruptionRecoveryStrategy(collaborators().build());

            RecoveryResult result = strategy.execute(context(FailureType.DATA_CORRUPTION, 0, healthy(), backup));

            assertThat(result.success()).isTrue();
            assertThat(result.action()).isEqualTo(RecoveryAction.RESTORE_FROM_BACKUP);
            assertThat(result.metadata())
                .containsEntry("backupId", backup.id())
                .containsEntry("tablesRestored", List.of("tasks"));
        }

        @Test
        @DisplayName("A failed validation hands over to a human")
        void testValidationFails() {
            BackupInfo backup = backups.createBackup(BackupType.FULL, List.of());
            SyncOperationExecutor rejecting = new SyncOperationExecutor() {
                @Override
                public void reissue(SyncOperation operation) {
                }

                @Override
                public void validate(SyncOperation operation) throws RecoveryStepException {
                    throw new RecoveryStepException("VALIDATION_FAILED", "row count mismatch");
                }
            };
            RecoveryStrategy strategy = new DataCorruptionRecoveryStrategy(collaborators().executor(rejecting).build());

            RecoveryResult result = strategy.execute(context(FailureType.SCHEMA_MISMATCH, 0, healthy(), backup));

            assertThat(result.success()).isFalse();
            assertThat(result.action()).isEqualTo(RecoveryAction.RESTORE_FROM_BACKUP);
            assertThat(result.nextAction()).isEqualTo(RecoveryAction.MANUAL_INTERVENTION);
            assertThat(result.message()).contains("row count mismatch");
        }

        @Test
        @DisplayName("A deleted backup fails the integrity check")
        void testMissingBackup() {
            BackupInfo backup = backups.createBackup(BackupType.FULL, List.of());
            backups.deleteBackup(backup.id());
            RecoveryStrategy strategy = new DataCorruptionRecoveryStrategy(collaborators().build());

            RecoveryResult result = strategy.execute(context(FailureType.DATA_CORRUPTION, 0, healthy(), backup));

            assertThat(result.success()).isFalse();
            assertThat(result.message()).contains("integrity check failed");
        }
    }

    // ========== Conflicts ==========

    @Nested
    @DisplayName("Conflict resolution")
    class Conflicts {

        private final List<ResolutionPolicy> applied = new ArrayList<>();

        private final ConflictResolver resolver = (operation, analysis, policy) -> {
            applied.add(policy);
            return 3;
        };

        @Test
        @DisplayName("Update conflicts use last-write-wins")
        void testUpdateConflict() {
            RecoveryStrategy strategy = new ConflictResolutionStrategy(collaborators().conflictResolver(resolver).build());

            RecoveryResult result = strategy.execute(context(FailureType.CONFLICT_ERROR, FailureSeverity.HIGH, 0,
                healthy(), null, "Conflict on UPDATE of row 7"));

            assertThat(result.success()).isTrue();
            assertThat(result.action()).isEqualTo(RecoveryAction.FALLBACK_STRATEGY);
            assertThat(result.metadata())
                .containsEntry("conflictType", "UPDATE_CONFLICT")
                .containsEntry("resolutionStrategy", "LAST_WRITE_WINS")
                .containsEntry("recordsResolved", 3);
            assertThat(applied).containsExactly(ResolutionPolicy.LAST_WRITE_WINS);
        }

        @Test
        @DisplayName("Low severity conflicts are merged, others reviewed")
        void testPolicyBySeverity() {
            RecoveryStrategy strategy = new ConflictResolutionStrategy(collaborators().conflictResolver(resolver).build());

            strategy.execute(context(FailureType.CONFLICT_ERROR, FailureSeverity.LOW, 0, healthy(), null, "conflict"));
            strategy.execute(context(FailureType.CONFLICT_ERROR, FailureSeverity.MEDIUM, 0, healthy(), null, "conflict"));

            assertThat(applied).containsExactly(ResolutionPolicy.AUTO_MERGE, ResolutionPolicy.MANUAL_REVIEW);
        }

        @Test
        @DisplayName("A resolver error becomes a failed result")
        void testResolverThrows() {
            ConflictResolver broken = (operation, analysis, policy) -> {
                throw new IllegalStateException("merge engine down");
            };
            RecoveryStrategy strategy = new ConflictResolutionStrategy(collaborators().conflictResolver(broken).build());

            RecoveryResult result = strategy.execute(context(FailureType.CONFLICT_ERROR, 0, healthy(), null));

            assertThat(result.success()).isFalse();
            assertThat(result.action()).isEqualTo(RecoveryAction.FALLBACK_STRATEGY);
            assertThat(result.nextAction()).isEqualTo(RecoveryAction.MANUAL_INTERVENTION);
            assertThat(result.message()).contains("merge engine down");
        }
    }

    // ========== Resources ==========

    @Test
    @DisplayName("Resource exhaustion frees the resources under pressure")
    void testResourceExhaustion() {
        List<String> calls = new ArrayList<>();
        ResourceReclaimer reclaimer = new ResourceReclaimer() {
            @Override
            public long reclaimMemory() {
                calls.add("memory");
                return 512;
            }

            @Override
            public long reclaimDisk() {
                calls.add("disk");
                return 2048;
            }

            @Override
            public void throttleCpu() {
                calls.add("cpu");
            }
        };
        SystemState pressured = new SystemState(NetworkStatus.ONLINE, 2 * SystemState.GIGABYTE, 0.85, 0.5, 0, 0, NOW);
        RecoveryStrategy strategy = new ResourceExhaustionStrategy(collaborators().reclaimer(reclaimer).build());

        RecoveryResult result = strategy.execute(context(FailureType.RESOURCE_EXHAUSTION, 0, pressured, null));

        assertThat(result.success()).isTrue();
        assertThat(result.action()).isEqualTo(RecoveryAction.FALLBACK_STRATEGY);
        assertThat(result.metadata())
            .containsEntry("resourceOptimizations", List.of("memory_cleanup", "disk_cleanup"))
            .containsEntry("memoryFreed", 512L)
            .containsEntry("diskSpaceFreed", 2048L);
        assertThat(calls).containsExactly("memory", "disk");
        assertThat(reissued).containsExactly("op-1");
    }

    @Test
    @DisplayName("Resource exhaustion without a reclaimer resets and resyncs")
    void testResourceExhaustionWithoutReclaimer() {
        SystemState pressured = new SystemState(NetworkStatus.ONLINE, 50 * SystemState.GIGABYTE, 0.5, 0.95, 0, 0, NOW);
        RecoveryStrategy strategy = new ResourceExhaustionStrategy(collaborators().build());

        RecoveryResult result = strategy.execute(context(FailureType.RESOURCE_EXHAUSTION, 0, pressured, null));

        assertThat(result.success()).isFalse();
        assertThat(result.action()).isEqualTo(RecoveryAction.RESET_AND_RESYNC);
        assertThat(result.nextAction()).isEqualTo(RecoveryAction.MANUAL_INTERVENTION);
        assertThat(reissued).isEmpty();
    }

    // ========== Default ==========

    @Test
    @DisplayName("Default retry doubles the delay per attempt")
    void testDefaultRetry() {
        RecoveryStrategy strategy = new DefaultRetryStrategy(collaborators().build());

        RecoveryResult result = strategy.execute(context(FailureType.UNKNOWN_ERROR, 2, healthy(), null));

        assertThat(result.success()).isTrue();
        assertThat(result.action()).isEqualTo(RecoveryAction.RETRY);
        assertThat(result.metadata()).containsEntry("attempt", 3).containsEntry("delay", 4000L);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("Duration covers the time spent in the strategy")
    void testDurationMeasured() {
        Sleeper advancing = duration -> clock.advance(duration);
        RecoveryStrategy strategy = new DefaultRetryStrategy(collaborators().sleeper(advancing).build());

        RecoveryResult result = strategy.execute(context(FailureType.UNKNOWN_ERROR, 0, healthy(), null));

        assertThat(result.duration()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Missing host collaborators are rejected")
    void testRequiredCollaborators() {
        assertThatThrownBy(() -> RecoveryCollaborators.builder(null, null).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
