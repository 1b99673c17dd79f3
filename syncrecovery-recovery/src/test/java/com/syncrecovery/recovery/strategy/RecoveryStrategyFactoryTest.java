package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.FailureSeverity;
import com.syncrecovery.core.model.FailureType;
import com.syncrecovery.core.model.NetworkStatus;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.core.model.SyncDirection;
import com.syncrecovery.core.model.SyncOperation;
import com.syncrecovery.core.model.SystemState;
import com.syncrecovery.core.test.TimeController;
import com.syncrecovery.engine.backup.BackupSnapshotSource;
import com.syncrecovery.engine.backup.InMemoryBackupManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Recovery strategy factory")
class RecoveryStrategyFactoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private RecoveryStrategyFactory factory;

    @BeforeEach
    void setUp() {
        TimeController clock = new TimeController(NOW);
        SystemState healthy = new SystemState(NetworkStatus.ONLINE, 50 * SystemState.GIGABYTE, 0.1, 0.1, 0, 0, NOW);
        factory = new RecoveryStrategyFactory(RecoveryCollaborators.builder(
            new InMemoryBackupManager(BackupSnapshotSource.noop(), clock, 30), () -> healthy).clock(clock).build());
    }

    private static RecoveryContext context(FailureType type, int previousAttempts) {
        SyncOperation operation = SyncOperation.create("op-1", SyncDirection.BIDIRECTIONAL, "tasks");
        FailureClassification classification = new FailureClassification("op-1", type, FailureSeverity.MEDIUM,
            true, RecoveryAction.RETRY, Duration.ofSeconds(1), Map.of());
        return new RecoveryContext(operation, classification, previousAttempts, null, null);
    }

    private RecoveryStrategy select(FailureType type, int previousAttempts) {
        return factory.select(type, context(type, previousAttempts));
    }

    @Test
    @DisplayName("Each failure type maps to its built-in strategy")
    void testBuiltInSelection() {
        assertThat(select(FailureType.NETWORK_ERROR, 0).name()).isEqualTo("NetworkRetryStrategy");
        assertThat(select(FailureType.TIMEOUT_ERROR, 0).name()).isEqualTo("NetworkRetryStrategy");
        assertThat(select(FailureType.AUTHENTICATION_ERROR, 0).name()).isEqualTo("AuthRecoveryStrategy");
        assertThat(select(FailureType.SCHEMA_MISMATCH, 0).name()).isEqualTo("DataCorruptionRecoveryStrategy");
        assertThat(select(FailureType.CONFLICT_ERROR, 0).name()).isEqualTo("ConflictResolutionStrategy");
        assertThat(select(FailureType.RESOURCE_EXHAUSTION, 0).name()).isEqualTo("ResourceExhaustionStrategy");
        assertThat(select(FailureType.PERMISSION_ERROR, 0).name()).isEqualTo("DefaultRetryStrategy");
    }

    @Test
    @DisplayName("A strategy out of budget falls back to the default")
    void testBudgetExhausted() {
        assertThat(select(FailureType.NETWORK_ERROR, 4).name()).isEqualTo("NetworkRetryStrategy");
        assertThat(select(FailureType.NETWORK_ERROR, 5).name()).isEqualTo("DefaultRetryStrategy");
        assertThat(select(FailureType.DATA_CORRUPTION, 2).name()).isEqualTo("DefaultRetryStrategy");
    }

    @ParameterizedTest
    @EnumSource(FailureType.class)
    @DisplayName("Selection always yields a strategy")
    void testAlwaysSelects(FailureType type) {
        assertThat(select(type, 100)).isNotNull();
    }

    @Test
    @DisplayName("Custom strategies are indexed by every declared type and ordered by priority")
    void testCustomStrategy() {
        RecoveryStrategy custom = new TestStrategy("VpnReconnect", Set.of(FailureType.NETWORK_ERROR,
            FailureType.CONFLICT_ERROR), 0, 2);
        factory.register(custom);

        assertThat(select(FailureType.NETWORK_ERROR, 0)).isSameAs(custom);
        assertThat(select(FailureType.CONFLICT_ERROR, 1)).isSameAs(custom);
        assertThat(select(FailureType.NETWORK_ERROR, 2).name()).isEqualTo("NetworkRetryStrategy");

        assertThat(factory.unregister("VpnReconnect")).isTrue();
        assertThat(select(FailureType.NETWORK_ERROR, 0).name()).isEqualTo("NetworkRetryStrategy");
        assertThat(factory.unregister("VpnReconnect")).isFalse();
    }

    @Test
    @DisplayName("Equal priorities keep registration order")
    void testPriorityTie() {
        RecoveryStrategy late = new TestStrategy("LateConflict", Set.of(FailureType.CONFLICT_ERROR), 2, 3);
        factory.register(late);

        assertThat(select(FailureType.CONFLICT_ERROR, 0).name()).isEqualTo("ConflictResolutionStrategy");
    }

    @Test
    @DisplayName("Registering a name again replaces the strategy")
    void testReplace() {
        factory.register(new TestStrategy("Custom", Set.of(FailureType.TIMEOUT_ERROR), 0, 1));
        RecoveryStrategy replacement = new TestStrategy("Custom", Set.of(FailureType.UNKNOWN_ERROR), 0, 1);
        factory.register(replacement);

        assertThat(select(FailureType.TIMEOUT_ERROR, 0).name()).isEqualTo("NetworkRetryStrategy");
        assertThat(select(FailureType.UNKNOWN_ERROR, 0)).isSameAs(replacement);
        assertThat(factory.find("Custom")).containsSame(replacement);
    }

    @Test
    @DisplayName("Strategies are listed by priority")
    void testListStrategies() {
        assertThat(factory.listStrategies())
            .extracting(RecoveryStrategy::name)
            .containsExactly(
                "NetworkRetryStrategy",
                "AuthRecoveryStrategy",
                "ConflictResolutionStrategy",
                "ResourceExhaustionStrategy",
                "DataCorruptionRecoveryStrategy",
                "DefaultRetryStrategy");
    }

    @Test
    @DisplayName("The default strategy stays the fallback after being unregistered")
    void testFallbackSurvivesUnregister() {
        factory.unregister("DefaultRetryStrategy");

        assertThat(select(FailureType.UNKNOWN_ERROR, 0).name()).isEqualTo("DefaultRetryStrategy");
        assertThat(factory.find("DefaultRetryStrategy")).isEmpty();
    }

    @Test
    @DisplayName("A strategy registered under the default name becomes the fallback")
    void testReplacedFallback() {
        RecoveryStrategy replacement = new TestStrategy("DefaultRetryStrategy", Set.of(), 9, 1);
        factory.register(replacement);

        assertThat(select(FailureType.NETWORK_ERROR, 50)).isSameAs(replacement);
        assertThat(factory.find("DefaultRetryStrategy")).containsSame(replacement);
    }

    private record TestStrategy(String name, Set<FailureType> failureTypes, int priority, int maxAttempts)
        implements RecoveryStrategy {

        @Override
        public double backoffMultiplier() {
            return 1.0;
        }

        @Override
        public RecoveryResult execute(RecoveryContext context) {
            return RecoveryResult.success(RecoveryAction.RETRY, Duration.ZERO, name + " ok", Map.of());
        }
    }
}
