package com.syncrecovery.engine.rollback;

import com.syncrecovery.core.exception.BackupOperationException;
import com.syncrecovery.core.exception.NotFoundException;
import com.syncrecovery.core.exception.RollbackPointExpiredException;
import com.syncrecovery.core.model.BackupFilter;
import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.BackupType;
import com.syncrecovery.core.model.RollbackPoint;
import com.syncrecovery.core.spi.BackupManager;
import com.syncrecovery.core.test.TimeController;
import com.syncrecovery.engine.backup.BackupSnapshotSource;
import com.syncrecovery.engine.backup.InMemoryBackupManager;
import com.syncrecovery.engine.persistence.InMemoryRollbackPointRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Rollback Points")
class RollbackPointServiceTest {

    private TimeController clock;
    private CountingBackupManager backups;
    private RollbackPointService service;

    @BeforeEach
    void setUp() {
        clock = new TimeController(Instant.parse("2024-03-01T00:00:00Z"));
        backups = new CountingBackupManager(new InMemoryBackupManager(BackupSnapshotSource.noop(), clock, 30));
        service = new RollbackPointService(new InMemoryRollbackPointRepository(), backups, clock, Duration.ofHours(24));
    }

    @Test
    @DisplayName("Creating a rollback point takes a backup")
    void testCreate() {
        RollbackPoint point = service.create("before sync", List.of("op-1"), BackupType.FULL, List.of());

        assertThat(point.backupId()).isEqualTo("backup_1");
        assertThat(point.operationIds()).containsExactly("op-1");
        assertThat(point.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
        assertThat(service.get(point.id())).isEqualTo(point);
    }

    @Test
    @DisplayName("Valid rollback points restore their backup")
    void testRestore() {
        RollbackPoint point = service.create("before sync", List.of("op-1"), BackupType.FULL, List.of());
        clock.advance(Duration.ofHours(23));

        service.restore(point.id());

        assertThat(backups.restoreCalls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Expired rollback points fail without touching the backup")
    void testExpiredRestore() {
        RollbackPoint point = service.create("before sync", List.of("op-1"), BackupType.FULL, List.of());
        clock.advance(Duration.ofHours(25));

        assertThatThrownBy(() -> service.restore(point.id()))
            .isInstanceOf(RollbackPointExpiredException.class)
            .satisfies(e -> assertThat(((RollbackPointExpiredException) e).isRecoverable()).isFalse());
        assertThat(backups.restoreCalls.get()).isZero();
    }

    @Test
    @DisplayName("A backup that cannot be restored is an error")
    void testMissingBackup() {
        RollbackPoint point = service.create("before sync", List.of(), BackupType.FULL, List.of());
        backups.deleteBackup(point.backupId());

        assertThatThrownBy(() -> service.restore(point.id()))
            .isInstanceOf(BackupOperationException.class);
    }

    @Test
    @DisplayName("Cleanup removes only expired points")
    void testCleanupExpired() {
        RollbackPoint shortLived = service.create("a", List.of(), BackupType.FULL, List.of(), Duration.ofHours(1), null);
        RollbackPoint longLived = service.create("b", List.of(), BackupType.FULL, List.of(), Duration.ofDays(2), "replay_1");
        clock.advance(Duration.ofHours(2));

        assertThat(service.cleanupExpired()).isEqualTo(1);
        assertThatThrownBy(() -> service.get(shortLived.id())).isInstanceOf(NotFoundException.class);
        assertThat(service.list("replay_1")).containsExactly(longLived);
        assertThat(service.list(null)).hasSize(1);
        assertThat(backups.listBackups(BackupFilter.all()))
            .extracting(BackupInfo::id)
            .containsExactly(longLived.backupId());
    }

    @Test
    @DisplayName("Discarding a point deletes its backup")
    void testDiscard() {
        BackupInfo hostBackup = backups.createBackup(BackupType.FULL, List.of("tasks"));
        RollbackPoint point = service.create("before sync", List.of("op-1"), BackupType.INCREMENTAL, List.of("tasks"));

        assertThat(service.isRollbackBackup(point.backupId())).isTrue();
        assertThat(service.isRollbackBackup(hostBackup.id())).isFalse();

        assertThat(service.discard(point.id())).isTrue();

        assertThat(service.isRollbackBackup(point.backupId())).isFalse();
        assertThat(backups.listBackups(BackupFilter.all())).containsExactly(hostBackup);
        assertThat(service.discard(point.id())).isFalse();
    }

    private static class CountingBackupManager implements BackupManager {
        private final BackupManager delegate;
        final AtomicInteger restoreCalls = new AtomicInteger();

        CountingBackupManager(BackupManager delegate) {
            this.delegate = delegate;
        }

        @Override
        public BackupInfo createBackup(BackupType type, List<String> tables) {
            return delegate.createBackup(type, tables);
        }

        @Override
        public boolean restoreFromBackup(String backupId, List<String> tables) {
            restoreCalls.incrementAndGet();
            return delegate.restoreFromBackup(backupId, tables);
        }

        @Override
        public List<BackupInfo> listBackups(BackupFilter filter) {
            return delegate.listBackups(filter);
        }

        @Override
        public boolean deleteBackup(String backupId) {
            return delegate.deleteBackup(backupId);
        }

        @Override
        public boolean verifyBackup(String backupId) {
            return delegate.verifyBackup(backupId);
        }

        @Override
        public int cleanup() {
            return delegate.cleanup();
        }
    }
}
