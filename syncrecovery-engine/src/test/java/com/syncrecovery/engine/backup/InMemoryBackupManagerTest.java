package com.syncrecovery.engine.backup;

import com.syncrecovery.core.exception.BackupOperationException;
import com.syncrecovery.core.model.BackupFilter;
import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.BackupType;
import com.syncrecovery.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class InMemoryBackupManagerTest {

    private TimeController clock;
    private RecordingSource source;
    private InMemoryBackupManager manager;

    @BeforeEach
    void setUp() {
        clock = new TimeController(Instant.parse("2024-03-01T00:00:00Z"));
        source = new RecordingSource();
        manager = new InMemoryBackupManager(source, clock, 30);
    }

    @Test
    @DisplayName("Backups get monotonic ids and verifiable checksums")
    void testCreateBackup() {
        BackupInfo first = manager.createBackup(BackupType.FULL, List.of());
        BackupInfo second = manager.createBackup(BackupType.INCREMENTAL, List.of("tasks"));

        assertThat(first.id()).isEqualTo("backup_1");
        assertThat(second.id()).isEqualTo("backup_2");
        assertThat(first.location()).isEqualTo("memory://backup_1");
        assertThat(first.checksum()).hasSize(64);
        assertThat(manager.verifyBackup(first.id())).isTrue();
        assertThat(manager.verifyBackup("backup_99")).isFalse();
    }

    @Test
    @DisplayName("Restore hands the captured snapshot back to the source")
    void testRestore() {
        BackupInfo backup = manager.createBackup(BackupType.FULL, List.of("tasks", "changes"));

        assertThat(manager.restoreFromBackup(backup.id(), List.of("tasks"))).isTrue();
        assertThat(source.restored).containsExactly("FULL:[tasks, changes]->[tasks]");
    }

    @Test
    @DisplayName("Unknown backups and uncovered tables are not restored")
    void testRestoreRejected() {
        BackupInfo backup = manager.createBackup(BackupType.INCREMENTAL, List.of("tasks"));

        assertThat(manager.restoreFromBackup("backup_404", List.of())).isFalse();
        assertThat(manager.restoreFromBackup(backup.id(), List.of("users"))).isFalse();
        assertThat(source.restored).isEmpty();
    }

    @Test
    @DisplayName("Source failures surface as BackupOperationException")
    void testSourceFailure() {
        BackupInfo backup = manager.createBackup(BackupType.FULL, List.of());
        source.failRestore = true;

        assertThatThrownBy(() -> manager.restoreFromBackup(backup.id(), List.of()))
            .isInstanceOf(BackupOperationException.class)
            .hasMessageContaining(backup.id());
    }

    @Test
    @DisplayName("Listing is newest first and honours the filter")
    void testListBackups() {
        manager.createBackup(BackupType.FULL, List.of());
        clock.advance(Duration.ofMinutes(1));
        manager.createBackup(BackupType.INCREMENTAL, List.of("tasks"));
        clock.advance(Duration.ofMinutes(1));
        manager.createBackup(BackupType.INCREMENTAL, List.of("users"));

        assertThat(manager.listBackups(null)).extracting(BackupInfo::id)
            .containsExactly("backup_3", "backup_2", "backup_1");
        assertThat(manager.listBackups(new BackupFilter(BackupType.INCREMENTAL, null, null)))
            .extracting(BackupInfo::id)
            .containsExactly("backup_3", "backup_2");
    }

    @Test
    @DisplayName("Cleanup drops backups past the retention window")
    void testCleanup() {
        manager.createBackup(BackupType.FULL, List.of());
        clock.advanceDays(31);
        BackupInfo recent = manager.createBackup(BackupType.FULL, List.of());

        assertThat(manager.cleanup()).isEqualTo(1);
        assertThat(manager.listBackups(null)).extracting(BackupInfo::id).containsExactly(recent.id());
        assertThat(manager.deleteBackup(recent.id())).isTrue();
        assertThat(manager.deleteBackup(recent.id())).isFalse();
    }

    @Test
    @DisplayName("Concurrent callers never share a backup id")
    void testConcurrentCreate() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<BackupInfo>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(executor.submit(() -> manager.createBackup(BackupType.INCREMENTAL, List.of())));
            }
            Set<String> ids = ConcurrentHashMap.newKeySet();
            for (Future<BackupInfo> future : futures) {
                ids.add(future.get().id());
            }
            assertThat(ids).hasSize(50);
        } finally {
            executor.shutdownNow();
        }
    }

    private static class RecordingSource implements BackupSnapshotSource {
        final List<String> restored = new ArrayList<>();
        boolean failRestore = false;

        @Override
        public byte[] capture(BackupType type, List<String> tables) {
            return (type + ":" + tables).getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public void restore(byte[] snapshot, List<String> tables) {
            if (failRestore) {
                throw new IllegalStateException("disk unavailable");
            }
            restored.add(new String(snapshot, StandardCharsets.UTF_8) + "->" + tables);
        }
    }
}
