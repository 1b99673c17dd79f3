package com.syncrecovery.engine.backup;

import com.syncrecovery.core.exception.BackupOperationException;
import com.syncrecovery.core.model.BackupFilter;
import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.BackupType;
import com.syncrecovery.core.spi.BackupManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Backup manager keeping snapshots in memory.
 * 
 * Backup ids are monotonic (backup_1, backup_2, ...). Each record is written
 * once under the manager lock, so readers never see a partial backup.
 */
public class InMemoryBackupManager implements BackupManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackupManager.class);

    private record StoredBackup(BackupInfo info, byte[] snapshot) {}

    private final BackupSnapshotSource snapshotSource;
    private final Clock clock;
    private final Duration retention;

    private final Map<String, StoredBackup> backups = new LinkedHashMap<>();
    private long nextId = 1;

    public InMemoryBackupManager(BackupSnapshotSource snapshotSource, Clock clock, int retentionDays) {
        this.snapshotSource = snapshotSource;
        this.clock = clock;
        this.retention = Duration.ofDays(retentionDays);
    }

    @Override
    public synchronized BackupInfo createBackup(BackupType type, List<String> tables) {
        List<String> covered = tables == null ? List.of() : List.copyOf(tables);
        byte[] snapshot;
        try {
            snapshot = snapshotSource.capture(type, covered);
        } catch (Exception e) {
            throw new BackupOperationException("Failed to capture " + type + " backup of " + covered, e);
        }

        String id = "backup_" + nextId++;
        Instant now = clock.instant();
        BackupInfo info = new BackupInfo(
            id,
            now,
            type,
            snapshot.length,
            "memory://" + id,
            checksum(id, type, covered, now, snapshot),
            covered,
            false,
            false
        );

        backups.put(id, new StoredBackup(info, snapshot));
        log.info("Created {} backup {} for tables {}", type, id, covered.isEmpty() ? "ALL" : covered);
        return info;
    }

    @Override
    public synchronized boolean restoreFromBackup(String backupId, List<String> tables) {
        StoredBackup stored = backups.get(backupId);
        if (stored == null) {
            log.warn("Cannot restore unknown backup {}", backupId);
            return false;
        }

        List<String> requested = tables == null ? List.of() : tables;
        for (String table : requested) {
            if (!stored.info().covers(table)) {
                log.warn("Backup {} does not cover table {}", backupId, table);
                return false;
            }
        }

        if (!isIntact(stored)) {
            throw new BackupOperationException("Backup " + backupId + " failed checksum verification");
        }

        try {
            snapshotSource.restore(stored.snapshot(), requested.isEmpty() ? stored.info().tables() : requested);
        } catch (Exception e) {
            throw new BackupOperationException("Failed to restore backup " + backupId, e);
        }
        log.info("Restored backup {} (tables={})", backupId, requested.isEmpty() ? "ALL" : requested);
        return true;
    }

    @Override
    public synchronized List<BackupInfo> listBackups(BackupFilter filter) {
        BackupFilter criteria = filter != null ? filter : BackupFilter.all();
        return backups.values().stream()
            .map(StoredBackup::info)
            .filter(criteria::matches)
            .sorted(Comparator.comparing(BackupInfo::timestamp).reversed()
                .thenComparing(Comparator.comparingLong(InMemoryBackupManager::sequenceOf).reversed()))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean deleteBackup(String backupId) {
        boolean removed = backups.remove(backupId) != null;
        if (removed) {
            log.info("Deleted backup {}", backupId);
        }
        return removed;
    }

    @Override
    public synchronized boolean verifyBackup(String backupId) {
        StoredBackup stored = backups.get(backupId);
        return stored != null && isIntact(stored);
    }

    @Override
    public synchronized int cleanup() {
        Instant cutoff = clock.instant().minus(retention);
        List<String> expired = new ArrayList<>();
        for (StoredBackup stored : backups.values()) {
            if (stored.info().timestamp().isBefore(cutoff)) {
                expired.add(stored.info().id());
            }
        }
        expired.forEach(backups::remove);
        if (!expired.isEmpty()) {
            log.info("Removed {} backups older than {} days", expired.size(), retention.toDays());
        }
        return expired.size();
    }

    private static boolean isIntact(StoredBackup stored) {
        BackupInfo info = stored.info();
        return info.checksum().equals(
            checksum(info.id(), info.type(), info.tables(), info.timestamp(), stored.snapshot()));
    }

    private static long sequenceOf(BackupInfo info) {
        return Long.parseLong(info.id().substring("backup_".length()));
    }

    private static String checksum(String id, BackupType type, List<String> tables, Instant timestamp,
                                   byte[] snapshot) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String descriptor = id + "|" + type + "|" + String.join(",", tables) + "|" + timestamp.toEpochMilli();
            digest.update(descriptor.getBytes(StandardCharsets.UTF_8));
            digest.update(snapshot);
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
