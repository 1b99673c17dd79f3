package com.syncrecovery.engine.rollback;

import com.syncrecovery.core.exception.BackupOperationException;
import com.syncrecovery.core.exception.NotFoundException;
import com.syncrecovery.core.exception.RollbackPointExpiredException;
import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.BackupType;
import com.syncrecovery.core.model.RollbackPoint;
import com.syncrecovery.core.repository.RollbackPointRepository;
import com.syncrecovery.core.spi.BackupManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Creates, restores and expires rollback points.
 * 
 * A rollback point names a backup taken before a risky step. It is never
 * applied once expired, and the backup manager is not called in that case.
 */
public class RollbackPointService {

    private static final Logger log = LoggerFactory.getLogger(RollbackPointService.class);
    private static final int CLEANUP_BATCH_SIZE = 100;

    private final RollbackPointRepository repository;
    private final BackupManager backupManager;
    private final Clock clock;
    private final Duration defaultTtl;

    public RollbackPointService(
            RollbackPointRepository repository,
            BackupManager backupManager,
            Clock clock,
            Duration defaultTtl) {
        this.repository = repository;
        this.backupManager = backupManager;
        this.clock = clock;
        this.defaultTtl = defaultTtl != null ? defaultTtl : RollbackPoint.DEFAULT_TTL;
    }

    /**
     * Take a backup and record a rollback point for it.
     * 
     * @param ttl Lifetime, null for the default
     * @param ownerSessionId Replay session owning the point, null otherwise
     */
    public RollbackPoint create(String description, List<String> operationIds, BackupType backupType,
                                List<String> tables, Duration ttl, String ownerSessionId) {
        BackupInfo backup = backupManager.createBackup(backupType, tables);
        RollbackPoint point = RollbackPoint.create(
            description,
            backup.id(),
            operationIds,
            ownerSessionId,
            clock.instant(),
            ttl != null ? ttl : defaultTtl
        );
        repository.save(point);
        log.info("Created rollback point {} (backup={}, expires={})", point.id(), backup.id(), point.expiresAt());
        return point;
    }

    public RollbackPoint create(String description, List<String> operationIds, BackupType backupType,
                                List<String> tables) {
        return create(description, operationIds, backupType, tables, null, null);
    }

    /**
     * Restore the backup behind a rollback point.
     * 
     * @throws NotFoundException if the point does not exist
     * @throws RollbackPointExpiredException if the point has expired
     */
    public RollbackPoint restore(String rollbackPointId) {
        RollbackPoint point = get(rollbackPointId);
        Instant now = clock.instant();
        if (point.isExpired(now)) {
            log.warn("Refusing to restore expired rollback point {} (expired {})", point.id(), point.expiresAt());
            throw new RollbackPointExpiredException(point.id(), point.expiresAt());
        }

        boolean restored = backupManager.restoreFromBackup(point.backupId(), List.of());
        if (!restored) {
            throw new BackupOperationException(
                "Backup " + point.backupId() + " of rollback point " + point.id() + " could not be restored");
        }
        log.info("Restored rollback point {} from backup {}", point.id(), point.backupId());
        return point;
    }

    /**
     * Delete a rollback point together with its backup.
     */
    public boolean discard(String rollbackPointId) {
        Optional<RollbackPoint> point = repository.findById(rollbackPointId);
        boolean removed = repository.delete(rollbackPointId);
        if (removed) {
            point.ifPresent(p -> deleteBackup(p.backupId()));
            log.debug("Discarded rollback point {}", rollbackPointId);
        }
        return removed;
    }

    /**
     * True if the backup is held by a live rollback point. Such backups are
     * snapshots of in-progress work, not restore sources for other recoveries.
     */
    public boolean isRollbackBackup(String backupId) {
        return repository.findAll().stream().anyMatch(point -> point.backupId().equals(backupId));
    }

    public RollbackPoint get(String rollbackPointId) {
        return repository.findById(rollbackPointId)
            .orElseThrow(() -> new NotFoundException("RollbackPoint", rollbackPointId));
    }

    /**
     * @param ownerSessionId Only points owned by this replay session, null for all
     */
    public List<RollbackPoint> list(String ownerSessionId) {
        return ownerSessionId != null ? repository.findByOwner(ownerSessionId) : repository.findAll();
    }

    /**
     * Delete expired rollback points.
     * 
     * @return Number of points removed
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = 0;
        List<RollbackPoint> expired;
        int batchRemoved;
        do {
            expired = repository.findExpired(now, CLEANUP_BATCH_SIZE);
            batchRemoved = 0;
            for (RollbackPoint point : expired) {
                if (repository.delete(point.id())) {
                    deleteBackup(point.backupId());
                    batchRemoved++;
                }
            }
            removed += batchRemoved;
        } while (expired.size() == CLEANUP_BATCH_SIZE && batchRemoved > 0);

        if (removed > 0) {
            log.info("Removed {} expired rollback points", removed);
        }
        return removed;
    }

    private void deleteBackup(String backupId) {
        try {
            backupManager.deleteBackup(backupId);
        } catch (RuntimeException e) {
            log.warn("Could not delete backup {}: {}", backupId, e.getMessage());
        }
    }
}
