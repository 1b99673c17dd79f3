package com.syncrecovery.core.spi;

import com.syncrecovery.core.model.BackupFilter;
import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.BackupType;

import java.util.List;

/**
 * Backup facility provided by the host environment.
 * Implementations must tolerate concurrent callers; backup records are written atomically.
 */
public interface BackupManager {

    /**
     * Create a backup.
     * 
     * @param type Backup type
     * @param tables Tables to include, empty for all
     * @return The created backup
     * @throws com.syncrecovery.core.exception.BackupOperationException if the backup cannot be taken
     */
    BackupInfo createBackup(BackupType type, List<String> tables);

    /**
     * Restore a backup.
     * 
     * @param backupId The backup to restore
     * @param tables Tables to restore, empty for all tables in the backup
     * @return true if the restore completed
     */
    boolean restoreFromBackup(String backupId, List<String> tables);

    /**
     * List backups, newest first.
     */
    List<BackupInfo> listBackups(BackupFilter filter);

    /**
     * @return true if the backup existed
     */
    boolean deleteBackup(String backupId);

    /**
     * Check the backup exists and its checksum matches.
     */
    boolean verifyBackup(String backupId);

    /**
     * Delete backups past their retention.
     * 
     * @return Number of backups deleted
     */
    int cleanup();
}
