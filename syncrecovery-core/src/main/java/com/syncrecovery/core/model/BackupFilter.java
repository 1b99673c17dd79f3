package com.syncrecovery.core.model;

import java.time.Instant;

/**
 * Criteria for listing backups. Null fields match everything.
 */
public record BackupFilter(BackupType type, String table, Instant since) {

    public static BackupFilter all() {
        return new BackupFilter(null, null, null);
    }

    public static BackupFilter forTable(String table) {
        return new BackupFilter(null, table, null);
    }

    public boolean matches(BackupInfo backup) {
        return (type == null || backup.type() == type)
            && (table == null || backup.covers(table))
            && (since == null || !backup.timestamp().isBefore(since));
    }
}
