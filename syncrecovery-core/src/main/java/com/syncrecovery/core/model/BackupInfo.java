package com.syncrecovery.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Metadata of a backup snapshot owned by the backup manager.
 */
public record BackupInfo(
    String id,
    Instant timestamp,
    BackupType type,
    long size,
    String location,
    String checksum,
    List<String> tables,
    boolean compressed,
    boolean encrypted
) {
    public BackupInfo {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    /**
     * Check if this backup covers the table. An empty table list means all tables.
     */
    public boolean covers(String table) {
        return tables.isEmpty() || tables.contains(table);
    }
}
