package com.syncrecovery.engine.backup;

import com.syncrecovery.core.model.BackupType;

import java.util.List;

/**
 * Captures and restores the state of synced tables for the in-memory backup manager.
 */
public interface BackupSnapshotSource {

    /**
     * Capture table state.
     * 
     * @param type Backup type
     * @param tables Tables to capture, empty for all
     * @return Opaque snapshot bytes
     */
    byte[] capture(BackupType type, List<String> tables);

    /**
     * Restore table state from a snapshot taken by {@link #capture}.
     */
    void restore(byte[] snapshot, List<String> tables);

    /**
     * Source that records nothing and restores nothing.
     */
    static BackupSnapshotSource noop() {
        return new BackupSnapshotSource() {
            @Override
            public byte[] capture(BackupType type, List<String> tables) {
                return new byte[0];
            }

            @Override
            public void restore(byte[] snapshot, List<String> tables) {
            }
        };
    }
}
