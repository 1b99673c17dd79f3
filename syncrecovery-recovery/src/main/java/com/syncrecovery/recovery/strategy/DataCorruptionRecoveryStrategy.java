package com.syncrecovery.recovery.strategy;

import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.RecoveryAction;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.recovery.spi.RecoveryStepException;

import java.util.List;
import java.util.Map;

/**
 * Restores the operation's table from the most recent backup.
 *
 * The backup checksum is verified before the restore and the restored
 * data is validated after it. Without a backup nothing is touched.
 */
public class DataCorruptionRecoveryStrategy extends AbstractRecoveryStrategy {

    public DataCorruptionRecoveryStrategy(RecoveryCollaborators collaborators) {
        super(BuiltInStrategy.DATA_CORRUPTION_RECOVERY, collaborators);
    }

    @Override
    protected RecoveryResult attempt(RecoveryContext context) throws RecoveryStepException {
        if (context.backupInfo() == null) {
            return failure(context, RecoveryAction.MANUAL_INTERVENTION,
                "No backup available for recovery", RecoveryAction.ESCALATE);
        }

        BackupInfo backup = context.backupInfo();
        String table = context.operation().tableName();

        if (!collaborators.backupManager().verifyBackup(backup.id())) {
            throw new RecoveryStepException("BACKUP_INVALID", "Backup integrity check failed for " + backup.id());
        }
        if (!collaborators.backupManager().restoreFromBackup(backup.id(), List.of(table))) {
            throw new RecoveryStepException("RESTORE_FAILED", "Restore of backup " + backup.id() + " failed");
        }
        require(collaborators.executor(), "SyncOperationExecutor").validate(context.operation());

        return success(RecoveryAction.RESTORE_FROM_BACKUP, Map.of(
            "backupId", backup.id(),
            "backupTimestamp", backup.timestamp().toString(),
            "tablesRestored", List.of(table)
        ));
    }

    @Override
    protected RecoveryAction failedAction() {
        return RecoveryAction.RESTORE_FROM_BACKUP;
    }

    @Override
    protected RecoveryAction nextActionOnFailure(RecoveryContext context) {
        return RecoveryAction.MANUAL_INTERVENTION;
    }
}
