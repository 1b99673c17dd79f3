package com.syncrecovery.recovery.events;

import com.syncrecovery.core.model.BackupInfo;
import com.syncrecovery.core.model.FailureClassification;
import com.syncrecovery.core.model.RecoveryContext;
import com.syncrecovery.core.model.RecoveryResult;
import com.syncrecovery.core.model.RollbackPoint;

/**
 * Callbacks for notification layers. Called on the event bus thread,
 * never on the thread running the recovery.
 */
public interface RecoveryObserver {

    default void onFailureDetected(FailureClassification classification) {
    }

    default void onRecoveryStarted(RecoveryContext context) {
    }

    default void onRecoveryCompleted(RecoveryResult result) {
    }

    default void onRollbackPointCreated(RollbackPoint rollbackPoint) {
    }

    default void onBackupCreated(BackupInfo backup) {
    }
}
