package com.syncrecovery.core.model;

public enum BackupType {
    FULL,
    INCREMENTAL,
    SCHEMA_ONLY
}
