package com.syncrecovery.core.model;

public enum ReplayEventStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
