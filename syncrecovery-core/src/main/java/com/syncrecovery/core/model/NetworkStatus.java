package com.syncrecovery.core.model;

public enum NetworkStatus {
    ONLINE,
    OFFLINE,
    DEGRADED
}
