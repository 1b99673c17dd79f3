package com.syncrecovery.core.model;

/**
 * How the events of a session are ordered and grouped.
 */
public enum ReplayStrategy {
    SEQUENTIAL,
    PARALLEL,
    DEPENDENCY_AWARE,
    SELECTIVE
}
