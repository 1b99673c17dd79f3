package com.syncrecovery.engine.changelog;

/**
 * Output formats supported by the change log export.
 */
public enum ExportFormat {
    JSON,
    CSV,
    SQL
}
