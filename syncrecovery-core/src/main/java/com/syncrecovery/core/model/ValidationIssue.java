package com.syncrecovery.core.model;

/**
 * Problem found by a replay pre-flight or post-run validation.
 */
public record ValidationIssue(String type, Level severity, String message) {

    public enum Level { WARNING, ERROR }

    public static ValidationIssue warning(String type, String message) {
        return new ValidationIssue(type, Level.WARNING, message);
    }

    public static ValidationIssue error(String type, String message) {
        return new ValidationIssue(type, Level.ERROR, message);
    }

    public boolean isError() {
        return severity == Level.ERROR;
    }
}
