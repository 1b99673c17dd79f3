package com.syncrecovery.engine.replay;

import com.syncrecovery.core.model.ValidationIssue;

import java.util.List;

/**
 * Pre-flight check of a replay session. Warnings never block execution.
 */
public record ReplayValidation(List<ValidationIssue> issues) {

    public ReplayValidation {
        issues = List.copyOf(issues);
    }

    public boolean isValid() {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    public boolean hasIssue(String type) {
        return issues.stream().anyMatch(issue -> issue.type().equals(type));
    }
}
