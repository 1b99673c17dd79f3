package com.syncrecovery.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Named reference to a backup plus the operations it guards.
 *
 * Invariants:
 * - an expired rollback point is never applied
 * - ownerSessionId is set only for replay checkpoints
 */
public record RollbackPoint(
    String id,
    Instant createdAt,
    String description,
    String backupId,
    List<String> operationIds,
    String ownerSessionId,
    Instant expiresAt
) {
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    public RollbackPoint {
        operationIds = operationIds == null ? List.of() : List.copyOf(operationIds);
    }

    /**
     * Create a new rollback point for a backup.
     */
    public static RollbackPoint create(String description, String backupId, List<String> operationIds,
                                       String ownerSessionId, Instant now, Duration ttl) {
        return new RollbackPoint(
            "rb_" + now.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8),
            now,
            description,
            backupId,
            operationIds,
            ownerSessionId,
            ttl == null ? null : now.plus(ttl)
        );
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isOwnedBy(String sessionId) {
        return ownerSessionId != null && ownerSessionId.equals(sessionId);
    }
}
