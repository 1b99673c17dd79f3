package com.syncrecovery.core.model;

/**
 * Offset/limit page request.
 */
public record Pagination(int offset, int limit) {

    public Pagination {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be >= 0");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be >= 1");
        }
    }

    public static Pagination of(int offset, int limit) {
        return new Pagination(offset, limit);
    }
}
