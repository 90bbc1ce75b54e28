package io.mnemo.core.store;

import java.time.Instant;

/**
 * Outcome of a write. Writes report failures through this type rather than throwing, so callers
 * can fall back.
 */
public record WriteResult(
    boolean success,
    long id,
    String contentHash,
    Instant expiresAt,
    StoreError error,
    String message
) {

    public static WriteResult inserted(long id, String contentHash, Instant expiresAt) {
        return new WriteResult(true, id, contentHash, expiresAt, null, null);
    }

    public static WriteResult ok(long id) {
        return new WriteResult(true, id, null, null, null, null);
    }

    public static WriteResult ok(long id, String contentHash, Instant expiresAt) {
        return new WriteResult(true, id, contentHash, expiresAt, null, null);
    }

    public static WriteResult failure(StoreError error, String message) {
        return new WriteResult(false, -1L, null, null, error, message);
    }

    public static WriteResult notFound(long id) {
        return failure(StoreError.NOT_FOUND, "No knowledge entry with id " + id);
    }

    public boolean hasError(StoreError expected) {
        return !success && error == expected;
    }
}
