package io.mnemo.core.lifecycle;

import io.mnemo.core.store.TtlCategory;
import java.time.Duration;
import java.time.Instant;

/**
 * How long an entry has gone unread relative to its retention horizon.
 *
 * @param score   0 for an entry read just now, approaching 1 as idle time grows past the horizon
 * @param idle    time since the last read, or since creation for entries never read
 * @param horizon retention window the score is measured against
 */
public record StalenessReport(
    long id,
    double score,
    Duration idle,
    Duration horizon,
    TtlCategory ttlCategory,
    int accessCount,
    Instant lastAccessed,
    Instant expiresAt,
    boolean expired
) {
}
