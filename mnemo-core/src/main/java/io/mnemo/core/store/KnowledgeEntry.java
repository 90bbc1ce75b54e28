package io.mnemo.core.store;

import java.time.Instant;

public record KnowledgeEntry(
    long id,
    String content,
    String type,
    KnowledgeScope scope,
    Instant createdAt,
    Instant expiresAt,
    int accessCount,
    Instant lastAccessed,
    String contentHash,
    TtlCategory ttlCategory,
    String projectSlug,
    KnowledgeMetadata metadata
) {

    public KnowledgeEntry {
        metadata = metadata == null ? KnowledgeMetadata.empty() : metadata;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
