package io.mnemo.core.store;

/**
 * Partial update; {@code null} fields are left untouched. {@code embedding} exists so that a
 * caller attempting to replace a stored vector gets an explicit rejection instead of a silent no-op.
 */
public record KnowledgeUpdate(
    String content,
    String type,
    TtlCategory ttlCategory,
    KnowledgeMetadata metadata,
    float[] embedding
) {

    public static KnowledgeUpdate content(String content) {
        return new KnowledgeUpdate(content, null, null, null, null);
    }

    public static KnowledgeUpdate type(String type) {
        return new KnowledgeUpdate(null, type, null, null, null);
    }

    public static KnowledgeUpdate ttlCategory(TtlCategory ttlCategory) {
        return new KnowledgeUpdate(null, null, ttlCategory, null, null);
    }

    public static KnowledgeUpdate metadata(KnowledgeMetadata metadata) {
        return new KnowledgeUpdate(null, null, null, metadata, null);
    }

    public static KnowledgeUpdate embedding(float[] embedding) {
        return new KnowledgeUpdate(null, null, null, null, embedding);
    }

    public KnowledgeUpdate withMetadata(KnowledgeMetadata value) {
        return new KnowledgeUpdate(content, type, ttlCategory, value, embedding);
    }

    public boolean isEmpty() {
        return content == null && type == null && ttlCategory == null && metadata == null && embedding == null;
    }
}
