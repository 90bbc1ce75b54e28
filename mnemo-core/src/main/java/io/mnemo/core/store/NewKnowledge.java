package io.mnemo.core.store;

/**
 * Insert request.
 *
 * @param ttlCategory explicit retention; {@code null} uses the type's default
 * @param embedding   raw embedding, normalized before it is stored; {@code null} for keyword-only entries
 */
public record NewKnowledge(
    String content,
    String type,
    KnowledgeScope scope,
    TtlCategory ttlCategory,
    float[] embedding,
    KnowledgeMetadata metadata
) {

    public NewKnowledge {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        type = type.trim();
        scope = scope == null ? KnowledgeScope.PROJECT : scope;
        metadata = metadata == null ? KnowledgeMetadata.empty() : metadata;
    }

    public NewKnowledge(String content, String type, KnowledgeScope scope) {
        this(content, type, scope, null, null, KnowledgeMetadata.empty());
    }

    public TtlCategory effectiveTtl() {
        return ttlCategory == null ? TtlCategory.defaultFor(type) : ttlCategory;
    }

    public NewKnowledge withEmbedding(float[] value) {
        return new NewKnowledge(content, type, scope, ttlCategory, value, metadata);
    }

    public NewKnowledge withMetadata(KnowledgeMetadata value) {
        return new NewKnowledge(content, type, scope, ttlCategory, embedding, value);
    }

    public NewKnowledge withTtlCategory(TtlCategory value) {
        return new NewKnowledge(content, type, scope, value, embedding, metadata);
    }
}
