package io.mnemo.core.search;

import io.mnemo.core.store.KnowledgeScope;
import java.util.List;

/**
 * Search request. Either {@code query} or {@code embedding} may be absent; with both absent the
 * search returns nothing.
 *
 * @param limit       maximum results; {@code 0} uses the configured default
 * @param scope       restrict to one scope, or {@code null}
 * @param types       restrict to these types; empty means any
 * @param projectSlug restrict to one project, or {@code null}
 */
public record SearchOptions(
    String query,
    float[] embedding,
    int limit,
    KnowledgeScope scope,
    List<String> types,
    String projectSlug
) {

    public SearchOptions {
        limit = Math.max(0, limit);
        types = types == null ? List.of() : List.copyOf(types);
        projectSlug = projectSlug == null || projectSlug.isBlank() ? null : projectSlug;
    }

    public static SearchOptions query(String query) {
        return new SearchOptions(query, null, 0, null, List.of(), null);
    }

    public SearchOptions withQuery(String value) {
        return new SearchOptions(value, embedding, limit, scope, types, projectSlug);
    }

    public SearchOptions withEmbedding(float[] value) {
        return new SearchOptions(query, value, limit, scope, types, projectSlug);
    }

    public SearchOptions withLimit(int value) {
        return new SearchOptions(query, embedding, value, scope, types, projectSlug);
    }

    public SearchOptions withScope(KnowledgeScope value) {
        return new SearchOptions(query, embedding, limit, value, types, projectSlug);
    }

    public SearchOptions withTypes(List<String> value) {
        return new SearchOptions(query, embedding, limit, scope, value, projectSlug);
    }

    public SearchOptions withProjectSlug(String value) {
        return new SearchOptions(query, embedding, limit, scope, types, value);
    }

    public boolean hasFilters() {
        return scope != null || !types.isEmpty() || projectSlug != null;
    }
}
