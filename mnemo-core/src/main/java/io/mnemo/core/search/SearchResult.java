package io.mnemo.core.search;

import io.mnemo.core.store.KnowledgeEntry;
import java.util.Set;

/**
 * A ranked entry with the parts of its score.
 *
 * @param rrfScore    summed reciprocal-rank score over the passes that returned the entry
 * @param finalScore  {@code rrfScore * typeWeight * accessBoost}
 */
public record SearchResult(
    KnowledgeEntry entry,
    double rrfScore,
    double typeWeight,
    double accessBoost,
    double finalScore,
    Set<SearchSource> sources
) {

    public SearchResult {
        sources = Set.copyOf(sources);
    }

    public long id() {
        return entry.id();
    }
}
