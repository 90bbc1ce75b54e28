package io.mnemo.core.search;

import io.mnemo.core.config.model.SearchConfig;
import io.mnemo.core.store.KnowledgeEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reciprocal rank fusion of the keyword and vector passes, re-ranked by type weight and access count.
 */
public final class RankFusion {
    private static final Comparator<SearchResult> ORDER = Comparator
        .comparingDouble(SearchResult::finalScore).reversed()
        .thenComparingLong(SearchResult::id);

    private final SearchConfig config;

    public RankFusion(SearchConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Each pass contributes {@code 1 / (k + rank)} per entry, ranks starting at 1. Ties on the final
     * score are broken by id so repeated searches return the same order.
     *
     * @param keyword entries from the keyword pass, best first
     * @param vector  entries from the vector pass, best first
     */
    public List<SearchResult> fuse(List<KnowledgeEntry> keyword, List<KnowledgeEntry> vector, int limit) {
        Map<Long, Candidate> candidates = new LinkedHashMap<>();
        accumulate(candidates, keyword, SearchSource.KEYWORD);
        accumulate(candidates, vector, SearchSource.VECTOR);

        List<SearchResult> results = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates.values()) {
            double typeWeight = config.typeWeight(candidate.entry.type());
            double accessBoost = accessBoost(candidate.entry.accessCount());
            results.add(new SearchResult(
                candidate.entry,
                candidate.rrfScore,
                typeWeight,
                accessBoost,
                candidate.rrfScore * typeWeight * accessBoost,
                candidate.sources
            ));
        }
        results.sort(ORDER);
        return limit > 0 && results.size() > limit ? List.copyOf(results.subList(0, limit)) : List.copyOf(results);
    }

    public static double accessBoost(int accessCount) {
        return 1.0 + Math.log(1.0 + Math.max(0, accessCount));
    }

    private void accumulate(Map<Long, Candidate> candidates, List<KnowledgeEntry> ranked, SearchSource source) {
        if (ranked == null) {
            return;
        }
        int rank = 0;
        for (KnowledgeEntry entry : ranked) {
            rank++;
            double score = 1.0 / (config.rrfK() + rank);
            Candidate candidate = candidates.computeIfAbsent(entry.id(), id -> new Candidate(entry));
            candidate.rrfScore += score;
            candidate.sources.add(source);
        }
    }

    private static final class Candidate {
        private final KnowledgeEntry entry;
        private final Set<SearchSource> sources = EnumSet.noneOf(SearchSource.class);
        private double rrfScore;

        private Candidate(KnowledgeEntry entry) {
            this.entry = entry;
        }
    }
}
