package io.mnemo.core.search;

import io.mnemo.core.config.model.SearchConfig;
import io.mnemo.core.store.EntryRows;
import io.mnemo.core.store.KnowledgeDatabase;
import io.mnemo.core.store.KnowledgeEntry;
import io.mnemo.core.store.RecordStore;
import io.mnemo.core.store.SqlErrors;
import io.mnemo.core.vector.Embeddings;
import io.mnemo.core.vector.VectorHit;
import io.mnemo.core.vector.VectorIndex;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hybrid search over one store: a full-text pass ranked by bm25 and a vector pass ranked by
 * similarity, fused with {@link RankFusion}. A pass that fails is logged and left out, so a locked
 * or vector-less store still answers from whatever pass succeeded.
 */
public final class SearchEngine {
    private static final Logger LOG = LoggerFactory.getLogger(SearchEngine.class);

    private final RecordStore store;
    private final SearchConfig config;
    private final RankFusion fusion;
    private final Clock clock;

    public SearchEngine(RecordStore store, SearchConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = config == null ? SearchConfig.defaults() : config;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.fusion = new RankFusion(this.config);
    }

    public List<SearchResult> search(SearchOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        int limit = options.limit() > 0 ? options.limit() : config.defaultLimit();
        int candidateLimit = limit * config.candidateMultiplier();
        Instant now = clock.instant();

        List<KnowledgeEntry> keyword = List.of();
        if (options.query() != null && !options.query().isBlank()) {
            try {
                keyword = keywordPass(options, candidateLimit, now);
            } catch (SQLException e) {
                LOG.warn("Degraded search: keyword pass failed ({}): {}", SqlErrors.classify(e).code(), e.getMessage());
            } catch (RuntimeException e) {
                LOG.warn("Degraded search: keyword pass failed: {}", e.toString());
            }
        }

        List<KnowledgeEntry> vector = List.of();
        if (options.embedding() != null && options.embedding().length > 0) {
            try {
                vector = vectorPass(options, candidateLimit, now);
            } catch (SQLException e) {
                LOG.warn("Degraded search: vector pass failed ({}), using keyword results only: {}",
                    SqlErrors.classify(e).code(), e.getMessage());
            } catch (RuntimeException e) {
                LOG.warn("Degraded search: vector pass failed, using keyword results only: {}", e.toString());
            }
        }

        return fusion.fuse(keyword, vector, limit);
    }

    /**
     * Full-text matches that pass every filter and have not expired, best bm25 first.
     */
    List<KnowledgeEntry> keywordPass(SearchOptions options, int candidateLimit, Instant now) throws SQLException {
        String match = FtsQuerySanitizer.sanitize(options.query());
        if (match.isEmpty()) {
            return List.of();
        }
        StringBuilder sql = new StringBuilder()
            .append("SELECT ").append(EntryRows.columns("k")).append(", bm25(knowledge_fts) AS bm25_score")
            .append(" FROM knowledge_fts JOIN knowledge k ON knowledge_fts.rowid = k.id")
            .append(" WHERE knowledge_fts MATCH ?");
        List<Object> parameters = new ArrayList<>();
        parameters.add(match);
        if (options.scope() != null) {
            sql.append(" AND k.scope = ?");
            parameters.add(options.scope().value());
        }
        if (!options.types().isEmpty()) {
            sql.append(" AND k.type IN (").append(String.join(", ", Collections.nCopies(options.types().size(), "?"))).append(")");
            parameters.addAll(options.types());
        }
        if (options.projectSlug() != null) {
            sql.append(" AND k.project_slug = ?");
            parameters.add(options.projectSlug());
        }
        sql.append(" AND (k.expires_at IS NULL OR k.expires_at > ?)");
        parameters.add(now.toEpochMilli());
        sql.append(" ORDER BY bm25_score, k.id LIMIT ?");
        parameters.add(candidateLimit);

        KnowledgeDatabase database = store.database();
        return database.read(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
                for (int i = 0; i < parameters.size(); i++) {
                    statement.setObject(i + 1, parameters.get(i));
                }
                List<KnowledgeEntry> entries = new ArrayList<>();
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        entries.add(EntryRows.map(resultSet));
                    }
                }
                return entries;
            }
        });
    }

    /**
     * Nearest neighbours of the query embedding. The index cannot filter, so it over-fetches and
     * the expiry check and filters run here.
     */
    List<KnowledgeEntry> vectorPass(SearchOptions options, int candidateLimit, Instant now) throws SQLException {
        KnowledgeDatabase database = store.database();
        Optional<VectorIndex> index = database.vectorIndex();
        if (index.isEmpty()) {
            return List.of();
        }
        if (options.embedding().length != index.get().dimension()) {
            throw new SQLException("Query embedding has " + options.embedding().length
                + " dimensions, store expects " + index.get().dimension());
        }
        float[] query = Embeddings.normalize(options.embedding());
        int fetch = candidateLimit * config.vectorOverFetch();
        List<VectorHit> hits = database.read(connection -> index.get().nearest(connection, query, fetch));
        if (hits.isEmpty()) {
            return List.of();
        }

        Map<Long, KnowledgeEntry> loaded = store.getAll(hits.stream().map(VectorHit::id).toList());
        List<KnowledgeEntry> entries = new ArrayList<>();
        for (VectorHit hit : hits) {
            KnowledgeEntry entry = loaded.get(hit.id());
            if (entry != null && matches(entry, options, now)) {
                entries.add(entry);
                if (entries.size() == candidateLimit) {
                    break;
                }
            }
        }
        return entries;
    }

    private static boolean matches(KnowledgeEntry entry, SearchOptions options, Instant now) {
        if (entry.isExpired(now)) {
            return false;
        }
        if (options.scope() != null && entry.scope() != options.scope()) {
            return false;
        }
        if (!options.types().isEmpty() && !options.types().contains(entry.type())) {
            return false;
        }
        return options.projectSlug() == null || options.projectSlug().equals(entry.projectSlug());
    }
}
