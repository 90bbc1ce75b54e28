package io.mnemo.core.api;

import io.mnemo.core.dedup.BatchResult;
import io.mnemo.core.dedup.DedupEvolution;
import io.mnemo.core.dedup.IngestResult;
import io.mnemo.core.lifecycle.AccessStats;
import io.mnemo.core.lifecycle.CleanupResult;
import io.mnemo.core.lifecycle.LifecycleManager;
import io.mnemo.core.lifecycle.StalenessReport;
import io.mnemo.core.search.SearchEngine;
import io.mnemo.core.search.SearchOptions;
import io.mnemo.core.search.SearchResult;
import io.mnemo.core.store.Availability;
import io.mnemo.core.store.KnowledgeDatabase;
import io.mnemo.core.store.KnowledgeEntry;
import io.mnemo.core.store.KnowledgeScope;
import io.mnemo.core.store.KnowledgeUpdate;
import io.mnemo.core.store.NewKnowledge;
import io.mnemo.core.store.RecordStore;
import io.mnemo.core.store.StoreError;
import io.mnemo.core.store.StoreManager;
import io.mnemo.core.store.WriteResult;
import io.mnemo.core.vector.EmbeddingProvider;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for consumers. No operation throws on a missing, disabled or failing store: reads
 * come back empty and writes come back skipped or failed with a reason.
 */
public final class KnowledgeService {
    private static final Logger LOG = LoggerFactory.getLogger(KnowledgeService.class);
    private static final String DISABLED = "disabled in config";

    private final StoreManager stores;
    private final EmbeddingProvider embeddingProvider;
    private final Clock clock;

    public KnowledgeService(StoreManager stores) {
        this(stores, null);
    }

    /**
     * @param embeddingProvider fills in embeddings for ingested entries and search queries that have
     *                          none; may be {@code null}
     */
    public KnowledgeService(StoreManager stores, EmbeddingProvider embeddingProvider) {
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.embeddingProvider = embeddingProvider;
        this.clock = stores.clock();
    }

    public Availability isAvailable(KnowledgeScope scope) {
        return stores.isAvailable(scope == null ? KnowledgeScope.PROJECT : scope);
    }

    public Readiness isReady(KnowledgeScope scope) {
        if (!stores.config().enabled()) {
            return new Readiness(false, DISABLED);
        }
        Availability availability = isAvailable(scope);
        return new Readiness(availability.available(), availability.available() ? null : availability.reason());
    }

    /**
     * Stores {@code entry} as given, without duplicate detection.
     */
    public AddResult add(NewKnowledge entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        Backend backend = backend(entry.scope());
        if (backend.unavailable()) {
            return AddResult.skipped(StoreError.UNAVAILABLE, backend.reason());
        }
        WriteResult result = backend.records().insert(entry);
        return result.success() ? AddResult.added(result) : AddResult.skipped(result.error(), result.message());
    }

    /**
     * Stores {@code entry} through the duplicate cascade, skipping or merging near-duplicates.
     */
    public IngestResult ingest(NewKnowledge entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        Backend backend = backend(entry.scope());
        if (backend.unavailable()) {
            return IngestResult.failed(StoreError.UNAVAILABLE, backend.reason());
        }
        return dedup(backend).insertOrEvolve(withEmbedding(entry));
    }

    /**
     * Ingests a batch, grouping entries by scope. Entries without an embedding get one from the
     * configured provider.
     */
    public BatchResult ingestBatch(List<NewKnowledge> entries) {
        if (entries == null || entries.isEmpty()) {
            return new BatchResult(0, 0, 0, List.of());
        }
        Map<KnowledgeScope, List<NewKnowledge>> byScope = new EnumMap<>(KnowledgeScope.class);
        for (NewKnowledge entry : entries) {
            byScope.computeIfAbsent(entry.scope(), scope -> new ArrayList<>()).add(entry);
        }
        int created = 0;
        int evolved = 0;
        int skipped = 0;
        List<BatchResult.BatchError> errors = new ArrayList<>();
        for (Map.Entry<KnowledgeScope, List<NewKnowledge>> group : byScope.entrySet()) {
            Backend backend = backend(group.getKey());
            if (backend.unavailable()) {
                for (NewKnowledge entry : group.getValue()) {
                    errors.add(new BatchResult.BatchError(entry.content(), backend.reason()));
                }
                continue;
            }
            BatchResult result = dedup(backend).processBatch(group.getValue(), embeddingProvider);
            created += result.created();
            evolved += result.evolved();
            skipped += result.skipped();
            errors.addAll(result.errors());
        }
        return new BatchResult(created, evolved, skipped, errors);
    }

    /**
     * Hybrid search in {@code options.scope()} (project when unset). Returned entries count as read.
     */
    public List<SearchResult> search(String query, SearchOptions options) {
        SearchOptions effective = (options == null ? SearchOptions.query(query) : options.withQuery(query));
        KnowledgeScope scope = effective.scope() == null ? KnowledgeScope.PROJECT : effective.scope();
        Backend backend = backend(scope);
        if (backend.unavailable()) {
            return List.of();
        }
        if (effective.embedding() == null) {
            effective = effective.withEmbedding(embedQuery(query));
        }
        SearchEngine engine = new SearchEngine(backend.records(), stores.config().search(), clock);
        List<SearchResult> results = engine.search(effective);
        if (!results.isEmpty()) {
            try {
                backend.lifecycle().trackAccessBatch(results.stream().map(SearchResult::id).toList());
            } catch (SQLException e) {
                LOG.warn("Could not record access for {} search results: {}", results.size(), e.getMessage());
            }
        }
        return results;
    }

    /**
     * Reads one entry and counts the read.
     */
    public Optional<KnowledgeEntry> get(long id, KnowledgeScope scope) {
        Backend backend = backend(scope);
        if (backend.unavailable()) {
            return Optional.empty();
        }
        try {
            Optional<KnowledgeEntry> entry = backend.records().get(id);
            if (entry.isPresent()) {
                backend.lifecycle().trackAccess(id);
            }
            return entry;
        } catch (SQLException e) {
            LOG.warn("Could not read knowledge entry {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    public WriteResult update(long id, KnowledgeUpdate update, KnowledgeScope scope) {
        Backend backend = backend(scope);
        if (backend.unavailable()) {
            return WriteResult.failure(StoreError.UNAVAILABLE, backend.reason());
        }
        return backend.records().update(id, update);
    }

    public WriteResult delete(long id, KnowledgeScope scope) {
        Backend backend = backend(scope);
        if (backend.unavailable()) {
            return WriteResult.failure(StoreError.UNAVAILABLE, backend.reason());
        }
        return backend.records().delete(id);
    }

    public List<KnowledgeEntry> getByType(String type, KnowledgeScope scope, int limit) {
        Backend backend = backend(scope);
        if (backend.unavailable()) {
            return List.of();
        }
        try {
            return backend.records().getByType(type, null, limit);
        } catch (SQLException e) {
            LOG.warn("Could not list knowledge of type {}: {}", type, e.getMessage());
            return List.of();
        }
    }

    public CleanupResult cleanup(KnowledgeScope scope) {
        Backend backend = backend(scope);
        if (backend.unavailable()) {
            return CleanupResult.none();
        }
        try {
            return backend.lifecycle().cleanupExpired();
        } catch (SQLException e) {
            LOG.warn("Expiry cleanup failed: {}", e.getMessage());
            return CleanupResult.none();
        }
    }

    public Optional<StalenessReport> staleness(long id, KnowledgeScope scope) {
        Backend backend = backend(scope);
        if (backend.unavailable()) {
            return Optional.empty();
        }
        try {
            return backend.lifecycle().getStalenessScore(id);
        } catch (SQLException e) {
            LOG.warn("Could not score staleness of entry {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @param type restrict to one type, or {@code null} for every type
     */
    public List<AccessStats> stats(KnowledgeScope scope, String type) {
        Backend backend = backend(scope);
        if (backend.unavailable()) {
            return List.of();
        }
        try {
            return backend.lifecycle().getAccessStats(null, type);
        } catch (SQLException e) {
            LOG.warn("Could not compute access stats: {}", e.getMessage());
            return List.of();
        }
    }

    private Backend backend(KnowledgeScope requested) {
        KnowledgeScope scope = requested == null ? KnowledgeScope.PROJECT : requested;
        if (!stores.config().enabled()) {
            return Backend.unavailable(DISABLED);
        }
        if (!stores.isOpen(scope)) {
            Availability availability = stores.isAvailable(scope);
            if (!availability.available()) {
                LOG.debug("Knowledge store {} unavailable: {}", scope.value(), availability.reason());
                return Backend.unavailable(availability.reason());
            }
        }
        try {
            KnowledgeDatabase database = stores.open(scope);
            return new Backend(new RecordStore(database, clock), new LifecycleManager(database, clock), null);
        } catch (IOException e) {
            LOG.warn("Knowledge store {} could not be opened: {}", scope.value(), e.getMessage());
            return Backend.unavailable(e.getMessage());
        }
    }

    private DedupEvolution dedup(Backend backend) {
        return new DedupEvolution(backend.records(), stores.config().dedup(), clock);
    }

    private NewKnowledge withEmbedding(NewKnowledge entry) {
        if (entry.embedding() != null || embeddingProvider == null) {
            return entry;
        }
        try {
            return entry.withEmbedding(embeddingProvider.embed(entry.content()));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Embedding failed, storing entry for keyword search only: {}", e.getMessage());
            return entry;
        }
    }

    private float[] embedQuery(String query) {
        if (embeddingProvider == null || query == null || query.isBlank()) {
            return null;
        }
        try {
            return embeddingProvider.embed(query);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Query embedding failed, searching by keyword only: {}", e.getMessage());
            return null;
        }
    }

    private record Backend(RecordStore records, LifecycleManager lifecycle, String reason) {

        static Backend unavailable(String reason) {
            return new Backend(null, null, reason == null ? "knowledge store unavailable" : reason);
        }

        boolean unavailable() {
            return records == null;
        }
    }
}
