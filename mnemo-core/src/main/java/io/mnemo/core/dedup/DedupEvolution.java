package io.mnemo.core.dedup;

import io.mnemo.core.config.model.DedupConfig;
import io.mnemo.core.store.ContentHash;
import io.mnemo.core.store.KnowledgeDatabase;
import io.mnemo.core.store.KnowledgeEntry;
import io.mnemo.core.store.KnowledgeMetadata;
import io.mnemo.core.store.KnowledgeUpdate;
import io.mnemo.core.store.NewKnowledge;
import io.mnemo.core.store.RecordStore;
import io.mnemo.core.store.SqlErrors;
import io.mnemo.core.store.WriteResult;
import io.mnemo.core.vector.EmbeddingProvider;
import io.mnemo.core.vector.Embeddings;
import io.mnemo.core.vector.VectorHit;
import io.mnemo.core.vector.VectorIndex;
import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes new knowledge through a three-stage duplicate cascade (exact hash, canonical hash,
 * embedding similarity) and then skips, evolves an existing entry, or creates a new one.
 *
 * <p>Submitting the same content twice never creates a second entry: the second submission
 * matches the first by hash, or, after an evolution, by the canonical hash stamped on merge.</p>
 */
public final class DedupEvolution {
    private static final Logger LOG = LoggerFactory.getLogger(DedupEvolution.class);
    private static final int ERROR_PREVIEW_LENGTH = 50;

    private final RecordStore store;
    private final DedupConfig config;
    private final EvolutionMerger merger;
    private final Clock clock;

    public DedupEvolution(RecordStore store, DedupConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = config == null ? DedupConfig.defaults() : config;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.merger = new EvolutionMerger(this.config.historyLimit());
    }

    /**
     * Runs the cascade without writing anything. Expired entries never match.
     */
    public DuplicateCheck check(String content, float[] embedding) throws SQLException {
        String canonicalHash = ContentCanonicalizer.canonicalHash(content);
        Instant now = clock.instant();

        Optional<KnowledgeEntry> exact = store.getByHash(ContentHash.sha256(content));
        if (exact.isPresent()) {
            return new DuplicateCheck(DedupStage.HASH, exact.get().id(), 1.0, canonicalHash);
        }

        Optional<KnowledgeEntry> canonical = store.getByCanonicalHash(canonicalHash);
        if (canonical.isPresent()) {
            return new DuplicateCheck(DedupStage.CANONICAL, canonical.get().id(), config.canonicalSimilarity(), canonicalHash);
        }

        return nearestNeighbour(embedding, canonicalHash, now);
    }

    /**
     * Applies the duplicate policy to {@code entry}: above the duplicate threshold it is skipped,
     * between the evolve and duplicate thresholds it is merged into the match, otherwise it is
     * inserted with its canonical hash stamped into metadata.
     */
    public IngestResult insertOrEvolve(NewKnowledge entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        DuplicateCheck check;
        try {
            check = check(entry.content(), entry.embedding());
        } catch (SQLException e) {
            LOG.warn("Duplicate check failed: {}", e.getMessage());
            return IngestResult.failed(SqlErrors.classify(e), e.getMessage());
        }

        if (check.isMatch() && check.similarity() > config.duplicateThreshold()) {
            LOG.debug("Skipping duplicate of entry {} ({}, similarity {})", check.existingId(), check.stage().value(), check.similarity());
            return IngestResult.skipped(check.existingId(), check.stage(), check.similarity());
        }
        if (check.isMatch() && check.similarity() >= config.evolveThreshold()) {
            Optional<IngestResult> evolved = evolve(check, entry.content());
            if (evolved.isPresent()) {
                return evolved.get();
            }
        }
        return create(entry, check);
    }

    /**
     * Ingests each entry independently. Entries without an embedding get one from {@code provider}
     * when it is given; a provider failure is recorded as an error for that entry only.
     */
    public BatchResult processBatch(List<NewKnowledge> entries, EmbeddingProvider provider) {
        int created = 0;
        int evolved = 0;
        int skipped = 0;
        List<BatchResult.BatchError> errors = new ArrayList<>();
        if (entries == null) {
            return new BatchResult(0, 0, 0, errors);
        }
        for (NewKnowledge entry : entries) {
            NewKnowledge prepared = entry;
            if (entry.embedding() == null && provider != null) {
                try {
                    prepared = entry.withEmbedding(provider.embed(entry.content()));
                } catch (IOException | RuntimeException e) {
                    LOG.warn("Embedding failed for batch entry: {}", e.getMessage());
                    errors.add(new BatchResult.BatchError(preview(entry.content()), "embedding failed: " + e.getMessage()));
                    continue;
                }
            }
            IngestResult result = insertOrEvolve(prepared);
            switch (result.action()) {
                case CREATED -> created++;
                case EVOLVED -> evolved++;
                case SKIPPED -> skipped++;
                case FAILED -> errors.add(new BatchResult.BatchError(preview(entry.content()), result.reason()));
            }
        }
        LOG.info("Processed knowledge batch: created={} evolved={} skipped={} errors={}", created, evolved, skipped, errors.size());
        return new BatchResult(created, evolved, skipped, errors);
    }

    private DuplicateCheck nearestNeighbour(float[] embedding, String canonicalHash, Instant now) throws SQLException {
        KnowledgeDatabase database = store.database();
        Optional<VectorIndex> index = database.vectorIndex();
        if (embedding == null || index.isEmpty() || embedding.length != index.get().dimension()) {
            return DuplicateCheck.none(canonicalHash);
        }
        float[] query = Embeddings.normalize(embedding);
        List<VectorHit> hits;
        try {
            hits = database.read(connection -> index.get().nearest(connection, query, config.neighborCount()));
        } catch (RuntimeException e) {
            LOG.warn("Similarity check skipped, vector index failed: {}", e.toString());
            return DuplicateCheck.none(canonicalHash);
        }
        if (hits.isEmpty()) {
            return DuplicateCheck.none(canonicalHash);
        }
        Map<Long, KnowledgeEntry> entries = store.getAll(hits.stream().map(VectorHit::id).toList());
        VectorHit best = null;
        for (VectorHit hit : hits) {
            KnowledgeEntry candidate = entries.get(hit.id());
            if (candidate == null || candidate.isExpired(now)) {
                continue;
            }
            if (best == null || hit.similarity() > best.similarity()) {
                best = hit;
            }
        }
        if (best == null || best.similarity() <= 0.0) {
            return DuplicateCheck.none(canonicalHash);
        }
        return new DuplicateCheck(DedupStage.EMBEDDING, best.id(), best.similarity(), canonicalHash);
    }

    private Optional<IngestResult> evolve(DuplicateCheck check, String newContent) {
        Optional<KnowledgeEntry> existing;
        try {
            existing = store.get(check.existingId());
        } catch (SQLException e) {
            return Optional.of(IngestResult.failed(SqlErrors.classify(e), e.getMessage()));
        }
        if (existing.isEmpty()) {
            // removed between the check and now
            return Optional.empty();
        }

        EvolutionMerger.Merged merged = merger.merge(existing.get(), newContent, check.similarity(), clock.instant());
        KnowledgeMetadata metadata = merged.metadata().with(KnowledgeMetadata.CANONICAL_HASH, check.canonicalHash());
        WriteResult written = store.update(
            check.existingId(),
            new KnowledgeUpdate(merged.content(), null, null, metadata, null)
        );
        if (!written.success()) {
            return Optional.of(IngestResult.failed(written.error(), written.message()));
        }
        LOG.debug("Evolved entry {} (similarity {}, evolution {})", check.existingId(), check.similarity(), merged.evolutionCount());
        return Optional.of(IngestResult.evolved(check.existingId(), check.stage(), check.similarity(), merged.evolutionCount()));
    }

    private IngestResult create(NewKnowledge entry, DuplicateCheck check) {
        NewKnowledge stamped = entry.withMetadata(
            entry.metadata().with(KnowledgeMetadata.CANONICAL_HASH, check.canonicalHash())
        );
        WriteResult written = store.insert(stamped);
        if (!written.success()) {
            return IngestResult.failed(written.error(), written.message());
        }
        return IngestResult.created(written.id(), check.similarity());
    }

    private static String preview(String content) {
        return content.length() <= ERROR_PREVIEW_LENGTH ? content : content.substring(0, ERROR_PREVIEW_LENGTH);
    }
}
