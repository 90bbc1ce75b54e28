package io.mnemo.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.mnemo.core.MutableClock;
import io.mnemo.core.TestStores;
import io.mnemo.core.config.model.SearchConfig;
import io.mnemo.core.lifecycle.LifecycleManager;
import io.mnemo.core.search.SearchEngine;
import io.mnemo.core.search.SearchOptions;
import io.mnemo.core.vector.BlobVectorIndex;
import io.mnemo.core.vector.VectorHit;
import io.mnemo.core.vector.VectorIndex;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecordStoreTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(NOW);
    private StoreManager stores;

    @AfterEach
    void closeStores() {
        if (stores != null) {
            stores.close();
        }
    }

    @Test
    void shouldRoundTripEntryWithMetadataAndEmbedding() throws Exception {
        RecordStore records = open();
        KnowledgeMetadata metadata = KnowledgeMetadata.of(Map.of(
            KnowledgeMetadata.SOURCE, "review",
            KnowledgeMetadata.PROJECT_SLUG, "alpha",
            KnowledgeMetadata.TAGS, List.of("db", "sqlite"),
            "custom", Map.of("nested", 1)
        ));
        NewKnowledge entry = new NewKnowledge(
            "Use WAL mode for concurrent readers",
            KnowledgeTypes.DECISION,
            KnowledgeScope.PROJECT,
            null,
            new float[] {3, 4, 0, 0},
            metadata
        );

        WriteResult result = records.insert(entry);
        KnowledgeEntry stored = records.get(result.id()).orElseThrow();

        assertThat(result.success()).isTrue();
        assertThat(result.contentHash()).isEqualTo(ContentHash.sha256("Use WAL mode for concurrent readers"));
        assertThat(stored.content()).isEqualTo(entry.content());
        assertThat(stored.type()).isEqualTo(KnowledgeTypes.DECISION);
        assertThat(stored.ttlCategory()).isEqualTo(TtlCategory.LONG_TERM);
        assertThat(stored.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(90)));
        assertThat(stored.projectSlug()).isEqualTo("alpha");
        assertThat(stored.metadata()).isEqualTo(metadata);
        assertThat(stored.metadata().tags()).containsExactly("db", "sqlite");
        assertThat(stored.accessCount()).isZero();

        float[] embedding = records.getEmbedding(result.id()).orElseThrow();
        assertThat(embedding[0]).isCloseTo(0.6f, within(1e-6f));
        assertThat(embedding[1]).isCloseTo(0.8f, within(1e-6f));
    }

    @Test
    void shouldDeriveExpiryFromTypeOrOverride() throws Exception {
        RecordStore records = open();

        KnowledgeEntry note = insertAndGet(records, new NewKnowledge("scratch", KnowledgeTypes.TEMP_NOTE, KnowledgeScope.PROJECT));
        KnowledgeEntry lesson = insertAndGet(records, new NewKnowledge("lesson", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT));
        KnowledgeEntry custom = insertAndGet(records, new NewKnowledge("custom", "observation", KnowledgeScope.PROJECT));
        KnowledgeEntry pinned = insertAndGet(records, new NewKnowledge("pinned", KnowledgeTypes.TEMP_NOTE, KnowledgeScope.PROJECT)
            .withTtlCategory(TtlCategory.PERMANENT));

        assertThat(note.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(24)));
        assertThat(lesson.expiresAt()).isNull();
        assertThat(custom.ttlCategory()).isEqualTo(TtlCategory.SHORT_TERM);
        assertThat(custom.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
        assertThat(pinned.expiresAt()).isNull();
    }

    @Test
    void shouldRejectEmbeddingWithWrongDimension() throws Exception {
        RecordStore records = open();

        WriteResult result = records.insert(new NewKnowledge("short vector", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)
            .withEmbedding(new float[] {1, 0}));

        assertThat(result.hasError(StoreError.INVALID_ARGUMENT)).isTrue();
        assertThat(records.count()).isZero();
    }

    @Test
    void shouldUpdateContentAndRehash() throws Exception {
        RecordStore records = open();
        long id = records.insert(new NewKnowledge("first version", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)).id();

        WriteResult result = records.update(id, KnowledgeUpdate.content("second version"));

        KnowledgeEntry updated = records.get(id).orElseThrow();
        assertThat(result.success()).isTrue();
        assertThat(updated.content()).isEqualTo("second version");
        assertThat(updated.contentHash()).isEqualTo(ContentHash.sha256("second version"));
        assertThat(records.getByHash(ContentHash.sha256("first version"))).isEmpty();
    }

    @Test
    void shouldReExpireOnTypeChangeWhenCategoryWasDefault() throws Exception {
        RecordStore records = open();
        long id = records.insert(new NewKnowledge("note that matters", KnowledgeTypes.TEMP_NOTE, KnowledgeScope.PROJECT)).id();
        clock.advance(Duration.ofHours(1));

        records.update(id, KnowledgeUpdate.type(KnowledgeTypes.DECISION));

        KnowledgeEntry updated = records.get(id).orElseThrow();
        assertThat(updated.type()).isEqualTo(KnowledgeTypes.DECISION);
        assertThat(updated.ttlCategory()).isEqualTo(TtlCategory.LONG_TERM);
        assertThat(updated.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)).plus(Duration.ofDays(90)));
    }

    @Test
    void shouldKeepExplicitCategoryOnTypeChange() throws Exception {
        RecordStore records = open();
        long id = records.insert(new NewKnowledge("pinned note", KnowledgeTypes.TEMP_NOTE, KnowledgeScope.PROJECT)
            .withTtlCategory(TtlCategory.PERMANENT)).id();

        records.update(id, KnowledgeUpdate.type(KnowledgeTypes.SUMMARY));

        KnowledgeEntry updated = records.get(id).orElseThrow();
        assertThat(updated.ttlCategory()).isEqualTo(TtlCategory.PERMANENT);
        assertThat(updated.expiresAt()).isNull();
    }

    @Test
    void shouldRejectEmbeddingUpdate() throws Exception {
        RecordStore records = open();
        long id = records.insert(new NewKnowledge("fixed vector", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)
            .withEmbedding(new float[] {1, 0, 0, 0})).id();

        WriteResult result = records.update(id, KnowledgeUpdate.embedding(new float[] {0, 1, 0, 0}));

        assertThat(result.hasError(StoreError.UNSUPPORTED_OPERATION)).isTrue();
        assertThat(records.getEmbedding(id).orElseThrow()[0]).isEqualTo(1.0f);
    }

    @Test
    void shouldReportMissingEntryOnUpdateAndDelete() throws Exception {
        RecordStore records = open();

        assertThat(records.update(42, KnowledgeUpdate.content("x")).hasError(StoreError.NOT_FOUND)).isTrue();
        assertThat(records.delete(42).hasError(StoreError.NOT_FOUND)).isTrue();
        assertThat(records.refreshTtl(42, null).hasError(StoreError.NOT_FOUND)).isTrue();
    }

    @Test
    void shouldDeleteRecordAndVectorTogether() throws Exception {
        RecordStore records = open();
        long id = records.insert(new NewKnowledge("to delete", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)
            .withEmbedding(new float[] {0, 0, 1, 0})).id();

        WriteResult result = records.delete(id);

        assertThat(result.success()).isTrue();
        assertThat(records.get(id)).isEmpty();
        assertThat(records.getEmbedding(id)).isEmpty();
    }

    @Test
    void shouldRollBackInsertWhenVectorIdentityDiffers() throws Exception {
        stores = TestStores.manager(tempDir, clock, (connection, config) -> {
            VectorIndex index = new ShiftedIndex(new BlobVectorIndex(config.dimension()));
            try {
                index.initialize(connection);
            } catch (SQLException e) {
                throw new IllegalStateException(e);
            }
            return Optional.of(index);
        });
        RecordStore records = new RecordStore(stores.open(KnowledgeScope.PROJECT), clock);

        WriteResult result = records.insert(new NewKnowledge("mismatched", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)
            .withEmbedding(new float[] {1, 0, 0, 0}));

        assertThat(result.hasError(StoreError.IDENTITY_MISMATCH)).isTrue();
        assertThat(records.count()).isZero();
    }

    @Test
    void shouldRefreshExpiryFromNow() throws Exception {
        RecordStore records = open();
        long id = records.insert(new NewKnowledge("summary", KnowledgeTypes.SUMMARY, KnowledgeScope.PROJECT)).id();
        clock.advance(Duration.ofDays(3));

        WriteResult refreshed = records.refreshTtl(id, null);
        WriteResult promoted = records.refreshTtl(id, TtlCategory.LONG_TERM);

        assertThat(refreshed.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(7)));
        assertThat(promoted.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(90)));
        assertThat(records.get(id).orElseThrow().ttlCategory()).isEqualTo(TtlCategory.LONG_TERM);
    }

    @Test
    void shouldListByTypeMostAccessedFirst() throws Exception {
        RecordStore records = open();
        long older = records.insert(new NewKnowledge("older lesson", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)).id();
        clock.advance(Duration.ofMinutes(1));
        long newer = records.insert(new NewKnowledge("newer lesson", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)).id();
        clock.advance(Duration.ofMinutes(1));
        long popular = records.insert(new NewKnowledge("popular lesson", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)).id();
        records.insert(new NewKnowledge("a decision", KnowledgeTypes.DECISION, KnowledgeScope.PROJECT));
        new LifecycleManager(records.database(), clock).trackAccess(popular);

        List<KnowledgeEntry> lessons = records.getByType(KnowledgeTypes.LESSON, KnowledgeScope.PROJECT, 10);

        assertThat(lessons).extracting(KnowledgeEntry::id).containsExactly(popular, newer, older);
    }

    @Test
    void shouldReportLockedWritesAndKeepReadingWhileAnotherWriterHoldsTheStore() throws Exception {
        RecordStore records = open();
        long id = records.insert(new NewKnowledge("readable while locked", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)).id();

        try (Connection writer = DriverManager.getConnection("jdbc:sqlite:" + records.database().path());
             Statement statement = writer.createStatement()) {
            statement.execute("BEGIN IMMEDIATE");

            long started = System.nanoTime();
            WriteResult blocked = records.insert(new NewKnowledge("blocked write", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT));
            Duration waited = Duration.ofNanos(System.nanoTime() - started);

            assertThat(blocked.success()).isFalse();
            assertThat(blocked.error()).isEqualTo(StoreError.LOCKED);
            assertThat(waited).isGreaterThanOrEqualTo(Duration.ofMillis(1_500)).isLessThan(Duration.ofSeconds(10));
            assertThat(records.get(id)).isPresent();
            assertThat(new SearchEngine(records, SearchConfig.defaults(), clock).search(SearchOptions.query("readable")))
                .hasSize(1);

            statement.execute("ROLLBACK");
        }

        assertThat(records.insert(new NewKnowledge("written after release", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)).success())
            .isTrue();
        assertThat(records.count()).isEqualTo(2);
    }

    private RecordStore open() throws Exception {
        stores = TestStores.manager(tempDir, clock);
        return new RecordStore(stores.open(KnowledgeScope.PROJECT), clock);
    }

    private static KnowledgeEntry insertAndGet(RecordStore records, NewKnowledge entry) throws SQLException {
        return records.get(records.insert(entry).id()).orElseThrow();
    }

    /**
     * Stores vectors under a different rowid than requested.
     */
    private record ShiftedIndex(BlobVectorIndex delegate) implements VectorIndex {

        @Override
        public String name() {
            return "shifted";
        }

        @Override
        public int dimension() {
            return delegate.dimension();
        }

        @Override
        public void initialize(Connection connection) throws SQLException {
            delegate.initialize(connection);
        }

        @Override
        public long insert(Connection connection, long id, float[] normalized) throws SQLException {
            return delegate.insert(connection, id + 1000, normalized);
        }

        @Override
        public boolean delete(Connection connection, long id) throws SQLException {
            return delegate.delete(connection, id);
        }

        @Override
        public boolean contains(Connection connection, long id) throws SQLException {
            return delegate.contains(connection, id);
        }

        @Override
        public Optional<float[]> read(Connection connection, long id) throws SQLException {
            return delegate.read(connection, id);
        }

        @Override
        public List<VectorHit> nearest(Connection connection, float[] normalizedQuery, int k) throws SQLException {
            return delegate.nearest(connection, normalizedQuery, k);
        }
    }
}
