package io.mnemo.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import io.mnemo.core.MutableClock;
import io.mnemo.core.TestStores;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.dedup.BatchResult;
import io.mnemo.core.dedup.DedupAction;
import io.mnemo.core.dedup.IngestResult;
import io.mnemo.core.lifecycle.AccessStats;
import io.mnemo.core.search.SearchOptions;
import io.mnemo.core.search.SearchResult;
import io.mnemo.core.store.KnowledgeEntry;
import io.mnemo.core.store.KnowledgeScope;
import io.mnemo.core.store.KnowledgeTypes;
import io.mnemo.core.store.KnowledgeUpdate;
import io.mnemo.core.store.NewKnowledge;
import io.mnemo.core.store.StoreError;
import io.mnemo.core.store.StoreManager;
import io.mnemo.core.store.TtlCategory;
import io.mnemo.core.vector.EmbeddingProvider;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KnowledgeServiceTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

    @Test
    void shouldAddSearchAndTrackAccess() {
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            KnowledgeService service = new KnowledgeService(stores);
            AddResult added = service.add(new NewKnowledge("Prefer constructor injection", KnowledgeTypes.DECISION, KnowledgeScope.PROJECT));

            List<SearchResult> results = service.search("constructor injection", null);

            assertThat(added.skipped()).isFalse();
            assertThat(results).extracting(SearchResult::id).containsExactly(added.id());
            assertThat(service.get(added.id(), KnowledgeScope.PROJECT).orElseThrow().accessCount()).isEqualTo(1);
            assertThat(service.get(added.id(), KnowledgeScope.PROJECT).orElseThrow().accessCount()).isEqualTo(2);
        }
    }

    @Test
    void shouldKeepScopesInSeparateStores() {
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            KnowledgeService service = new KnowledgeService(stores);
            service.add(new NewKnowledge("global preference for tabs", KnowledgeTypes.LESSON, KnowledgeScope.GLOBAL));

            assertThat(service.search("tabs", null)).isEmpty();
            assertThat(service.search("tabs", SearchOptions.query("ignored").withScope(KnowledgeScope.GLOBAL))).hasSize(1);
        }
    }

    @Test
    void shouldIngestThroughDuplicateCascade() {
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            EmbeddingProvider provider = text -> new float[] {1, 0, 0, 0};
            KnowledgeService service = new KnowledgeService(stores, provider);

            IngestResult first = service.ingest(new NewKnowledge("Run migrations at startup", KnowledgeTypes.DECISION, KnowledgeScope.PROJECT));
            IngestResult second = service.ingest(new NewKnowledge("Run migrations at startup", KnowledgeTypes.DECISION, KnowledgeScope.PROJECT));
            IngestResult different = service.ingest(new NewKnowledge("Something else entirely", KnowledgeTypes.DECISION, KnowledgeScope.PROJECT));

            assertThat(first.action()).isEqualTo(DedupAction.CREATED);
            assertThat(second.action()).isEqualTo(DedupAction.SKIPPED);
            // the provider maps every text to the same vector
            assertThat(different.action()).isEqualTo(DedupAction.SKIPPED);
            assertThat(different.similarity()).isGreaterThan(0.88);
        }
    }

    @Test
    void shouldIngestBatchAcrossScopes() {
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            KnowledgeService service = new KnowledgeService(stores);

            BatchResult result = service.ingestBatch(List.of(
                new NewKnowledge("project fact", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT),
                new NewKnowledge("global fact", KnowledgeTypes.LESSON, KnowledgeScope.GLOBAL),
                new NewKnowledge("project fact", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)
            ));

            assertThat(result.created()).isEqualTo(2);
            assertThat(result.skipped()).isEqualTo(1);
            assertThat(result.errors()).isEmpty();
        }
    }

    @Test
    void shouldUpdateDeleteAndRejectEmbeddingChanges() {
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            KnowledgeService service = new KnowledgeService(stores);
            long id = service.add(new NewKnowledge("draft", KnowledgeTypes.TEMP_NOTE, KnowledgeScope.PROJECT)).id();

            assertThat(service.update(id, KnowledgeUpdate.ttlCategory(TtlCategory.PERMANENT), KnowledgeScope.PROJECT).success()).isTrue();
            assertThat(service.update(id, KnowledgeUpdate.embedding(new float[] {1, 0, 0, 0}), KnowledgeScope.PROJECT)
                .hasError(StoreError.UNSUPPORTED_OPERATION)).isTrue();
            assertThat(service.getByType(KnowledgeTypes.TEMP_NOTE, KnowledgeScope.PROJECT, 10))
                .extracting(KnowledgeEntry::expiresAt).containsOnlyNulls();

            assertThat(service.delete(id, KnowledgeScope.PROJECT).success()).isTrue();
            assertThat(service.delete(id, KnowledgeScope.PROJECT).hasError(StoreError.NOT_FOUND)).isTrue();
        }
    }

    @Test
    void shouldCleanupAndReportLifecycle() {
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            KnowledgeService service = new KnowledgeService(stores);
            long note = service.add(new NewKnowledge("short lived", KnowledgeTypes.TEMP_NOTE, KnowledgeScope.PROJECT)).id();
            long lesson = service.add(new NewKnowledge("long lived", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)).id();
            clock.advance(Duration.ofDays(2));

            assertThat(service.staleness(note, KnowledgeScope.PROJECT).orElseThrow().expired()).isTrue();
            assertThat(service.cleanup(KnowledgeScope.PROJECT).ids()).containsExactly(note);
            assertThat(service.staleness(lesson, KnowledgeScope.PROJECT)).isPresent();
            assertThat(service.stats(KnowledgeScope.PROJECT, null)).extracting(AccessStats::type).containsExactly(KnowledgeTypes.LESSON);
        }
    }

    @Test
    void shouldDegradeWhenDisabled() {
        MnemoConfig disabled = new MnemoConfig(false, TestStores.config(tempDir).storage(), null, null, null);
        try (StoreManager stores = new StoreManager(disabled, tempDir.resolve("project"), clock)) {
            KnowledgeService service = new KnowledgeService(stores);

            AddResult added = service.add(new NewKnowledge("ignored", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT));

            assertThat(added.skipped()).isTrue();
            assertThat(added.error()).isEqualTo(StoreError.UNAVAILABLE);
            assertThat(service.search("ignored", null)).isEmpty();
            assertThat(service.get(1, KnowledgeScope.PROJECT)).isEmpty();
            assertThat(service.cleanup(KnowledgeScope.PROJECT).deleted()).isZero();
            assertThat(service.isReady(KnowledgeScope.PROJECT)).isEqualTo(new Readiness(false, "disabled in config"));
            assertThat(Files.exists(tempDir.resolve("project/.mnemo"))).isFalse();
        }
    }

    @Test
    void shouldDegradeWhenStoreIsCorrupt() throws IOException {
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            Path path = stores.resolvePath(KnowledgeScope.PROJECT);
            Files.createDirectories(path.getParent());
            Files.writeString(path, "garbage that is long enough to fill a sqlite header and then some more");
            KnowledgeService service = new KnowledgeService(stores);

            AddResult added = service.add(new NewKnowledge("fact", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT));

            assertThat(added.skipped()).isTrue();
            assertThat(added.reason()).contains("Failed to open");
            assertThat(service.search("fact", null)).isEmpty();
            assertThat(service.isReady(KnowledgeScope.PROJECT).ready()).isTrue();
        }
    }

    @Test
    void shouldSearchByEmbeddedQueryWhenProviderPresent() {
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            EmbeddingProvider provider = text -> text.contains("vector") ? new float[] {0, 1, 0, 0} : new float[] {1, 0, 0, 0};
            KnowledgeService service = new KnowledgeService(stores, provider);
            IngestResult stored = service.ingest(new NewKnowledge("vector only entry", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT));

            List<SearchResult> results = service.search("semantic vector lookup", null);

            assertThat(results).extracting(SearchResult::id).containsExactly(stored.id());
        }
    }

    @Test
    void shouldFallBackToKeywordOnlyWhenProviderFails() {
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            EmbeddingProvider provider = text -> {
                throw new IllegalStateException("provider down");
            };
            KnowledgeService service = new KnowledgeService(stores, provider);

            IngestResult stored = service.ingest(new NewKnowledge("Rotate signing keys yearly", KnowledgeTypes.DECISION, KnowledgeScope.PROJECT));
            List<SearchResult> results = service.search("signing keys", null);

            assertThat(stored.action()).isEqualTo(DedupAction.CREATED);
            assertThat(results).extracting(SearchResult::id).containsExactly(stored.id());
        }
    }
}
