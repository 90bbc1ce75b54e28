package io.mnemo.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.MutableClock;
import io.mnemo.core.TestStores;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.VectorConfig;
import io.mnemo.core.vector.VectorMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoreManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCreateStoreAtSchemaLatestVersion() throws Exception {
        try (StoreManager stores = TestStores.manager(tempDir, clock())) {
            KnowledgeDatabase database = stores.open(KnowledgeScope.PROJECT);

            assertThat(database.path()).startsWith(tempDir.resolve("project/.mnemo/knowledge"));
            assertThat(database.path().getFileName().toString()).endsWith(".db");
            assertThat(Files.exists(database.path())).isTrue();
            assertThat(database.schemaVersion()).isEqualTo(SchemaMigrator.LATEST_VERSION);
            assertThat(database.vectorEnabled()).isTrue();
            String journalMode = database.read(connection -> pragma(connection, "journal_mode"));
            int storedVersion = database.read(SchemaMigrator::currentVersion);
            assertThat(storedVersion).isEqualTo(3);
            assertThat(journalMode).isEqualTo("wal");
        }
    }

    @Test
    void shouldCacheOneStorePerScope() throws Exception {
        try (StoreManager stores = TestStores.manager(tempDir, clock())) {
            KnowledgeDatabase project = stores.open(KnowledgeScope.PROJECT);
            KnowledgeDatabase global = stores.open(KnowledgeScope.GLOBAL);

            assertThat(stores.open(KnowledgeScope.PROJECT)).isSameAs(project);
            assertThat(global).isNotSameAs(project);
            assertThat(global.path()).startsWith(tempDir.resolve("global"));
        }
    }

    @Test
    void shouldReopenAfterClose() throws Exception {
        try (StoreManager stores = TestStores.manager(tempDir, clock())) {
            KnowledgeDatabase first = stores.open(KnowledgeScope.PROJECT);
            stores.close(first);

            assertThat(first.isClosed()).isTrue();
            assertThat(stores.isOpen(KnowledgeScope.PROJECT)).isFalse();
            assertThat(stores.open(KnowledgeScope.PROJECT)).isNotSameAs(first);
        }
    }

    @Test
    void shouldCloseEveryCachedStore() throws Exception {
        try (StoreManager stores = TestStores.manager(tempDir, clock())) {
            KnowledgeDatabase project = stores.open(KnowledgeScope.PROJECT);
            KnowledgeDatabase global = stores.open(KnowledgeScope.GLOBAL);

            stores.closeAll();

            assertThat(project.isClosed()).isTrue();
            assertThat(global.isClosed()).isTrue();
            assertThat(stores.isOpen(KnowledgeScope.GLOBAL)).isFalse();
        }
    }

    @Test
    void shouldRefuseCorruptStore() throws Exception {
        try (StoreManager stores = TestStores.manager(tempDir, clock())) {
            Path path = stores.resolvePath(KnowledgeScope.PROJECT);
            Files.createDirectories(path.getParent());
            Files.writeString(path, "this is definitely not a sqlite database, just some text padding the header");

            assertThatThrownBy(() -> stores.open(KnowledgeScope.PROJECT))
                .isInstanceOf(IOException.class)
                .hasMessageContaining(path.toString());
            assertThat(stores.isOpen(KnowledgeScope.PROJECT)).isFalse();
        }
    }

    @Test
    void shouldRunWithoutVectorsWhenBackendFails() throws Exception {
        try (StoreManager stores = TestStores.manager(tempDir, clock(), (connection, config) -> Optional.empty())) {
            KnowledgeDatabase database = stores.open(KnowledgeScope.PROJECT);

            assertThat(database.vectorEnabled()).isFalse();
            WriteResult result = new RecordStore(database, clock())
                .insert(new NewKnowledge("keyword only", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)
                    .withEmbedding(new float[] {1, 0, 0, 0}));
            assertThat(result.success()).isTrue();
        }
    }

    @Test
    void shouldSweepExpiredEntriesOnOpen() throws Exception {
        MutableClock clock = clock();
        try (StoreManager stores = TestStores.manager(tempDir, clock)) {
            KnowledgeDatabase database = stores.open(KnowledgeScope.PROJECT);
            RecordStore records = new RecordStore(database, clock);
            long note = records.insert(new NewKnowledge("scratch note", KnowledgeTypes.TEMP_NOTE, KnowledgeScope.PROJECT)).id();
            long lesson = records.insert(new NewKnowledge("keep this", KnowledgeTypes.LESSON, KnowledgeScope.PROJECT)).id();
            stores.close(database);

            clock.advance(Duration.ofHours(25));
            RecordStore reopened = new RecordStore(stores.open(KnowledgeScope.PROJECT), clock);

            assertThat(reopened.get(note)).isEmpty();
            assertThat(reopened.get(lesson)).isPresent();
        }
    }

    @Test
    void shouldReportAvailabilityWithoutOpening() throws Exception {
        try (StoreManager stores = TestStores.manager(tempDir, clock())) {
            Availability availability = stores.isAvailable(KnowledgeScope.PROJECT);

            assertThat(availability.available()).isTrue();
            assertThat(availability.vectorAvailable()).isTrue();
            assertThat(Files.exists(stores.resolvePath(KnowledgeScope.PROJECT))).isFalse();
        }
    }

    @Test
    void shouldReportUnavailableWhenDisabled() {
        MnemoConfig disabled = new MnemoConfig(false, null, null, null, null);
        try (StoreManager stores = new StoreManager(disabled, tempDir, clock())) {
            Availability availability = stores.isAvailable(KnowledgeScope.GLOBAL);

            assertThat(availability.available()).isFalse();
            assertThat(availability.reason()).contains("disabled");
        }
    }

    @Test
    void shouldReportMissingVectorExtension() {
        MnemoConfig config = TestStores.config(tempDir)
            .withVector(new VectorConfig(VectorMode.SQLITE_VEC, tempDir.resolve("missing/vec0").toString(), 4));
        try (StoreManager stores = new StoreManager(config, tempDir, clock())) {
            Availability availability = stores.isAvailable(KnowledgeScope.PROJECT);

            assertThat(availability.available()).isTrue();
            assertThat(availability.vectorAvailable()).isFalse();
            assertThat(availability.reason()).contains("not found");
        }
    }

    private static String pragma(Connection connection, String name) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("PRAGMA " + name)) {
            resultSet.next();
            return resultSet.getString(1);
        }
    }

    private static MutableClock clock() {
        return new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    }
}
