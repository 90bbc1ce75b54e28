package io.mnemo.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaMigratorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUpgradeVersionOneStoreAndBackfillProjectSlug() throws Exception {
        try (Connection connection = connect()) {
            new SchemaMigrator(SchemaMigrator.MIGRATIONS.subList(0, 1)).migrate(connection);
            try (Statement statement = connection.createStatement()) {
                statement.execute("""
                    INSERT INTO knowledge (content, type, scope, created_at, content_hash, metadata)
                    VALUES ('old entry', 'lesson', 'project', 0, 'abc', '{"project_slug":"alpha"}')
                    """);
            }

            int version = new SchemaMigrator().migrate(connection);

            assertThat(version).isEqualTo(SchemaMigrator.LATEST_VERSION);
            assertThat(query(connection, "SELECT project_slug FROM knowledge")).isEqualTo("alpha");
            assertThat(query(connection, "SELECT ttl_category IS NULL FROM knowledge")).isEqualTo("1");
            assertThat(query(connection,
                "SELECT count(*) FROM sqlite_master WHERE name = 'idx_knowledge_canonical'")).isEqualTo("1");
        }
    }

    @Test
    void shouldBeNoOpWhenAlreadyCurrent() throws Exception {
        try (Connection connection = connect()) {
            new SchemaMigrator().migrate(connection);

            assertThat(new SchemaMigrator().migrate(connection)).isEqualTo(SchemaMigrator.LATEST_VERSION);
        }
    }

    @Test
    void shouldRefuseStoreFromNewerRelease() throws Exception {
        try (Connection connection = connect()) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA user_version = 99");
            }

            assertThatThrownBy(() -> new SchemaMigrator().migrate(connection))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("newer");
        }
    }

    @Test
    void shouldRollBackFailedStepAndKeepPreviousVersion() throws Exception {
        List<Migration> migrations = List.of(
            new Migration(1, "table", List.of("CREATE TABLE sample (id INTEGER PRIMARY KEY)")),
            new Migration(2, "broken", List.of(
                "CREATE TABLE partial (id INTEGER PRIMARY KEY)",
                "THIS IS NOT SQL"
            ))
        );
        try (Connection connection = connect()) {
            assertThatThrownBy(() -> new SchemaMigrator(migrations).migrate(connection))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("version 2");

            assertThat(SchemaMigrator.currentVersion(connection)).isEqualTo(1);
            assertThat(query(connection, "SELECT count(*) FROM sqlite_master WHERE name = 'partial'")).isEqualTo("0");
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("migrate.db"));
    }

    private static String query(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            resultSet.next();
            return resultSet.getString(1);
        }
    }
}
