package io.mnemo.core.store;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forward-only schema migrations keyed on {@code PRAGMA user_version}. Each step runs in its own
 * transaction together with the version bump.
 */
public final class SchemaMigrator {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);

    public static final List<Migration> MIGRATIONS = List.of(
        new Migration(1, "knowledge table with full-text index", List.of(
            """
            CREATE TABLE IF NOT EXISTS knowledge (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                content TEXT NOT NULL,
                type TEXT NOT NULL,
                scope TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                expires_at INTEGER,
                access_count INTEGER NOT NULL DEFAULT 0,
                last_accessed INTEGER,
                content_hash TEXT NOT NULL,
                metadata TEXT
            )
            """,
            """
            CREATE VIRTUAL TABLE IF NOT EXISTS knowledge_fts USING fts5(
                content,
                content='knowledge',
                content_rowid='id',
                tokenize='porter unicode61'
            )
            """,
            """
            CREATE TRIGGER IF NOT EXISTS knowledge_fts_insert AFTER INSERT ON knowledge BEGIN
                INSERT INTO knowledge_fts(rowid, content) VALUES (new.id, new.content);
            END
            """,
            """
            CREATE TRIGGER IF NOT EXISTS knowledge_fts_update AFTER UPDATE OF content ON knowledge BEGIN
                INSERT INTO knowledge_fts(knowledge_fts, rowid, content) VALUES ('delete', old.id, old.content);
                INSERT INTO knowledge_fts(rowid, content) VALUES (new.id, new.content);
            END
            """,
            """
            CREATE TRIGGER IF NOT EXISTS knowledge_fts_delete AFTER DELETE ON knowledge BEGIN
                INSERT INTO knowledge_fts(knowledge_fts, rowid, content) VALUES ('delete', old.id, old.content);
            END
            """,
            "CREATE INDEX IF NOT EXISTS idx_knowledge_expires ON knowledge(expires_at) WHERE expires_at IS NOT NULL",
            "CREATE INDEX IF NOT EXISTS idx_knowledge_type_access ON knowledge(type, access_count DESC)",
            "CREATE INDEX IF NOT EXISTS idx_knowledge_hash ON knowledge(content_hash)"
        )),
        new Migration(2, "ttl category and project slug columns", List.of(
            "ALTER TABLE knowledge ADD COLUMN ttl_category TEXT",
            "ALTER TABLE knowledge ADD COLUMN project_slug TEXT",
            """
            UPDATE knowledge
            SET project_slug = json_extract(metadata, '$.project_slug')
            WHERE project_slug IS NULL AND metadata IS NOT NULL AND json_valid(metadata)
            """,
            "CREATE INDEX IF NOT EXISTS idx_knowledge_project ON knowledge(project_slug)"
        )),
        new Migration(3, "canonical hash lookup index", List.of(
            """
            CREATE INDEX IF NOT EXISTS idx_knowledge_canonical
            ON knowledge(json_extract(metadata, '$.canonical_hash'))
            """
        ))
    );

    public static final int LATEST_VERSION = MIGRATIONS.get(MIGRATIONS.size() - 1).version();

    private final List<Migration> migrations;

    public SchemaMigrator() {
        this(MIGRATIONS);
    }

    SchemaMigrator(List<Migration> migrations) {
        this.migrations = List.copyOf(migrations);
    }

    /**
     * Applies every migration newer than the stored version.
     *
     * @return the version after migrating
     */
    public int migrate(Connection connection) throws SQLException {
        int current = currentVersion(connection);
        int latest = migrations.isEmpty() ? 0 : migrations.get(migrations.size() - 1).version();
        if (current > latest) {
            throw new SQLException("Store schema version " + current + " is newer than supported version " + latest);
        }
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            for (Migration migration : migrations) {
                if (migration.version() <= current) {
                    continue;
                }
                try (Statement statement = connection.createStatement()) {
                    for (String sql : migration.statements()) {
                        statement.execute(sql);
                    }
                    statement.execute("PRAGMA user_version = " + migration.version());
                    connection.commit();
                } catch (SQLException e) {
                    connection.rollback();
                    throw new SQLException("Migration to version " + migration.version() + " failed", e);
                }
                LOG.info("Applied knowledge schema migration {}: {}", migration.version(), migration.description());
                current = migration.version();
            }
        } finally {
            connection.setAutoCommit(autoCommit);
        }
        return current;
    }

    public static int currentVersion(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("PRAGMA user_version")) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        }
    }
}
