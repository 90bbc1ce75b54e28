package io.mnemo.core.store;

import io.mnemo.core.vector.Embeddings;
import io.mnemo.core.vector.VectorIndex;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CRUD over knowledge entries and their paired vector rows.
 *
 * <p>Writes return a {@link WriteResult} instead of throwing. Reads throw {@link SQLException} and
 * leave degradation to the caller.</p>
 */
public final class RecordStore {
    private static final Logger LOG = LoggerFactory.getLogger(RecordStore.class);
    private static final int DEFAULT_TYPE_LIMIT = 100;

    private final KnowledgeDatabase database;
    private final Clock clock;

    public RecordStore(KnowledgeDatabase database, Clock clock) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public KnowledgeDatabase database() {
        return database;
    }

    public WriteResult insert(NewKnowledge entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        VectorIndex index = database.vectorIndex().orElse(null);
        float[] normalized = null;
        if (entry.embedding() != null && index != null) {
            if (entry.embedding().length != index.dimension()) {
                return WriteResult.failure(
                    StoreError.INVALID_ARGUMENT,
                    "Embedding has " + entry.embedding().length + " dimensions, store expects " + index.dimension()
                );
            }
            normalized = Embeddings.normalize(entry.embedding());
        } else if (entry.embedding() != null) {
            LOG.debug("Vector support disabled, storing entry without embedding");
        }

        String hash = ContentHash.sha256(entry.content());
        TtlCategory ttl = entry.effectiveTtl();
        Instant now = clock.instant();
        Instant expiresAt = ttl.expiresAt(now);
        float[] vector = normalized;

        try {
            long id = database.inTransaction(connection -> {
                long recordId = insertRow(connection, entry, hash, ttl, now, expiresAt);
                if (vector != null) {
                    long vectorId = index.insert(connection, recordId, vector);
                    if (vectorId != recordId || !index.contains(connection, recordId)) {
                        throw new IdentityMismatchException(recordId, vectorId);
                    }
                }
                return recordId;
            });
            LOG.debug("Inserted knowledge entry {} type={} ttl={}", id, entry.type(), ttl.value());
            return WriteResult.inserted(id, hash, expiresAt);
        } catch (SQLException e) {
            return failure("insert", -1L, e);
        }
    }

    public Optional<KnowledgeEntry> get(long id) throws SQLException {
        return database.read(connection -> findById(connection, id));
    }

    /**
     * Newest live entry with this content hash. Expired rows that have not been swept yet are skipped.
     */
    public Optional<KnowledgeEntry> getByHash(String contentHash) throws SQLException {
        if (contentHash == null || contentHash.isBlank()) {
            return Optional.empty();
        }
        return database.read(connection -> firstLive(connection,
            "SELECT " + EntryRows.COLUMNS + " FROM knowledge WHERE content_hash = ?"
                + " AND (expires_at IS NULL OR expires_at > ?) ORDER BY id DESC LIMIT 1",
            contentHash
        ));
    }

    /**
     * Newest live entry whose metadata carries this canonical hash.
     */
    public Optional<KnowledgeEntry> getByCanonicalHash(String canonicalHash) throws SQLException {
        if (canonicalHash == null || canonicalHash.isBlank()) {
            return Optional.empty();
        }
        return database.read(connection -> firstLive(connection,
            "SELECT " + EntryRows.COLUMNS + " FROM knowledge"
                + " WHERE json_extract(metadata, '$.canonical_hash') = ?"
                + " AND (expires_at IS NULL OR expires_at > ?) ORDER BY id DESC LIMIT 1",
            canonicalHash
        ));
    }

    /**
     * Entries of one type, most accessed first, then newest first.
     */
    public List<KnowledgeEntry> getByType(String type, KnowledgeScope scope, int limit) throws SQLException {
        if (type == null || type.isBlank()) {
            return List.of();
        }
        int safeLimit = limit <= 0 ? DEFAULT_TYPE_LIMIT : limit;
        StringBuilder sql = new StringBuilder("SELECT " + EntryRows.COLUMNS + " FROM knowledge WHERE type = ?");
        if (scope != null) {
            sql.append(" AND scope = ?");
        }
        sql.append(" ORDER BY access_count DESC, created_at DESC, id DESC LIMIT ?");
        return database.read(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
                int i = 1;
                statement.setString(i++, type);
                if (scope != null) {
                    statement.setString(i++, scope.value());
                }
                statement.setInt(i, safeLimit);
                return mapAll(statement);
            }
        });
    }

    /**
     * Loads the given ids in one query. Missing ids are absent from the result.
     */
    public Map<Long, KnowledgeEntry> getAll(Collection<Long> ids) throws SQLException {
        if (ids == null || ids.isEmpty()) {
            return Map.of();
        }
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        ids.forEach(id -> placeholders.add("?"));
        String sql = "SELECT " + EntryRows.COLUMNS + " FROM knowledge WHERE id IN " + placeholders;
        return database.read(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                int i = 1;
                for (Long id : ids) {
                    statement.setLong(i++, id);
                }
                Map<Long, KnowledgeEntry> found = new LinkedHashMap<>();
                for (KnowledgeEntry entry : mapAll(statement)) {
                    found.put(entry.id(), entry);
                }
                return found;
            }
        });
    }

    public Optional<float[]> getEmbedding(long id) throws SQLException {
        Optional<VectorIndex> index = database.vectorIndex();
        if (index.isEmpty()) {
            return Optional.empty();
        }
        return database.read(connection -> index.get().read(connection, id));
    }

    public int count() throws SQLException {
        return database.read(connection -> {
            try (Statement statement = connection.createStatement();
                 ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM knowledge")) {
                return resultSet.next() ? resultSet.getInt(1) : 0;
            }
        });
    }

    /**
     * Applies a partial update in one transaction. Changing the TTL category, or changing the type
     * of an entry that still carries the old type's default category, recomputes the expiry from now.
     */
    public WriteResult update(long id, KnowledgeUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        if (update.embedding() != null) {
            return WriteResult.failure(
                StoreError.UNSUPPORTED_OPERATION,
                "Stored embeddings are immutable; delete and reinsert entry " + id + " to change it"
            );
        }
        if (update.content() != null && update.content().isBlank()) {
            return WriteResult.failure(StoreError.INVALID_ARGUMENT, "content must not be blank");
        }
        if (update.type() != null && update.type().isBlank()) {
            return WriteResult.failure(StoreError.INVALID_ARGUMENT, "type must not be blank");
        }

        Instant now = clock.instant();
        try {
            return database.inTransaction(connection -> {
                Optional<KnowledgeEntry> found = findById(connection, id);
                if (found.isEmpty()) {
                    return WriteResult.notFound(id);
                }
                KnowledgeEntry current = found.get();

                List<String> fields = new ArrayList<>();
                List<Object> values = new ArrayList<>();
                String hash = current.contentHash();
                Instant expiresAt = current.expiresAt();

                if (update.content() != null) {
                    hash = ContentHash.sha256(update.content());
                    fields.add("content = ?");
                    values.add(update.content());
                    fields.add("content_hash = ?");
                    values.add(hash);
                }
                String type = current.type();
                if (update.type() != null) {
                    type = update.type().trim();
                    fields.add("type = ?");
                    values.add(type);
                }
                TtlCategory ttl = update.ttlCategory();
                if (ttl == null && !type.equals(current.type())
                    && current.ttlCategory() == TtlCategory.defaultFor(current.type())) {
                    ttl = TtlCategory.defaultFor(type);
                }
                if (ttl != null) {
                    expiresAt = ttl.expiresAt(now);
                    fields.add("ttl_category = ?");
                    values.add(ttl.value());
                    fields.add("expires_at = ?");
                    values.add(EntryRows.epochMillis(expiresAt));
                }
                if (update.metadata() != null) {
                    fields.add("metadata = ?");
                    values.add(update.metadata().toJson());
                    fields.add("project_slug = ?");
                    values.add(update.metadata().projectSlug());
                }

                if (!fields.isEmpty()) {
                    values.add(id);
                    String sql = "UPDATE knowledge SET " + String.join(", ", fields) + " WHERE id = ?";
                    try (PreparedStatement statement = connection.prepareStatement(sql)) {
                        bind(statement, values);
                        statement.executeUpdate();
                    }
                }
                return WriteResult.ok(id, hash, expiresAt);
            });
        } catch (SQLException e) {
            return failure("update", id, e);
        }
    }

    /**
     * Removes an entry and its vector row together.
     */
    public WriteResult delete(long id) {
        try {
            return database.inTransaction(connection -> {
                int removed = deleteRows(connection, database.vectorIndex().orElse(null), id);
                return removed > 0 ? WriteResult.ok(id) : WriteResult.notFound(id);
            });
        } catch (SQLException e) {
            return failure("delete", id, e);
        }
    }

    /**
     * Restarts the entry's retention window from now.
     *
     * @param category new category, or {@code null} to keep the entry's current one
     */
    public WriteResult refreshTtl(long id, TtlCategory category) {
        Instant now = clock.instant();
        try {
            return database.inTransaction(connection -> {
                Optional<KnowledgeEntry> found = findById(connection, id);
                if (found.isEmpty()) {
                    return WriteResult.notFound(id);
                }
                KnowledgeEntry current = found.get();
                TtlCategory effective = category != null ? category : current.ttlCategory();
                Instant expiresAt = effective.expiresAt(now);
                try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE knowledge SET expires_at = ?, ttl_category = ? WHERE id = ?")) {
                    setNullableLong(statement, 1, EntryRows.epochMillis(expiresAt));
                    statement.setString(2, effective.value());
                    statement.setLong(3, id);
                    statement.executeUpdate();
                }
                return WriteResult.ok(id, current.contentHash(), expiresAt);
            });
        } catch (SQLException e) {
            return failure("refresh ttl", id, e);
        }
    }

    /**
     * Deletes the record and vector rows for {@code id} on the caller's transaction.
     *
     * @return number of record rows removed
     * @throws IdentityMismatchException if the vector row survives the delete
     */
    public static int deleteRows(Connection connection, VectorIndex index, long id) throws SQLException {
        if (index != null) {
            index.delete(connection, id);
        }
        int removed;
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM knowledge WHERE id = ?")) {
            statement.setLong(1, id);
            removed = statement.executeUpdate();
        }
        if (index != null && index.contains(connection, id)) {
            throw new IdentityMismatchException(id, id);
        }
        return removed;
    }

    private long insertRow(
        Connection connection,
        NewKnowledge entry,
        String hash,
        TtlCategory ttl,
        Instant now,
        Instant expiresAt
    ) throws SQLException {
        String sql = """
            INSERT INTO knowledge (
                content, type, scope, created_at, expires_at, access_count, last_accessed,
                content_hash, ttl_category, project_slug, metadata
            )
            VALUES (?, ?, ?, ?, ?, 0, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, entry.content());
            statement.setString(2, entry.type());
            statement.setString(3, entry.scope().value());
            statement.setLong(4, now.toEpochMilli());
            setNullableLong(statement, 5, EntryRows.epochMillis(expiresAt));
            statement.setLong(6, now.toEpochMilli());
            statement.setString(7, hash);
            statement.setString(8, ttl.value());
            statement.setString(9, entry.metadata().projectSlug());
            statement.setString(10, entry.metadata().toJson());
            statement.executeUpdate();
        }
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT last_insert_rowid()")) {
            if (!resultSet.next()) {
                throw new SQLException("Insert did not report a rowid");
            }
            return resultSet.getLong(1);
        }
    }

    private Optional<KnowledgeEntry> findById(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT " + EntryRows.COLUMNS + " FROM knowledge WHERE id = ?")) {
            statement.setLong(1, id);
            List<KnowledgeEntry> rows = mapAll(statement);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private Optional<KnowledgeEntry> firstLive(Connection connection, String sql, String parameter) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, parameter);
            statement.setLong(2, clock.instant().toEpochMilli());
            List<KnowledgeEntry> rows = mapAll(statement);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private static List<KnowledgeEntry> mapAll(PreparedStatement statement) throws SQLException {
        List<KnowledgeEntry> entries = new ArrayList<>();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                entries.add(EntryRows.map(resultSet));
            }
        }
        return entries;
    }

    private static void bind(PreparedStatement statement, List<Object> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value == null) {
                statement.setNull(i + 1, Types.NULL);
            } else if (value instanceof Long number) {
                statement.setLong(i + 1, number);
            } else {
                statement.setObject(i + 1, value);
            }
        }
    }

    private static void setNullableLong(PreparedStatement statement, int index, Long value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value);
        }
    }

    private WriteResult failure(String operation, long id, SQLException e) {
        StoreError error = SqlErrors.classify(e);
        switch (error) {
            case IDENTITY_MISMATCH -> LOG.error(
                "Knowledge {} rolled back: record/vector identity mismatch in {} ({})",
                operation,
                database.path(),
                e.getMessage()
            );
            case LOCKED -> LOG.warn("Knowledge {} of entry {} timed out waiting for lock: {}", operation, id, e.getMessage());
            default -> LOG.error("Knowledge {} of entry {} failed", operation, id, e);
        }
        return WriteResult.failure(error, e.getMessage());
    }
}
