package io.mnemo.core.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@code knowledge} rows to entries. Queries select {@link #COLUMNS}, optionally prefixed by a
 * table alias.
 */
public final class EntryRows {
    private static final Logger LOG = LoggerFactory.getLogger(EntryRows.class);

    public static final String COLUMNS = columns("");

    private EntryRows() {
    }

    public static String columns(String alias) {
        String p = alias == null || alias.isBlank() ? "" : alias + ".";
        return String.join(", ",
            p + "id",
            p + "content",
            p + "type",
            p + "scope",
            p + "created_at",
            p + "expires_at",
            p + "access_count",
            p + "last_accessed",
            p + "content_hash",
            p + "ttl_category",
            p + "project_slug",
            p + "metadata"
        );
    }

    public static KnowledgeEntry map(ResultSet resultSet) throws SQLException {
        long id = resultSet.getLong("id");
        String type = resultSet.getString("type");
        String rawTtl = resultSet.getString("ttl_category");
        TtlCategory ttl;
        try {
            ttl = rawTtl == null ? TtlCategory.defaultFor(type) : TtlCategory.fromString(rawTtl);
        } catch (IllegalArgumentException e) {
            LOG.warn("Entry {} has unknown ttl_category '{}', using type default", id, rawTtl);
            ttl = TtlCategory.defaultFor(type);
        }
        return new KnowledgeEntry(
            id,
            resultSet.getString("content"),
            type,
            parseScope(resultSet.getString("scope")),
            instant(resultSet, "created_at"),
            instant(resultSet, "expires_at"),
            resultSet.getInt("access_count"),
            instant(resultSet, "last_accessed"),
            resultSet.getString("content_hash"),
            ttl,
            resultSet.getString("project_slug"),
            metadata(id, resultSet.getString("metadata"))
        );
    }

    public static Long epochMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant instant(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static KnowledgeScope parseScope(String raw) {
        try {
            return KnowledgeScope.fromString(raw);
        } catch (IllegalArgumentException e) {
            return KnowledgeScope.PROJECT;
        }
    }

    private static KnowledgeMetadata metadata(long id, String json) {
        try {
            return KnowledgeMetadata.fromJson(json);
        } catch (IllegalArgumentException e) {
            LOG.warn("Entry {} has unreadable metadata, returning it without metadata", id);
            return KnowledgeMetadata.empty();
        }
    }
}
