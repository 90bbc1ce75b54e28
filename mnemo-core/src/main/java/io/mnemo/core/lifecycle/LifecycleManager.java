package io.mnemo.core.lifecycle;

import io.mnemo.core.store.EntryRows;
import io.mnemo.core.store.KnowledgeDatabase;
import io.mnemo.core.store.KnowledgeEntry;
import io.mnemo.core.store.KnowledgeScope;
import io.mnemo.core.store.RecordStore;
import io.mnemo.core.store.TtlCategory;
import io.mnemo.core.vector.VectorIndex;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expiry sweeps, access counters and staleness scoring for one store.
 */
public final class LifecycleManager {
    private static final Logger LOG = LoggerFactory.getLogger(LifecycleManager.class);
    static final Duration PERMANENT_HORIZON = Duration.ofDays(365);

    private final KnowledgeDatabase database;
    private final Clock clock;

    public LifecycleManager(KnowledgeDatabase database, Clock clock) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Deletes every entry whose expiry has passed, record and vector rows together, in one transaction.
     */
    public CleanupResult cleanupExpired() throws SQLException {
        long now = clock.millis();
        VectorIndex index = database.vectorIndex().orElse(null);
        CleanupResult result = database.inTransaction(connection -> {
            List<Long> ids = new ArrayList<>();
            try (PreparedStatement statement = connection.prepareStatement(
                "SELECT id FROM knowledge WHERE expires_at IS NOT NULL AND expires_at <= ? ORDER BY id")) {
                statement.setLong(1, now);
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        ids.add(resultSet.getLong(1));
                    }
                }
            }
            if (ids.isEmpty()) {
                return CleanupResult.none();
            }
            int deleted = 0;
            for (long id : ids) {
                deleted += RecordStore.deleteRows(connection, index, id);
            }
            return new CleanupResult(deleted, ids);
        });
        if (result.deleted() > 0) {
            LOG.debug("Expired {} knowledge entries from {}", result.deleted(), database.path());
        }
        return result;
    }

    /**
     * Counts one read of {@code id}.
     *
     * @return false when no such entry exists
     */
    public boolean trackAccess(long id) throws SQLException {
        return trackAccessBatch(List.of(id)) > 0;
    }

    /**
     * Counts one read of each distinct id in a single transaction.
     *
     * @return number of entries updated
     */
    public int trackAccessBatch(Collection<Long> ids) throws SQLException {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        List<Long> distinct = new ArrayList<>(new LinkedHashSet<>(ids));
        long now = clock.millis();
        return database.inTransaction(connection -> {
            int updated = 0;
            try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE knowledge SET access_count = access_count + 1, last_accessed = ? WHERE id = ?")) {
                for (Long id : distinct) {
                    if (id == null) {
                        continue;
                    }
                    statement.setLong(1, now);
                    statement.setLong(2, id);
                    updated += statement.executeUpdate();
                }
            }
            return updated;
        });
    }

    /**
     * Scores staleness as {@code 1 - exp(-idle / horizon)}, where the horizon is the entry's TTL
     * duration and a year for permanent entries.
     */
    public Optional<StalenessReport> getStalenessScore(long id) throws SQLException {
        Optional<KnowledgeEntry> found = database.read(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                "SELECT " + EntryRows.COLUMNS + " FROM knowledge WHERE id = ?")) {
                statement.setLong(1, id);
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? Optional.of(EntryRows.map(resultSet)) : Optional.<KnowledgeEntry>empty();
                }
            }
        });
        return found.map(this::staleness);
    }

    /**
     * Per-type access statistics, most accessed type first.
     *
     * @param scope restrict to one scope, or {@code null} for all
     * @param type  restrict to one type, or {@code null} for all
     */
    public List<AccessStats> getAccessStats(KnowledgeScope scope, String type) throws SQLException {
        StringBuilder sql = new StringBuilder("""
            SELECT type,
                   COUNT(*) AS entries,
                   COALESCE(SUM(access_count), 0) AS total_accesses,
                   COALESCE(AVG(access_count), 0) AS average_accesses,
                   SUM(CASE WHEN access_count = 0 THEN 1 ELSE 0 END) AS never_accessed
            FROM knowledge
            WHERE 1 = 1
            """);
        List<String> parameters = new ArrayList<>();
        if (scope != null) {
            sql.append(" AND scope = ?");
            parameters.add(scope.value());
        }
        if (type != null && !type.isBlank()) {
            sql.append(" AND type = ?");
            parameters.add(type.trim());
        }
        sql.append(" GROUP BY type ORDER BY total_accesses DESC, type");
        return database.read(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
                for (int i = 0; i < parameters.size(); i++) {
                    statement.setString(i + 1, parameters.get(i));
                }
                List<AccessStats> stats = new ArrayList<>();
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        stats.add(new AccessStats(
                            resultSet.getString("type"),
                            resultSet.getInt("entries"),
                            resultSet.getLong("total_accesses"),
                            resultSet.getDouble("average_accesses"),
                            resultSet.getInt("never_accessed")
                        ));
                    }
                }
                return stats;
            }
        });
    }

    StalenessReport staleness(KnowledgeEntry entry) {
        Instant now = clock.instant();
        Instant reference = entry.lastAccessed() != null ? entry.lastAccessed() : entry.createdAt();
        Duration idle = reference == null || reference.isAfter(now) ? Duration.ZERO : Duration.between(reference, now);
        TtlCategory ttl = entry.ttlCategory();
        Duration horizon = ttl.duration().orElse(PERMANENT_HORIZON);
        double score = 1.0 - Math.exp(-(double) idle.toMillis() / horizon.toMillis());
        return new StalenessReport(
            entry.id(),
            score,
            idle,
            horizon,
            ttl,
            entry.accessCount(),
            entry.lastAccessed(),
            entry.expiresAt(),
            entry.isExpired(now)
        );
    }
}
