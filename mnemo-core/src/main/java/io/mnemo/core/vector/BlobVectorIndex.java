package io.mnemo.core.vector;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Portable vector backend: float32 blobs in an ordinary table, scanned in Java. Needs no native
 * extension, at the cost of a linear scan per query.
 */
public final class BlobVectorIndex implements VectorIndex {
    private final int dimension;

    public BlobVectorIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public String name() {
        return "blob";
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void initialize(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                CREATE TABLE IF NOT EXISTS knowledge_vec_blob (
                    rowid INTEGER PRIMARY KEY,
                    embedding BLOB NOT NULL
                )
                """);
        }
    }

    @Override
    public long insert(Connection connection, long id, float[] normalized) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO knowledge_vec_blob (rowid, embedding) VALUES (?, ?)")) {
            statement.setLong(1, id);
            statement.setBytes(2, Embeddings.toBlob(normalized));
            statement.executeUpdate();
        }
        return lastInsertRowid(connection);
    }

    @Override
    public boolean delete(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "DELETE FROM knowledge_vec_blob WHERE rowid = ?")) {
            statement.setLong(1, id);
            return statement.executeUpdate() > 0;
        }
    }

    @Override
    public boolean contains(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT 1 FROM knowledge_vec_blob WHERE rowid = ?")) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        }
    }

    @Override
    public Optional<float[]> read(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT embedding FROM knowledge_vec_blob WHERE rowid = ?")) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(Embeddings.fromBlob(resultSet.getBytes(1)));
            }
        }
    }

    @Override
    public List<VectorHit> nearest(Connection connection, float[] normalizedQuery, int k) throws SQLException {
        if (normalizedQuery == null || normalizedQuery.length == 0 || k <= 0) {
            return List.of();
        }
        Comparator<VectorHit> worstFirst = Comparator.comparingDouble(VectorHit::similarity)
            .thenComparing(Comparator.comparingLong(VectorHit::id).reversed());
        PriorityQueue<VectorHit> best = new PriorityQueue<>(worstFirst);
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT rowid, embedding FROM knowledge_vec_blob");
             ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                float[] stored = Embeddings.fromBlob(resultSet.getBytes(2));
                if (stored.length != normalizedQuery.length) {
                    continue;
                }
                best.add(new VectorHit(resultSet.getLong(1), Embeddings.dot(normalizedQuery, stored)));
                if (best.size() > k) {
                    best.poll();
                }
            }
        }
        List<VectorHit> hits = new ArrayList<>(best);
        hits.sort(worstFirst.reversed());
        return hits;
    }

    static long lastInsertRowid(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT last_insert_rowid()")) {
            return resultSet.next() ? resultSet.getLong(1) : -1L;
        }
    }
}
