package io.mnemo.core.vector;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Vector backend on the sqlite-vec {@code vec0} virtual table. The extension must already be
 * loaded into the connection.
 *
 * <p>{@code vec0} only accepts an explicit rowid as a SQL literal, so inserts inline the id.
 * It cannot update a vector in place either; replacing one means delete and insert.</p>
 */
public final class SqliteVecIndex implements VectorIndex {
    private final int dimension;

    public SqliteVecIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public String name() {
        return "sqlite-vec";
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void initialize(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(
                "CREATE VIRTUAL TABLE IF NOT EXISTS knowledge_vec USING vec0(embedding float[" + dimension + "])"
            );
        }
    }

    @Override
    public long insert(Connection connection, long id, float[] normalized) throws SQLException {
        String sql = "INSERT INTO knowledge_vec (rowid, embedding) VALUES (" + id + ", ?)";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setBytes(1, Embeddings.toBlob(normalized));
            statement.executeUpdate();
        }
        return BlobVectorIndex.lastInsertRowid(connection);
    }

    @Override
    public boolean delete(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "DELETE FROM knowledge_vec WHERE rowid = ?")) {
            statement.setLong(1, id);
            return statement.executeUpdate() > 0;
        }
    }

    @Override
    public boolean contains(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT rowid FROM knowledge_vec WHERE rowid = ?")) {
            statement.setLong(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        }
    }

    @Override
    public Optional<float[]> read(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT embedding FROM knowledge_vec WHERE rowid = ?")) {
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
        String sql = """
            SELECT rowid, distance
            FROM knowledge_vec
            WHERE embedding MATCH ? AND k = ?
            ORDER BY distance
            """;
        List<VectorHit> hits = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setBytes(1, Embeddings.toBlob(normalizedQuery));
            statement.setInt(2, k);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    hits.add(new VectorHit(resultSet.getLong(1), Embeddings.similarityFromL2(resultSet.getDouble(2))));
                }
            }
        }
        return hits;
    }
}
