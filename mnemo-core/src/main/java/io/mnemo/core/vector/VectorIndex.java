package io.mnemo.core.vector;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Storage for entry embeddings keyed by the owning record's rowid. All calls run on the
 * caller's connection so they join the caller's transaction.
 */
public interface VectorIndex {

    String name();

    int dimension();

    void initialize(Connection connection) throws SQLException;

    /**
     * Stores a unit-length embedding under {@code id}.
     *
     * @return the rowid the backend actually assigned, which callers compare against {@code id}
     */
    long insert(Connection connection, long id, float[] normalized) throws SQLException;

    boolean delete(Connection connection, long id) throws SQLException;

    boolean contains(Connection connection, long id) throws SQLException;

    Optional<float[]> read(Connection connection, long id) throws SQLException;

    /**
     * Returns up to {@code k} stored vectors closest to {@code normalizedQuery}, best first.
     */
    List<VectorHit> nearest(Connection connection, float[] normalizedQuery, int k) throws SQLException;
}
