package io.mnemo.core.store;

import io.mnemo.core.vector.VectorIndex;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * One open store: the shared JDBC connection plus its optional vector backend.
 *
 * <p>SQLite allows a single writer per database file. Other processes are kept out by SQLite's own
 * file locking; threads of this process are serialized on this object's monitor, which every
 * read and transaction takes.</p>
 */
public final class KnowledgeDatabase {
    private final KnowledgeScope scope;
    private final Path path;
    private final Connection connection;
    private final VectorIndex vectorIndex;
    private final int schemaVersion;
    private boolean closed;

    KnowledgeDatabase(KnowledgeScope scope, Path path, Connection connection, VectorIndex vectorIndex, int schemaVersion) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.vectorIndex = vectorIndex;
        this.schemaVersion = schemaVersion;
    }

    public KnowledgeScope scope() {
        return scope;
    }

    public Path path() {
        return path;
    }

    public int schemaVersion() {
        return schemaVersion;
    }

    public boolean vectorEnabled() {
        return vectorIndex != null;
    }

    public Optional<VectorIndex> vectorIndex() {
        return Optional.ofNullable(vectorIndex);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Runs {@code work} in autocommit mode.
     */
    public synchronized <T> T read(SqlWork<T> work) throws SQLException {
        ensureOpen();
        return work.run(connection);
    }

    /**
     * Runs {@code work} in one transaction, committing on success and rolling back on any exception.
     */
    public synchronized <T> T inTransaction(SqlWork<T> work) throws SQLException {
        ensureOpen();
        T result;
        try {
            // BEGIN IMMEDIATE runs here, so a busy writer elsewhere surfaces inside the guarded block
            connection.setAutoCommit(false);
            result = work.run(connection);
            connection.commit();
        } catch (SQLException | RuntimeException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            try {
                connection.setAutoCommit(true);
            } catch (SQLException resetFailure) {
                e.addSuppressed(resetFailure);
            }
            throw e;
        }
        connection.setAutoCommit(true);
        return result;
    }

    synchronized void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        connection.close();
    }

    private void ensureOpen() throws SQLException {
        if (closed) {
            throw new SQLException("Knowledge store is closed: " + path);
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }
}
