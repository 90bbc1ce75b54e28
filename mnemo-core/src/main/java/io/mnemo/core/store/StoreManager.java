package io.mnemo.core.store;

import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.StorageConfig;
import io.mnemo.core.lifecycle.CleanupResult;
import io.mnemo.core.lifecycle.LifecycleManager;
import io.mnemo.core.vector.VectorIndex;
import io.mnemo.core.vector.VectorIndexFactory;
import io.mnemo.core.vector.VectorIndexes;
import io.mnemo.core.vector.VectorMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * Opens knowledge stores and keeps one connection per resolved file for as long as the manager
 * lives. Owned by the application root and handed to whatever needs a store.
 */
public final class StoreManager implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StoreManager.class);
    private static final String DRIVER_CLASS = "org.sqlite.JDBC";

    private final MnemoConfig config;
    private final Path projectRoot;
    private final Clock clock;
    private final VectorIndexFactory vectorIndexFactory;
    private final String user;
    private final Map<Path, KnowledgeDatabase> open = new LinkedHashMap<>();

    public StoreManager(MnemoConfig config, Path projectRoot, Clock clock) {
        this(config, projectRoot, clock, VectorIndexes.standard());
    }

    public StoreManager(MnemoConfig config, Path projectRoot, Clock clock, VectorIndexFactory vectorIndexFactory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.projectRoot = projectRoot == null ? Path.of("").toAbsolutePath() : projectRoot.toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.vectorIndexFactory = Objects.requireNonNull(vectorIndexFactory, "vectorIndexFactory must not be null");
        this.user = ConfigPaths.currentUser();
    }

    public MnemoConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Path resolvePath(KnowledgeScope scope) {
        StorageConfig storage = config.storage();
        Path dir = switch (scope) {
            case GLOBAL -> ConfigPaths.resolveGlobalRoot(storage.globalRoot());
            case PROJECT -> ConfigPaths.resolveProjectStateDir(projectRoot, storage.projectStateDir());
        };
        return dir.resolve(user + ".db").toAbsolutePath().normalize();
    }

    /**
     * Returns the cached store for {@code scope}, opening and migrating it on first use.
     *
     * @throws IOException if the file cannot be created, is not a SQLite database, or fails to migrate
     */
    public synchronized KnowledgeDatabase open(KnowledgeScope scope) throws IOException {
        Objects.requireNonNull(scope, "scope must not be null");
        Path path = resolvePath(scope);
        KnowledgeDatabase cached = open.get(path);
        if (cached != null && !cached.isClosed()) {
            return cached;
        }

        Files.createDirectories(path.getParent());
        Connection connection = null;
        try {
            connection = connect(path);
            configure(connection);
            int version = new SchemaMigrator().migrate(connection);
            VectorIndex vectorIndex = vectorIndexFactory.open(connection, config.vector()).orElse(null);
            KnowledgeDatabase database = new KnowledgeDatabase(scope, path, connection, vectorIndex, version);
            open.put(path, database);
            LOG.info(
                "Opened {} knowledge store at {} (schema v{}, vector={})",
                scope.value(),
                path,
                version,
                vectorIndex == null ? "disabled" : vectorIndex.name()
            );
            if (config.storage().cleanupOnOpen()) {
                sweepExpired(database);
            }
            return database;
        } catch (SQLException e) {
            closeQuietly(connection, e);
            open.remove(path);
            throw new IOException("Failed to open knowledge store at " + path, e);
        }
    }

    /**
     * Dependency check that does not open or create the store.
     */
    public Availability isAvailable(KnowledgeScope scope) {
        if (!config.enabled()) {
            return Availability.unavailable("knowledge store disabled in config");
        }
        try {
            Class.forName(DRIVER_CLASS);
        } catch (ClassNotFoundException e) {
            return Availability.unavailable("SQLite driver not on classpath: " + e.getMessage());
        }

        Path path = resolvePath(scope);
        Path existing = path.getParent();
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null || !Files.isWritable(existing)) {
            return Availability.unavailable("Knowledge directory is not writable: " + path.getParent());
        }
        if (Files.exists(path) && !Files.isWritable(path)) {
            return Availability.unavailable("Knowledge store is not writable: " + path);
        }

        if (config.vector().mode() == VectorMode.DISABLED) {
            return Availability.ready(false, "vector search disabled in config");
        }
        Optional<String> vectorProblem = VectorIndexes.checkExtension(config.vector());
        if (vectorProblem.isPresent() && config.vector().mode() == VectorMode.SQLITE_VEC) {
            return Availability.ready(false, vectorProblem.get());
        }
        return Availability.ready(true, null);
    }

    public synchronized boolean isOpen(KnowledgeScope scope) {
        KnowledgeDatabase database = open.get(resolvePath(scope));
        return database != null && !database.isClosed();
    }

    /**
     * Evicts {@code database} from the cache and closes its connection.
     */
    public synchronized void close(KnowledgeDatabase database) {
        if (database == null) {
            return;
        }
        open.remove(database.path());
        try {
            database.close();
        } catch (SQLException e) {
            LOG.warn("Error closing knowledge store {}: {}", database.path(), e.getMessage());
        }
    }

    /**
     * Closes every cached store. The manager stays usable and reopens stores on demand.
     */
    public synchronized void closeAll() {
        List<KnowledgeDatabase> all = new ArrayList<>(open.values());
        for (KnowledgeDatabase database : all) {
            close(database);
        }
    }

    @Override
    public void close() {
        closeAll();
    }

    private Connection connect(Path path) throws SQLException {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.setBusyTimeout(config.storage().busyTimeoutMs());
        if (VectorIndexes.wantsExtension(config.vector())) {
            sqlite.enableLoadExtension(true);
        }
        return DriverManager.getConnection("jdbc:sqlite:" + path, sqlite.toProperties());
    }

    private void configure(Connection connection) throws SQLException {
        StorageConfig storage = config.storage();
        try (Statement statement = connection.createStatement()) {
            // reading the schema forces SQLite to validate the file header
            try (ResultSet resultSet = statement.executeQuery("SELECT count(*) FROM sqlite_master")) {
                resultSet.next();
            }
            statement.execute("PRAGMA journal_mode=WAL");
            statement.execute("PRAGMA synchronous=NORMAL");
            statement.execute("PRAGMA cache_size=-" + Math.max(1, storage.cacheSizeKib()));
            statement.execute("PRAGMA temp_store=MEMORY");
            statement.execute("PRAGMA busy_timeout=" + Math.max(0, storage.busyTimeoutMs()));
        }
    }

    private void sweepExpired(KnowledgeDatabase database) {
        try {
            CleanupResult cleaned = new LifecycleManager(database, clock).cleanupExpired();
            if (cleaned.deleted() > 0) {
                LOG.info("Cleaned {} expired knowledge entries from {}", cleaned.deleted(), database.path());
            }
        } catch (SQLException e) {
            // the next open or an explicit cleanup retries
            LOG.warn("Expiry sweep on open failed for {}: {}", database.path(), e.getMessage());
        }
    }

    private void closeQuietly(Connection connection, Exception cause) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
