package io.mnemo.core.vector;

import io.mnemo.core.config.model.VectorConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class VectorIndexes {
    private static final Logger LOG = LoggerFactory.getLogger(VectorIndexes.class);

    private VectorIndexes() {
    }

    /**
     * Default backend selection. Failures are logged and turn vector support off; they never
     * fail the open.
     */
    public static VectorIndexFactory standard() {
        return VectorIndexes::select;
    }

    public static boolean wantsExtension(VectorConfig config) {
        return switch (config.mode()) {
            case SQLITE_VEC -> true;
            case AUTO -> !config.extensionPath().isBlank();
            case BLOB, DISABLED -> false;
        };
    }

    public static Optional<String> checkExtension(VectorConfig config) {
        if (!wantsExtension(config)) {
            return Optional.empty();
        }
        if (config.extensionPath().isBlank()) {
            return Optional.of("sqlite-vec extension path is not configured");
        }
        if (!Files.isReadable(resolveLibrary(config.extensionPath()))) {
            return Optional.of("sqlite-vec extension not found: " + config.extensionPath());
        }
        return Optional.empty();
    }

    private static Optional<VectorIndex> select(Connection connection, VectorConfig config) {
        return switch (config.mode()) {
            case DISABLED -> Optional.empty();
            case BLOB -> initialize(connection, new BlobVectorIndex(config.dimension()));
            case SQLITE_VEC -> loadExtension(connection, config)
                ? initialize(connection, new SqliteVecIndex(config.dimension()))
                : Optional.empty();
            case AUTO -> {
                if (wantsExtension(config) && loadExtension(connection, config)) {
                    Optional<VectorIndex> vec = initialize(connection, new SqliteVecIndex(config.dimension()));
                    if (vec.isPresent()) {
                        yield vec;
                    }
                }
                yield initialize(connection, new BlobVectorIndex(config.dimension()));
            }
        };
    }

    private static boolean loadExtension(Connection connection, VectorConfig config) {
        Optional<String> problem = checkExtension(config);
        if (problem.isPresent()) {
            LOG.warn("Vector extension unavailable: {}", problem.get());
            return false;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT load_extension(?)")) {
            statement.setString(1, config.extensionPath());
            statement.execute();
            return true;
        } catch (SQLException e) {
            LOG.warn("Vector extension failed to load from {}: {}", config.extensionPath(), e.getMessage());
            return false;
        }
    }

    private static Optional<VectorIndex> initialize(Connection connection, VectorIndex index) {
        try {
            index.initialize(connection);
            return Optional.of(index);
        } catch (SQLException e) {
            LOG.warn("Could not create {} vector table: {}", index.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private static Path resolveLibrary(String extensionPath) {
        Path path = Path.of(extensionPath);
        if (Files.exists(path)) {
            return path;
        }
        // load_extension appends the platform suffix when it is missing
        for (String suffix : new String[] {".so", ".dylib", ".dll"}) {
            Path candidate = Path.of(extensionPath + suffix);
            if (Files.exists(candidate)) {
                return candidate;
            }
        }
        return path;
    }
}
