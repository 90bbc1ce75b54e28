package io.mnemo.core.vector;

import io.mnemo.core.config.model.VectorConfig;
import java.sql.Connection;
import java.util.Optional;

/**
 * Chooses and prepares the vector backend for a freshly opened connection. An empty result means
 * the store runs without vector support.
 */
@FunctionalInterface
public interface VectorIndexFactory {

    Optional<VectorIndex> open(Connection connection, VectorConfig config);
}
