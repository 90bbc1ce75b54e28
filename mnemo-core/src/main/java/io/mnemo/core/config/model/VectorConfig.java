package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.vector.VectorMode;

/**
 * @param mode          which vector backend to use
 * @param extensionPath path of the sqlite-vec loadable extension, used by {@link VectorMode#SQLITE_VEC}
 *                      and {@link VectorMode#AUTO}
 * @param dimension     embedding dimension shared by every entry of a deployment
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VectorConfig(
    VectorMode mode,
    String extensionPath,
    int dimension
) {

    public VectorConfig {
        mode = mode == null ? VectorMode.AUTO : mode;
        extensionPath = extensionPath == null ? "" : extensionPath.trim();
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
    }

    public static VectorConfig defaults() {
        return new VectorConfig(VectorMode.AUTO, "", 512);
    }
}
