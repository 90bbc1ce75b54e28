package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Where stores live and how each SQLite connection is tuned.
 *
 * @param globalRoot      directory holding global-scope stores; {@code ~/} is expanded
 * @param projectStateDir directory holding project-scope stores, relative to the project root
 * @param busyTimeoutMs   how long a statement waits on a locked database before failing with
 *                        {@code SQLITE_BUSY}; bounds how long writers in other processes can stall reads
 * @param cacheSizeKib    page cache size per connection
 * @param cleanupOnOpen   sweep expired entries whenever a store is first opened
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String globalRoot,
    String projectStateDir,
    int busyTimeoutMs,
    int cacheSizeKib,
    boolean cleanupOnOpen
) {

    public static StorageConfig defaults() {
        return new StorageConfig(
            "~/.mnemo/knowledge",
            ".mnemo/knowledge",
            5_000,
            10_000,
            true
        );
    }
}
