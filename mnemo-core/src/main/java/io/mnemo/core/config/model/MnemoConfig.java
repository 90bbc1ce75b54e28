package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MnemoConfig(
    boolean enabled,
    StorageConfig storage,
    VectorConfig vector,
    SearchConfig search,
    DedupConfig dedup
) {

    public MnemoConfig {
        storage = storage == null ? StorageConfig.defaults() : storage;
        vector = vector == null ? VectorConfig.defaults() : vector;
        search = search == null ? SearchConfig.defaults() : search;
        dedup = dedup == null ? DedupConfig.defaults() : dedup;
    }

    public static MnemoConfig defaults() {
        return new MnemoConfig(
            true,
            StorageConfig.defaults(),
            VectorConfig.defaults(),
            SearchConfig.defaults(),
            DedupConfig.defaults()
        );
    }

    public MnemoConfig withStorage(StorageConfig storage) {
        return new MnemoConfig(enabled, storage, vector, search, dedup);
    }

    public MnemoConfig withVector(VectorConfig vector) {
        return new MnemoConfig(enabled, storage, vector, search, dedup);
    }
}
