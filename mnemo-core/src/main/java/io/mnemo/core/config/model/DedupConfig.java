package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DedupConfig(
    double duplicateThreshold,
    double evolveThreshold,
    double canonicalSimilarity,
    int neighborCount,
    int historyLimit
) {

    public DedupConfig {
        if (evolveThreshold > duplicateThreshold) {
            throw new IllegalArgumentException("evolveThreshold must not exceed duplicateThreshold");
        }
        neighborCount = Math.max(1, neighborCount);
        historyLimit = Math.max(1, historyLimit);
    }

    public static DedupConfig defaults() {
        return new DedupConfig(0.88, 0.65, 0.9, 5, 10);
    }
}
