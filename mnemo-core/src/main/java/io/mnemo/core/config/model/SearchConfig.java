package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchConfig(
    int rrfK,
    int candidateMultiplier,
    int vectorOverFetch,
    int defaultLimit,
    Map<String, Double> typeWeights
) {

    public SearchConfig {
        rrfK = rrfK <= 0 ? 60 : rrfK;
        candidateMultiplier = Math.max(1, candidateMultiplier);
        vectorOverFetch = Math.max(1, vectorOverFetch);
        defaultLimit = defaultLimit <= 0 ? 10 : defaultLimit;
        typeWeights = typeWeights == null ? Map.of() : Map.copyOf(typeWeights);
    }

    public static SearchConfig defaults() {
        return new SearchConfig(
            60,
            3,
            3,
            10,
            Map.of(
                "decision", 2.0,
                "lesson", 2.0,
                "summary", 0.5,
                "temp_note", 0.3
            )
        );
    }

    public double typeWeight(String type) {
        if (type == null) {
            return 1.0;
        }
        return typeWeights.getOrDefault(type, 1.0);
    }
}
