package io.mnemo.core.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extensible key-value metadata attached to an entry and persisted as JSON.
 *
 * <p>Recognized keys:</p>
 * <ul>
 *   <li>{@code confidence}: number in [0, 1]</li>
 *   <li>{@code source}: who produced the entry</li>
 *   <li>{@code project_slug}: owning project, also indexed for search filters</li>
 *   <li>{@code tags}: list of strings</li>
 *   <li>{@code evolution_count}: how many times new content was merged in</li>
 *   <li>{@code evolution_history}: the latest merges, oldest first</li>
 *   <li>{@code last_evolution}: epoch millis of the latest merge</li>
 *   <li>{@code canonical_hash}: hash of the normalized content used for near-duplicate lookup</li>
 * </ul>
 * Any other key is kept as-is. Values are normalized to their JSON form on construction, so an
 * instance compares equal to itself after a store round trip.
 */
public final class KnowledgeMetadata {
    public static final String CONFIDENCE = "confidence";
    public static final String SOURCE = "source";
    public static final String PROJECT_SLUG = "project_slug";
    public static final String TAGS = "tags";
    public static final String EVOLUTION_COUNT = "evolution_count";
    public static final String EVOLUTION_HISTORY = "evolution_history";
    public static final String LAST_EVOLUTION = "last_evolution";
    public static final String CANONICAL_HASH = "canonical_hash";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<EvolutionRecord>> HISTORY_TYPE = new TypeReference<>() {
    };
    private static final KnowledgeMetadata EMPTY = new KnowledgeMetadata(Map.of());

    private final Map<String, Object> values;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    private KnowledgeMetadata(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(normalize(values));
    }

    public static KnowledgeMetadata empty() {
        return EMPTY;
    }

    public static KnowledgeMetadata of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new KnowledgeMetadata(new LinkedHashMap<>(values));
    }

    public static KnowledgeMetadata fromJson(String json) {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        try {
            return new KnowledgeMetadata(MAPPER.readValue(json, MAP_TYPE));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid metadata JSON", e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metadata", e);
        }
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public KnowledgeMetadata with(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        Map<String, Object> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new KnowledgeMetadata(copy);
    }

    public KnowledgeMetadata merge(KnowledgeMetadata other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(other.values);
        return new KnowledgeMetadata(copy);
    }

    public Double confidence() {
        Object value = values.get(CONFIDENCE);
        return value instanceof Number number ? number.doubleValue() : null;
    }

    public String source() {
        return string(SOURCE);
    }

    public String projectSlug() {
        return string(PROJECT_SLUG);
    }

    public String canonicalHash() {
        return string(CANONICAL_HASH);
    }

    public List<String> tags() {
        Object value = values.get(TAGS);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> tags = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) {
                tags.add(String.valueOf(item));
            }
        }
        return List.copyOf(tags);
    }

    public int evolutionCount() {
        Object value = values.get(EVOLUTION_COUNT);
        return value instanceof Number number ? number.intValue() : 0;
    }

    public Long lastEvolution() {
        Object value = values.get(LAST_EVOLUTION);
        return value instanceof Number number ? number.longValue() : null;
    }

    public List<EvolutionRecord> evolutionHistory() {
        Object value = values.get(EVOLUTION_HISTORY);
        if (!(value instanceof List<?>)) {
            return List.of();
        }
        return List.copyOf(MAPPER.convertValue(value, HISTORY_TYPE));
    }

    public KnowledgeMetadata withEvolutionHistory(List<EvolutionRecord> history) {
        return with(EVOLUTION_HISTORY, history == null ? null : MAPPER.convertValue(history, Object.class));
    }

    private String string(String key) {
        Object value = values.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static Map<String, Object> normalize(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(MAPPER.writeValueAsBytes(raw), MAP_TYPE);
        } catch (IOException e) {
            throw new IllegalArgumentException("Metadata values must be JSON-serializable", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof KnowledgeMetadata other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "KnowledgeMetadata" + values;
    }
}
