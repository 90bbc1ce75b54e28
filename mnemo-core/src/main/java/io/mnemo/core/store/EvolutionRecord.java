package io.mnemo.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One merge of new content into an existing entry.
 *
 * @param date           merge date, {@code yyyy-MM-dd}
 * @param contentPreview first 100 characters of the merged-in content
 * @param similarity     similarity that triggered the merge
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvolutionRecord(
    @JsonProperty("date") String date,
    @JsonProperty("content_preview") String contentPreview,
    @JsonProperty("similarity") double similarity
) {
}
