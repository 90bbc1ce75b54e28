package io.mnemo.core.dedup;

import java.util.List;

public record BatchResult(int created, int evolved, int skipped, List<BatchError> errors) {

    public BatchResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public int processed() {
        return created + evolved + skipped + errors.size();
    }

    /**
     * @param contentPreview first 50 characters of the failed submission
     */
    public record BatchError(String contentPreview, String message) {
    }
}
