package io.mnemo.core.lifecycle;

import java.util.List;

public record CleanupResult(int deleted, List<Long> ids) {

    public CleanupResult {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    public static CleanupResult none() {
        return new CleanupResult(0, List.of());
    }
}
