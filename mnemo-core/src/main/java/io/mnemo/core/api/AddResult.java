package io.mnemo.core.api;

import io.mnemo.core.store.StoreError;
import io.mnemo.core.store.WriteResult;

/**
 * Outcome of {@link KnowledgeService#add}: either the stored entry's identity, or a skip with a reason.
 */
public record AddResult(boolean skipped, long id, String contentHash, String reason, StoreError error) {

    public static AddResult added(WriteResult result) {
        return new AddResult(false, result.id(), result.contentHash(), null, null);
    }

    public static AddResult skipped(StoreError error, String reason) {
        return new AddResult(true, -1L, null, reason, error);
    }
}
