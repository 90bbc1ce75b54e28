package io.mnemo.core.dedup;

import io.mnemo.core.store.StoreError;

/**
 * Outcome of routing one submission through the duplicate cascade.
 *
 * @param id     entry created or evolved, or the existing entry a skipped submission matched
 * @param reason why a submission was skipped, e.g. {@code duplicate_hash}; {@code null} otherwise
 */
public record IngestResult(
    DedupAction action,
    long id,
    DedupStage stage,
    double similarity,
    int evolutionCount,
    String reason,
    StoreError error
) {

    public static IngestResult created(long id, double similarity) {
        return new IngestResult(DedupAction.CREATED, id, DedupStage.NONE, similarity, 0, null, null);
    }

    public static IngestResult evolved(long id, DedupStage stage, double similarity, int evolutionCount) {
        return new IngestResult(DedupAction.EVOLVED, id, stage, similarity, evolutionCount, null, null);
    }

    public static IngestResult skipped(long id, DedupStage stage, double similarity) {
        return new IngestResult(DedupAction.SKIPPED, id, stage, similarity, 0, "duplicate_" + stage.value(), null);
    }

    public static IngestResult failed(StoreError error, String message) {
        return new IngestResult(DedupAction.FAILED, -1L, DedupStage.NONE, 0.0, 0, message, error);
    }

    public boolean success() {
        return action != DedupAction.FAILED;
    }
}
