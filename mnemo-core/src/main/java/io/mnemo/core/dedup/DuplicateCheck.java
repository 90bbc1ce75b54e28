package io.mnemo.core.dedup;

/**
 * Result of the duplicate cascade for one piece of content.
 *
 * @param existingId    matched entry, or {@code -1} when nothing matched
 * @param similarity    1.0 for an exact hash match, the configured canonical similarity for a
 *                      canonical match, the best cosine for an embedding match, otherwise 0
 * @param canonicalHash canonical hash of the submitted content
 */
public record DuplicateCheck(DedupStage stage, long existingId, double similarity, String canonicalHash) {

    public static DuplicateCheck none(String canonicalHash) {
        return new DuplicateCheck(DedupStage.NONE, -1L, 0.0, canonicalHash);
    }

    public boolean isMatch() {
        return stage != DedupStage.NONE && existingId > 0;
    }
}
