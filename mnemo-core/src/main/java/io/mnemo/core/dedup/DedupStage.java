package io.mnemo.core.dedup;

import java.util.Locale;

/**
 * Which step of the duplicate cascade produced a match.
 */
public enum DedupStage {
    NONE,
    HASH,
    CANONICAL,
    EMBEDDING;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
