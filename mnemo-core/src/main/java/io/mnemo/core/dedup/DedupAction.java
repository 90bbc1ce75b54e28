package io.mnemo.core.dedup;

public enum DedupAction {
    CREATED,
    EVOLVED,
    SKIPPED,
    FAILED
}
