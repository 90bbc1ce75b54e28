package io.mnemo.core.store;

import java.util.Locale;

public enum StoreError {
    /** Storage driver or vector capability missing. */
    UNAVAILABLE,
    NOT_FOUND,
    /** Record and vector rows disagree on identity; the transaction was rolled back. */
    IDENTITY_MISMATCH,
    /** Database stayed locked past the busy timeout; retryable. */
    LOCKED,
    UNSUPPORTED_OPERATION,
    INVALID_ARGUMENT,
    STORAGE_ERROR;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
