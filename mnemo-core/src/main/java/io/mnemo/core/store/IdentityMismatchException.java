package io.mnemo.core.store;

import java.sql.SQLException;

/**
 * A record row and its vector row ended up with different identities. Always aborts the
 * surrounding transaction.
 */
public final class IdentityMismatchException extends SQLException {

    public IdentityMismatchException(long recordId, long vectorId) {
        super("Rowid mismatch: knowledge=" + recordId + ", vector=" + vectorId);
    }
}
