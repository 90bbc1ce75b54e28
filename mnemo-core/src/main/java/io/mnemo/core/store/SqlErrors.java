package io.mnemo.core.store;

import java.sql.SQLException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

public final class SqlErrors {

    private SqlErrors() {
    }

    /**
     * True for {@code SQLITE_BUSY}/{@code SQLITE_LOCKED} and their extended codes.
     */
    public static boolean isLockContention(SQLException e) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            int code = -1;
            if (current instanceof SQLiteException sqlite) {
                code = sqlite.getResultCode().code;
            } else if (current instanceof SQLException sql) {
                code = sql.getErrorCode();
            }
            int primary = code & 0xff;
            if (code > 0 && (primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code)) {
                return true;
            }
        }
        return false;
    }

    public static StoreError classify(SQLException e) {
        if (e instanceof IdentityMismatchException) {
            return StoreError.IDENTITY_MISMATCH;
        }
        return isLockContention(e) ? StoreError.LOCKED : StoreError.STORAGE_ERROR;
    }
}
