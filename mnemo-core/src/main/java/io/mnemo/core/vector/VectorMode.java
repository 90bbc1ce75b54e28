package io.mnemo.core.vector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum VectorMode {
    AUTO,
    SQLITE_VEC,
    BLOB,
    DISABLED;

    @JsonCreator
    public static VectorMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "sqlite_vec", "vec0" -> SQLITE_VEC;
            case "blob", "portable" -> BLOB;
            case "disabled", "off", "none" -> DISABLED;
            default -> AUTO;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
