package io.mnemo.core.store;

import java.util.Locale;

public enum KnowledgeScope {
    GLOBAL,
    PROJECT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static KnowledgeScope fromString(String value) {
        if (value == null || value.isBlank()) {
            return PROJECT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "global" -> GLOBAL;
            case "project" -> PROJECT;
            default -> throw new IllegalArgumentException("Unknown scope: " + value);
        };
    }
}
