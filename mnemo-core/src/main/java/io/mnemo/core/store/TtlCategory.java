package io.mnemo.core.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

public enum TtlCategory {
    PERMANENT(null),
    LONG_TERM(Duration.ofDays(90)),
    SHORT_TERM(Duration.ofDays(7)),
    EPHEMERAL(Duration.ofHours(24));

    private final Duration duration;

    TtlCategory(Duration duration) {
        this.duration = duration;
    }

    public Optional<Duration> duration() {
        return Optional.ofNullable(duration);
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Expiry for an entry written at {@code now}, or {@code null} when it never expires.
     */
    public Instant expiresAt(Instant now) {
        return duration == null ? null : now.plus(duration);
    }

    public static TtlCategory defaultFor(String type) {
        if (type == null) {
            return SHORT_TERM;
        }
        return switch (type) {
            case KnowledgeTypes.LESSON -> PERMANENT;
            case KnowledgeTypes.DECISION -> LONG_TERM;
            case KnowledgeTypes.SUMMARY -> SHORT_TERM;
            case KnowledgeTypes.TEMP_NOTE -> EPHEMERAL;
            default -> SHORT_TERM;
        };
    }

    public static TtlCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "permanent" -> PERMANENT;
            case "long_term" -> LONG_TERM;
            case "short_term" -> SHORT_TERM;
            case "ephemeral" -> EPHEMERAL;
            default -> throw new IllegalArgumentException("Unknown TTL category: " + value);
        };
    }
}
