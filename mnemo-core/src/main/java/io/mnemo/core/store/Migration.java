package io.mnemo.core.store;

import java.util.List;

public record Migration(int version, String description, List<String> statements) {

    public Migration {
        if (version <= 0) {
            throw new IllegalArgumentException("version must be > 0");
        }
        statements = List.copyOf(statements);
    }
}
