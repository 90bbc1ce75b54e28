package io.mnemo.core.search;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns free text into an FTS5 query that cannot fail to parse: query syntax characters are
 * dropped and every remaining token is quoted, so the query matches entries containing all tokens.
 */
public final class FtsQuerySanitizer {
    private static final Pattern SPECIAL = Pattern.compile("[(){}\\[\\]^\"~*?:\\\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FtsQuerySanitizer() {
    }

    /**
     * @return the sanitized query, or an empty string when nothing searchable is left
     */
    public static String sanitize(String query) {
        List<String> tokens = tokens(query);
        if (tokens.isEmpty()) {
            return "";
        }
        List<String> quoted = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            quoted.add("\"" + token + "\"");
        }
        return String.join(" ", quoted);
    }

    static List<String> tokens(String query) {
        if (query == null) {
            return List.of();
        }
        String stripped = SPECIAL.matcher(query).replaceAll(" ").trim();
        if (stripped.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(stripped));
    }
}
