package io.mnemo.core.dedup;

import io.mnemo.core.store.ContentHash;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normal form used to catch submissions that differ only in case, spacing or closing punctuation.
 */
public final class ContentCanonicalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{Punct}\\s]+$");

    private ContentCanonicalizer() {
    }

    public static String canonicalize(String content) {
        if (content == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(content.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        return TRAILING_PUNCTUATION.matcher(collapsed).replaceAll("");
    }

    public static String canonicalHash(String content) {
        return ContentHash.sha256(canonicalize(content));
    }
}
