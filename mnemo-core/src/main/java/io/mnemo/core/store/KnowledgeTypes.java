package io.mnemo.core.store;

/**
 * Well-known entry types. Callers may store any other non-blank type string.
 */
public final class KnowledgeTypes {
    public static final String DECISION = "decision";
    public static final String LESSON = "lesson";
    public static final String SUMMARY = "summary";
    public static final String TEMP_NOTE = "temp_note";

    private KnowledgeTypes() {
    }
}
