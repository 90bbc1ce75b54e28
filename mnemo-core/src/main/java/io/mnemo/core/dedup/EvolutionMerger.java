package io.mnemo.core.dedup;

import io.mnemo.core.store.EvolutionRecord;
import io.mnemo.core.store.KnowledgeEntry;
import io.mnemo.core.store.KnowledgeMetadata;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds new content into an existing entry as a dated update paragraph.
 */
public final class EvolutionMerger {
    static final String SEPARATOR = "\n\nUpdate: ";
    static final int PREVIEW_LENGTH = 100;

    private final int historyLimit;

    public EvolutionMerger(int historyLimit) {
        this.historyLimit = Math.max(1, historyLimit);
    }

    public Merged merge(KnowledgeEntry existing, String newContent, double similarity, Instant now) {
        String date = LocalDate.ofInstant(now, ZoneOffset.UTC).toString();
        String content = existing.content() + SEPARATOR + "[" + date + "] " + newContent;

        KnowledgeMetadata current = existing.metadata();
        int evolutionCount = current.evolutionCount() + 1;
        List<EvolutionRecord> history = new ArrayList<>(current.evolutionHistory());
        history.add(new EvolutionRecord(date, preview(newContent), similarity));
        if (history.size() > historyLimit) {
            history = new ArrayList<>(history.subList(history.size() - historyLimit, history.size()));
        }

        KnowledgeMetadata metadata = current
            .with(KnowledgeMetadata.EVOLUTION_COUNT, evolutionCount)
            .with(KnowledgeMetadata.LAST_EVOLUTION, now.toEpochMilli())
            .withEvolutionHistory(history);
        return new Merged(content, metadata, evolutionCount);
    }

    private static String preview(String content) {
        return content.length() <= PREVIEW_LENGTH ? content : content.substring(0, PREVIEW_LENGTH);
    }

    public record Merged(String content, KnowledgeMetadata metadata, int evolutionCount) {
    }
}
