package io.mnemo.core.lifecycle;

/**
 * Access counters aggregated over the entries of one type.
 */
public record AccessStats(
    String type,
    int entries,
    long totalAccesses,
    double averageAccesses,
    int neverAccessed
) {
}
