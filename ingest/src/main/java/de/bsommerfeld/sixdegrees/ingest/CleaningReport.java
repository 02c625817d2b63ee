package de.bsommerfeld.sixdegrees.ingest;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rows deleted by each cleaning step. Counts cover the rows of the table a
 * step targets; cascaded ratings and edges are not included.
 */
public record CleaningReport(Map<CleaningStep, Long> deleted) {

    public CleaningReport {
        EnumMap<CleaningStep, Long> copy = new EnumMap<>(CleaningStep.class);
        copy.putAll(deleted);
        deleted = Collections.unmodifiableMap(copy);
    }

    public long deleted(CleaningStep step) {
        return deleted.getOrDefault(step, 0L);
    }

    public long total() {
        return deleted.values().stream().mapToLong(Long::longValue).sum();
    }
}
