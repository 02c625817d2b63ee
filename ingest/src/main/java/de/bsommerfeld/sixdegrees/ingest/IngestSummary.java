package de.bsommerfeld.sixdegrees.ingest;

import de.bsommerfeld.sixdegrees.db.StoreTable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a full rebuild.
 *
 * @param loads     one report per loaded table, in load order
 * @param cleaning  rows removed by the cleaning stage
 * @param rowCounts rows per table in the finished store
 */
public record IngestSummary(List<LoadReport> loads, CleaningReport cleaning, Map<StoreTable, Long> rowCounts) {

    public IngestSummary {
        loads = List.copyOf(loads);
        EnumMap<StoreTable, Long> copy = new EnumMap<>(StoreTable.class);
        copy.putAll(rowCounts);
        rowCounts = Collections.unmodifiableMap(copy);
    }

    public LoadReport load(StoreTable table) {
        return loads.stream()
                .filter(r -> r.table() == table)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No load report for " + table));
    }

    public long rowCount(StoreTable table) {
        return rowCounts.getOrDefault(table, 0L);
    }
}
