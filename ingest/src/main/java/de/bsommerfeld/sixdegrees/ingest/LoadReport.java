package de.bsommerfeld.sixdegrees.ingest;

import de.bsommerfeld.sixdegrees.db.StoreTable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of loading one dump into one table: how many rows went in and how
 * many were dropped for which reason. Callers and tests assert on these
 * counts instead of parsing log output.
 *
 * @param table    the table that was rebuilt
 * @param inserted rows written
 * @param dropped  rows not written, by outcome; never contains
 *                 {@link RowOutcome#INSERTED}
 */
public record LoadReport(StoreTable table, long inserted, Map<RowOutcome, Long> dropped) {

    public LoadReport {
        EnumMap<RowOutcome, Long> copy = new EnumMap<>(RowOutcome.class);
        copy.putAll(dropped);
        dropped = Collections.unmodifiableMap(copy);
    }

    public long dropped(RowOutcome outcome) {
        return dropped.getOrDefault(outcome, 0L);
    }

    /** Rows that count as skipped, i.e. everything dropped except benign duplicates. */
    public long skipped() {
        long total = 0;
        for (Map.Entry<RowOutcome, Long> e : dropped.entrySet()) {
            if (e.getKey().countsAsSkip())
                total += e.getValue();
        }
        return total;
    }

    /** Skipped rows over all rows that were either inserted or skipped; 0 for an empty dump. */
    public double skipRatio() {
        long skipped = skipped();
        long considered = inserted + skipped;
        return considered == 0 ? 0.0 : (double) skipped / considered;
    }

    static Builder builder(StoreTable table) {
        return new Builder(table);
    }

    static final class Builder {
        private final StoreTable table;
        private final EnumMap<RowOutcome, Long> dropped = new EnumMap<>(RowOutcome.class);
        private long inserted;

        private Builder(StoreTable table) {
            this.table = table;
        }

        void record(RowOutcome outcome) {
            if (outcome == RowOutcome.INSERTED) {
                inserted++;
            } else {
                dropped.merge(outcome, 1L, Long::sum);
            }
        }

        long inserted() {
            return inserted;
        }

        LoadReport build() {
            return new LoadReport(table, inserted, dropped);
        }
    }
}
