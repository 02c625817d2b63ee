package de.bsommerfeld.sixdegrees.core.event;

/**
 * Progress events published while the graph store is rebuilt.
 */
public class IngestEvents {

    /** A batch was committed; {@code rowsSoFar} counts inserted rows of the table. */
    public record BatchCommitted(String table, long rowsSoFar) {
    }

    /** A table finished loading. */
    public record TableLoaded(String table, long inserted, long skipped) {
    }

    /** The cleaning stage finished; {@code deletedRows} sums all steps. */
    public record CleaningFinished(long deletedRows) {
    }
}
