package de.bsommerfeld.sixdegrees.ingest;

/**
 * What happened to a single dump row.
 */
public enum RowOutcome {

    INSERTED(false),

    /** Appearance row whose person is not in {@code people}. */
    MISSING_PERSON(true),

    /** Appearance or rating row whose movie is not in {@code movies}. */
    MISSING_MOVIE(true),

    /** Role category this build does not know: the dump format drifted. */
    UNKNOWN_ROLE(true),

    /** Second credit of the same person on the same movie. Benign. */
    DUPLICATE_PAIR(false);

    private final boolean countsAsSkip;

    RowOutcome(boolean countsAsSkip) {
        this.countsAsSkip = countsAsSkip;
    }

    /**
     * Whether the row counts toward the skip ratio that can fail a load.
     * Duplicates are dropped too but never indicate a problem.
     */
    public boolean countsAsSkip() {
        return countsAsSkip;
    }
}
