package de.bsommerfeld.sixdegrees.ingest;

/** Cleaning steps in execution order. */
public enum CleaningStep {
    ADULT_MOVIES,
    EXCLUDED_TITLE_TYPES,
    UNPOPULAR_MOVIES,
    EXCLUDED_GENRES,
    ORPHAN_PEOPLE
}
