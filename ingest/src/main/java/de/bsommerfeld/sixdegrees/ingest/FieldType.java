package de.bsommerfeld.sixdegrees.ingest;

/**
 * Semantic type of a raw dump field, deciding how {@link FieldNormalizer}
 * converts it.
 */
public enum FieldType {

    /** Whole number; anything but digits or the sentinel is corruption. */
    INTEGER,

    /** Decimal number such as an average rating. */
    DECIMAL,

    /** Free text, kept verbatim. */
    TEXT,

    /** Short code out of a closed vocabulary, kept verbatim. */
    CATEGORY
}
