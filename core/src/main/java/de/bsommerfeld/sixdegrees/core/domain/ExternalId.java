package de.bsommerfeld.sixdegrees.core.domain;

/**
 * Converts the dataset's external identifiers into the integer keys used by
 * the graph store, and back.
 *
 * <p>
 * Every id-bearing column of the dumps holds a fixed two-letter prefix
 * followed by a zero-padded decimal number ({@code nm0000102},
 * {@code tt0087277}). The store key is that number with the prefix stripped
 * and the leading zeros dropped. The same rule applies to every entity type,
 * only the prefix differs.
 */
public final class ExternalId {

    /** Prefix of person identifiers ({@code name.basics}, {@code title.principals}). */
    public static final String PERSON_PREFIX = "nm";

    /** Prefix of title identifiers ({@code title.basics}, {@code title.ratings}). */
    public static final String MOVIE_PREFIX = "tt";

    private static final int PADDED_WIDTH = 7;

    private ExternalId() {
    }

    /**
     * Parses {@code raw} into its integer key.
     *
     * @param prefix the expected two-letter prefix
     * @param raw    the external identifier as it appears in the dump
     * @return the numeric remainder with leading zeros removed
     * @throws MalformedIdException if the prefix does not match or the remainder
     *                              is not a non-empty run of ASCII digits that
     *                              fits into an {@code int}
     */
    public static int parse(String prefix, String raw) {
        if (raw == null || !raw.startsWith(prefix)) {
            throw new MalformedIdException("Expected '" + prefix + "' identifier but got: " + raw);
        }
        String digits = raw.substring(prefix.length());
        if (digits.isEmpty()) {
            throw new MalformedIdException("Identifier has no numeric part: " + raw);
        }
        for (int i = 0; i < digits.length(); i++) {
            char ch = digits.charAt(i);
            if (ch < '0' || ch > '9') {
                throw new MalformedIdException("Identifier has a non-numeric remainder: " + raw);
            }
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new MalformedIdException("Identifier out of range: " + raw, e);
        }
    }

    /** Formats a key back into the dataset's zero-padded external form. */
    public static String format(String prefix, int id) {
        String digits = Integer.toString(id);
        StringBuilder sb = new StringBuilder(prefix);
        for (int i = digits.length(); i < PADDED_WIDTH; i++)
            sb.append('0');
        return sb.append(digits).toString();
    }
}
