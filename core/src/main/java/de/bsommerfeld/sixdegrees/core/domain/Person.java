package de.bsommerfeld.sixdegrees.core.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * A row of the {@code people} table.
 *
 * @param id       key derived from the {@code nm} identifier
 * @param name     display name
 * @param birth    birth year, {@code null} if unknown
 * @param death    death year, {@code null} if unknown or alive
 * @param knownFor raw comma-separated {@code tt} identifiers, {@code null} if
 *                 the dump has none
 */
public record Person(
        int id,
        String name,
        Integer birth,
        Integer death,
        String knownFor) {

    /**
     * Parses {@link #knownFor()} into movie keys, preserving dump order. The
     * referenced movies need not exist in the store.
     */
    public List<Integer> knownForMovieIds() {
        List<Integer> ids = new ArrayList<>();
        if (knownFor == null || knownFor.isBlank())
            return ids;
        for (String token : knownFor.split(",")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty())
                ids.add(ExternalId.parse(ExternalId.MOVIE_PREFIX, trimmed));
        }
        return ids;
    }
}
