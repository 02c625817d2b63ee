package de.bsommerfeld.sixdegrees.core.domain;

/**
 * A row of the {@code ratings} table. Exactly one movie is referenced; the
 * row disappears with it.
 */
public record Rating(int movieId, Double average, Integer numVotes) {
}
