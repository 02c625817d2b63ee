package de.bsommerfeld.sixdegrees.core.domain;

/**
 * An appearance edge: one person credited on one movie. The store keeps at
 * most one edge per (person, movie) pair, whatever the role.
 */
public record Appearance(int personId, int movieId, RoleCategory role) {
}
