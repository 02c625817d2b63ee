package de.bsommerfeld.sixdegrees.search;

import java.util.Set;

/**
 * Neighbors of a person in the co-appearance graph: everyone who shares at
 * least one movie with them, never the person themselves.
 */
@FunctionalInterface
public interface AdjacencyLookup {

    Set<Integer> neighbors(int personId);
}
