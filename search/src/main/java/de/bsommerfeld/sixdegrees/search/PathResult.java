package de.bsommerfeld.sixdegrees.search;

import java.util.List;

/**
 * Outcome of a completed search.
 *
 * @param path     person keys from start to target inclusive; empty when the
 *                 two are not connected
 * @param expanded number of people whose neighbors were looked up
 */
public record PathResult(List<Integer> path, int expanded) {

    public PathResult {
        path = List.copyOf(path);
    }

    static PathResult found(List<Integer> path, int expanded) {
        return new PathResult(path, expanded);
    }

    static PathResult noPath(int expanded) {
        return new PathResult(List.of(), expanded);
    }

    public boolean isFound() {
        return !path.isEmpty();
    }

    /** Number of edges on the path; -1 without a path. */
    public int hops() {
        return path.size() - 1;
    }
}
