package de.bsommerfeld.sixdegrees.search;

/**
 * Thrown when a search expands more people than {@code search.max-nodes}
 * allows. Says nothing about whether a path exists.
 */
public class SearchCeilingExceededException extends RuntimeException {

    private final int ceiling;

    public SearchCeilingExceededException(int ceiling) {
        super("Search gave up after expanding " + ceiling + " people");
        this.ceiling = ceiling;
    }

    public int getCeiling() {
        return ceiling;
    }
}
