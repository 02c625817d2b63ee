package de.bsommerfeld.sixdegrees.search;

import de.bsommerfeld.sixdegrees.core.domain.Movie;
import de.bsommerfeld.sixdegrees.core.domain.Person;
import de.bsommerfeld.sixdegrees.core.domain.RoleCategory;

/**
 * One hop of a path: two people and the movie that connects them.
 */
public record Link(Person from, RoleCategory fromRole, Movie movie, Person to, RoleCategory toRole) {

    /** e.g. "Kevin Bacon was an actor in Footloose (1984) where John Lithgow was an actor." */
    public String sentence() {
        StringBuilder sb = new StringBuilder()
                .append(from.name()).append(' ').append(fromRole.phrase())
                .append(" in ").append(movie.title());
        if (movie.year() != null)
            sb.append(" (").append(movie.year()).append(')');
        return sb.append(" where ")
                .append(to.name()).append(' ').append(toRole.phrase())
                .append('.')
                .toString();
    }
}
