package de.bsommerfeld.sixdegrees.search;

import de.bsommerfeld.sixdegrees.core.domain.Person;

import java.util.List;

/**
 * Result of resolving user input to a person.
 *
 * @param outcome    which of the three cases applies
 * @param matches    every matching person, least known first
 * @param candidates the matches worth showing to a user: those with at least
 *                   one known-for title present in the store
 */
public record Resolution(Outcome outcome, List<Person> matches, List<Person> candidates) {

    public enum Outcome {
        EXACT_MATCH,
        AMBIGUOUS,
        NOT_FOUND
    }

    public Resolution {
        matches = List.copyOf(matches);
        candidates = List.copyOf(candidates);
    }

    static Resolution exact(Person person) {
        return new Resolution(Outcome.EXACT_MATCH, List.of(person), List.of(person));
    }

    static Resolution ambiguous(List<Person> matches, List<Person> candidates) {
        return new Resolution(Outcome.AMBIGUOUS, matches, candidates);
    }

    static Resolution notFound() {
        return new Resolution(Outcome.NOT_FOUND, List.of(), List.of());
    }

    /**
     * @throws IllegalStateException unless the outcome is
     *                               {@link Outcome#EXACT_MATCH}
     */
    public Person person() {
        if (outcome != Outcome.EXACT_MATCH)
            throw new IllegalStateException("No unique person: " + outcome);
        return matches.get(0);
    }
}
