package de.bsommerfeld.sixdegrees.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PersonTest {

    @Test
    void knownForMovieIds_shouldParseInDumpOrder() {
        var person = new Person(102, "Kevin Bacon", 1958, null, "tt0087277,tt0164052,tt0327056");
        assertEquals(List.of(87277, 164052, 327056), person.knownForMovieIds());
    }

    @Test
    void knownForMovieIds_shouldBeEmptyWhenAbsent() {
        assertTrue(new Person(1, "A", null, null, null).knownForMovieIds().isEmpty());
        assertTrue(new Person(1, "A", null, null, " ").knownForMovieIds().isEmpty());
    }

    @Test
    void knownForMovieIds_shouldFailOnMalformedToken() {
        var person = new Person(1, "A", null, null, "tt0087277,ttXYZ");
        assertThrows(MalformedIdException.class, person::knownForMovieIds);
    }
}
