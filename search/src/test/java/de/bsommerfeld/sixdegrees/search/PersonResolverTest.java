package de.bsommerfeld.sixdegrees.search;

import de.bsommerfeld.sixdegrees.core.domain.Person;
import de.bsommerfeld.sixdegrees.db.SqliteGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PersonResolverTest {

    @TempDir
    Path tempDir;

    private SqliteGraphStore store;
    private PersonResolver resolver;

    @BeforeEach
    void setUp() throws SQLException {
        store = SearchFixtures.store(tempDir);
        resolver = new PersonResolver(store);
    }

    // -- Names --

    @Test
    void resolve_fullName_shouldMatchExactly() {
        Resolution r = resolver.resolve("Kevin Bacon");

        assertEquals(Resolution.Outcome.EXACT_MATCH, r.outcome());
        assertEquals(1, r.person().id());
    }

    @Test
    void resolve_shouldIgnoreCaseAndSurroundingWhitespace() {
        assertEquals(1, resolver.resolve("  bacon ").person().id());
        assertEquals(3, resolver.resolve("TOM HANKS").person().id());
    }

    @Test
    void resolve_partialToken_shouldNotMatch() {
        assertEquals(Resolution.Outcome.NOT_FOUND, resolver.resolve("Baco").outcome());
        assertEquals(Resolution.Outcome.NOT_FOUND, resolver.resolve("vin Bac").outcome());
    }

    @Test
    void resolve_nonAsciiName_shouldFoldCase() {
        Resolution r = resolver.resolve("ZOË saldaña");

        assertEquals(Resolution.Outcome.EXACT_MATCH, r.outcome());
        assertEquals(30, r.person().id());
    }

    @Test
    void resolve_sharedName_shouldBeAmbiguousLeastKnownFirst() {
        Resolution r = resolver.resolve("chris evans");

        assertEquals(Resolution.Outcome.AMBIGUOUS, r.outcome());
        assertEquals(List.of(20, 21, 22), ids(r.matches()));
        // 20 has no known-for list, 21 only titles outside the store
        assertEquals(List.of(22), ids(r.candidates()));
        assertThrows(IllegalStateException.class, r::person);
    }

    @Test
    void resolve_ambiguous_shouldFilterCandidatesOnOneConnection() throws SQLException {
        SqliteGraphStore counting = spy(store);

        Resolution r = new PersonResolver(counting).resolve("Evans");

        assertEquals(4, r.matches().size());
        verify(counting, times(1)).openConnection();
    }

    @Test
    void resolve_ambiguousTies_shouldBreakById() {
        Resolution r = resolver.resolve("Evans");

        // known-for lengths 0, 9, 9, 19
        assertEquals(List.of(20, 21, 23, 22), ids(r.matches()));
    }

    @Test
    void resolve_ambiguous_shouldOrderByKnownForAndHideUnknowns() throws SQLException {
        try (Connection conn = store.openConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("INSERT INTO people (id, name, known_for) VALUES"
                    + " (50, 'Alex Morgan', 'tt0000001,tt0000002,tt0000003,tt0000004,tt0000005'),"
                    + " (51, 'Alex Morgan', NULL),"
                    + " (52, 'Alex Morgan', 'tt0000001,tt0000002')");
        }

        Resolution r = resolver.resolve("alex morgan");

        assertEquals(Resolution.Outcome.AMBIGUOUS, r.outcome());
        assertEquals(List.of(51, 52, 50), ids(r.matches()));
        assertEquals(List.of(52, 50), ids(r.candidates()));
        // still reachable by id
        assertEquals(51, resolver.resolve("51").person().id());
    }

    // -- Keys --

    @Test
    void resolve_digits_shouldLookUpKey() {
        Resolution r = resolver.resolve(" 5 ");

        assertEquals(Resolution.Outcome.EXACT_MATCH, r.outcome());
        assertEquals("Clint Eastwood", r.person().name());
    }

    @Test
    void resolve_digits_shouldAcceptFullIntRangeAndLeadingZeros() throws SQLException {
        try (Connection conn = store.openConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("INSERT INTO people (id, name) VALUES (1234567890, 'Tenth Digit')");
        }

        assertEquals("Tenth Digit", resolver.resolve("1234567890").person().name());
        assertEquals("Kevin Bacon", resolver.resolve("00000000001").person().name());
        assertEquals(Resolution.Outcome.NOT_FOUND, resolver.resolve("0").outcome());
    }

    @Test
    void parseKey_shouldRejectValuesBeyondIntRange() {
        assertEquals(OptionalInt.of(Integer.MAX_VALUE), PersonResolver.parseKey("2147483647"));
        assertEquals(OptionalInt.of(7), PersonResolver.parseKey("0000000000000007"));
        assertEquals(OptionalInt.of(0), PersonResolver.parseKey("000"));
        assertEquals(OptionalInt.empty(), PersonResolver.parseKey("2147483648"));
        assertEquals(OptionalInt.empty(), PersonResolver.parseKey("99999999999999999999"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "999", "00000000999", "2147483648", "12345678901", "", "   ", "Nobody" })
    void resolve_unknownInput_shouldBeNotFound(String input) {
        Resolution r = resolver.resolve(input);

        assertEquals(Resolution.Outcome.NOT_FOUND, r.outcome());
        assertTrue(r.matches().isEmpty());
    }

    @Test
    void resolve_null_shouldBeNotFound() {
        assertEquals(Resolution.Outcome.NOT_FOUND, resolver.resolve(null).outcome());
    }

    // -- Known-for --

    @Test
    void knownForTitles_shouldKeepDumpOrder() {
        Person bacon = resolver.findById(1).orElseThrow();

        assertEquals(List.of("Footloose", "Apollo 13"), resolver.knownForTitles(bacon));
    }

    @Test
    void knownForTitles_shouldSkipMissingAndMalformedTitles() {
        assertEquals(List.of(), resolver.knownForTitles(new Person(21, "Chris Evans", 1985, null, "tt0000099")));
        assertEquals(List.of(), resolver.knownForTitles(new Person(40, "X", null, null, "garbage")));
        assertEquals(List.of(), resolver.knownForTitles(new Person(41, "Y", null, null, null)));
    }

    @Test
    void likePattern_shouldEscapeWildcards() {
        assertEquals("%100\\%\\_a\\\\b%", PersonResolver.likePattern("100%_a\\b"));
        assertEquals("%", PersonResolver.likePattern("Zoë"));
    }

    private static List<Integer> ids(List<Person> people) {
        return people.stream().map(Person::id).collect(Collectors.toList());
    }
}
