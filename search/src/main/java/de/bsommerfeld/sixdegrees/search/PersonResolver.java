package de.bsommerfeld.sixdegrees.search;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.domain.MalformedIdException;
import de.bsommerfeld.sixdegrees.core.domain.Person;
import de.bsommerfeld.sixdegrees.db.GraphStore;
import de.bsommerfeld.sixdegrees.db.SqlLoader;
import de.bsommerfeld.sixdegrees.db.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Turns user input into a person of the graph store.
 *
 * <p>
 * Digits are taken as a person key. Anything else is matched against names
 * as a whole run of tokens, case-insensitively: {@code "Bacon"} matches
 * "Kevin Bacon" but {@code "Baco"} does not. Several matches are returned in
 * ascending order of known-for length, so the best known person comes last.
 */
@Singleton
public class PersonResolver {

    private static final Logger LOG = LoggerFactory.getLogger(PersonResolver.class);

    private final GraphStore store;

    @Inject
    public PersonResolver(GraphStore store) {
        this.store = store;
    }

    /**
     * @throws StoreException if the store cannot be queried
     */
    public Resolution resolve(String input) {
        if (input == null || input.isBlank())
            return Resolution.notFound();

        String trimmed = input.trim();
        if (isDigits(trimmed)) {
            OptionalInt key = parseKey(trimmed);
            if (key.isEmpty())
                return Resolution.notFound();
            return findById(key.getAsInt())
                    .map(Resolution::exact)
                    .orElseGet(Resolution::notFound);
        }
        return resolveName(trimmed);
    }

    public Optional<Person> findById(int id) {
        try (Connection conn = store.openConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-person-by-id"))) {
            ps.setInt(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(Rows.person(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to look up person " + id, e);
        }
    }

    /**
     * Titles of the person's known-for movies that exist in the store, in
     * dump order. Titles removed by cleaning are left out.
     */
    public List<String> knownForTitles(Person person) {
        try (Connection conn = store.openConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-movie-by-id"))) {
            return knownForTitles(ps, person);
        } catch (SQLException e) {
            throw new StoreException("Failed to resolve known-for titles of person " + person.id(), e);
        }
    }

    private Resolution resolveName(String name) {
        try (Connection conn = store.openConnection()) {
            List<Person> matches = findByName(conn, name);
            if (matches.isEmpty())
                return Resolution.notFound();
            if (matches.size() == 1)
                return Resolution.exact(matches.get(0));

            List<Person> candidates = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-movie-by-id"))) {
                for (Person p : matches) {
                    if (!knownForTitles(ps, p).isEmpty())
                        candidates.add(p);
                }
            }
            LOG.debug("'{}' matched {} people, {} with known titles", name, matches.size(), candidates.size());
            return Resolution.ambiguous(matches, candidates);
        } catch (SQLException e) {
            throw new StoreException("Failed to search people named '" + name + "'", e);
        }
    }

    private static List<String> knownForTitles(PreparedStatement selectMovie, Person person) throws SQLException {
        List<Integer> movieIds;
        try {
            movieIds = person.knownForMovieIds();
        } catch (MalformedIdException e) {
            LOG.warn("Ignoring malformed known-for list of person {}: {}", person.id(), e.getMessage());
            return List.of();
        }

        List<String> titles = new ArrayList<>();
        for (int movieId : movieIds) {
            selectMovie.setInt(1, movieId);
            try (ResultSet rs = selectMovie.executeQuery()) {
                if (rs.next())
                    titles.add(rs.getString("title"));
            }
        }
        return titles;
    }

    private static List<Person> findByName(Connection conn, String name) throws SQLException {
        Pattern token = Pattern.compile("(?:^|\\s)" + Pattern.quote(name) + "(?:$|\\s)",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

        List<Person> matches = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-people-by-name"))) {
            ps.setString(1, likePattern(name));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Person p = Rows.person(rs);
                    if (token.matcher(p.name()).find())
                        matches.add(p);
                }
            }
        }
        return matches;
    }

    /**
     * Digit runs name a key by value, so leading zeros are allowed. Values
     * beyond the int range cannot be a key.
     */
    static OptionalInt parseKey(String digits) {
        int first = 0;
        while (first < digits.length() - 1 && digits.charAt(first) == '0')
            first++;
        String significant = digits.substring(first);
        if (significant.length() > 10)
            return OptionalInt.empty();
        long value = Long.parseLong(significant);
        return value > Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of((int) value);
    }

    /**
     * SQLite's {@code LIKE} folds ASCII case only, so non-ASCII input falls
     * back to a full scan that the pattern then filters.
     */
    static String likePattern(String name) {
        for (int i = 0; i < name.length(); i++) {
            if (name.charAt(i) > 0x7F)
                return "%";
        }
        String escaped = name.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static boolean isDigits(String input) {
        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);
            if (ch < '0' || ch > '9')
                return false;
        }
        return true;
    }
}
