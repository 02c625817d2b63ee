package de.bsommerfeld.sixdegrees.search;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sixdegrees.core.domain.Movie;
import de.bsommerfeld.sixdegrees.core.domain.Person;
import de.bsommerfeld.sixdegrees.core.domain.RoleCategory;
import de.bsommerfeld.sixdegrees.db.GraphStore;
import de.bsommerfeld.sixdegrees.db.SqlLoader;
import de.bsommerfeld.sixdegrees.db.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Hydrates a path of person keys into {@link Link}s. Where two people share
 * several movies, the one with the most votes is shown.
 */
@Singleton
public class PathDescriber {

    private final GraphStore store;

    @Inject
    public PathDescriber(GraphStore store) {
        this.store = store;
    }

    /**
     * @throws StoreException if a person is missing or two consecutive people
     *                        share no movie
     */
    public List<Link> describe(List<Integer> path) {
        List<Link> links = new ArrayList<>();
        if (path.size() < 2)
            return links;

        try (Connection conn = store.openConnection();
                PreparedStatement person = conn.prepareStatement(SqlLoader.load("select-person-by-id"));
                PreparedStatement shared = conn.prepareStatement(SqlLoader.load("select-shared-movie"))) {
            Person from = loadPerson(person, path.get(0));
            for (int i = 1; i < path.size(); i++) {
                Person to = loadPerson(person, path.get(i));
                links.add(link(shared, from, to));
                from = to;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to describe path " + path, e);
        }
        return links;
    }

    private static Person loadPerson(PreparedStatement ps, int id) throws SQLException {
        ps.setInt(1, id);
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next())
                throw new StoreException("Person " + id + " is not in the store");
            return Rows.person(rs);
        }
    }

    private static Link link(PreparedStatement ps, Person from, Person to) throws SQLException {
        ps.setInt(1, from.id());
        ps.setInt(2, to.id());
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next())
                throw new StoreException(from.name() + " and " + to.name() + " share no movie");
            Movie movie = Rows.movie(rs);
            return new Link(from, role(rs.getString("from_role")), movie, to, role(rs.getString("to_role")));
        }
    }

    private static RoleCategory role(String code) {
        return RoleCategory.fromCode(code)
                .orElseThrow(() -> new StoreException("Unknown role in store: " + code));
    }
}
