package de.bsommerfeld.sixdegrees.search;

import de.bsommerfeld.sixdegrees.core.domain.Movie;
import de.bsommerfeld.sixdegrees.core.domain.Person;

import java.sql.ResultSet;
import java.sql.SQLException;

/** Maps result rows of the graph tables onto domain records. */
final class Rows {

    private Rows() {
    }

    static Person person(ResultSet rs) throws SQLException {
        return new Person(
                rs.getInt("id"),
                rs.getString("name"),
                nullableInt(rs, "birth"),
                nullableInt(rs, "death"),
                rs.getString("known_for"));
    }

    static Movie movie(ResultSet rs) throws SQLException {
        return new Movie(
                rs.getInt("id"),
                rs.getString("title"),
                nullableInt(rs, "year"),
                rs.getString("title_type"),
                rs.getInt("is_adult") == 1,
                nullableInt(rs, "runtime"),
                rs.getString("genres"));
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
