package de.bsommerfeld.sixdegrees.ingest;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/** Null-aware parameter binding shared by the loaders. */
final class JdbcBinding {

    private JdbcBinding() {
    }

    static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null)
            ps.setNull(index, Types.INTEGER);
        else
            ps.setInt(index, value);
    }

    static void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null)
            ps.setNull(index, Types.REAL);
        else
            ps.setDouble(index, value);
    }

    /** Runs a single-parameter existence query. */
    static boolean exists(PreparedStatement query, int id) throws SQLException {
        query.setInt(1, id);
        try (ResultSet rs = query.executeQuery()) {
            return rs.next();
        }
    }
}
