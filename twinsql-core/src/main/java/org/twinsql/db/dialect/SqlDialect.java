package org.twinsql.db.dialect;

import org.twinsql.db.Engine;
import org.twinsql.db.SqlValue;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Turns the client's query convention ({@code %s} markers, engine-neutral DDL) into what one engine accepts,
 * and converts parameter values to the objects its driver binds.
 *
 * <p>Implementations are stateless and pattern based; they do not parse SQL.
 */
public interface SqlDialect {

    Engine engine();

    /**
     * @throws IllegalArgumentException when the number of {@code %s} markers and values differ
     */
    TranslatedQuery translate(String sql, List<SqlValue> params);

    /** True when {@code e} means the engine rejected a {@code RETURNING} clause and the statement may be retried without it. */
    default boolean isReturningUnsupported(SQLException e) {
        return false;
    }

    /** Statement text with its {@code RETURNING} clause removed. */
    default String stripReturning(String sql) {
        return sql;
    }

    /** Identifier generated by the last insert on {@code connection}, for engines that expose one. */
    default Object lastGeneratedId(Connection connection) throws SQLException {
        return null;
    }
}
