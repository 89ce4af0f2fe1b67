package org.twinsql.db.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.twinsql.db.ExecutionResult;
import org.twinsql.db.QueryKind;
import org.twinsql.db.dialect.SqlDialect;
import org.twinsql.db.dialect.TranslatedQuery;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Executes one translated statement on a connection and shapes its outcome by {@link QueryKind}.
 *
 * <p>Transaction control is the caller's job (see {@link TransactionScope}). Statements and result sets are
 * closed before this returns, so the caller can commit right away.
 */
public final class StatementExecutor {
    private static final Logger log = LoggerFactory.getLogger(StatementExecutor.class);

    private final SqlDialect dialect;
    private final int queryTimeoutSeconds;
    private final boolean debug;

    public StatementExecutor(SqlDialect dialect, Duration queryTimeout, boolean debug) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.queryTimeoutSeconds = queryTimeout == null ? 0 : (int) Math.min(Integer.MAX_VALUE, queryTimeout.toSeconds());
        this.debug = debug;
    }

    public ExecutionResult execute(Connection connection, TranslatedQuery query, QueryKind kind) throws SQLException {
        trace("[SQL] {} | sql={} | params={}", kind.label(), query.sql(), query.bindValues());

        ExecutionResult result = switch (kind) {
            case SELECT -> new ExecutionResult.Rows(select(connection, query.sql(), query.bindValues()));
            case NON_QUERY -> new ExecutionResult.UpdateCount(update(connection, query.sql(), query.bindValues()));
            case NON_QUERY_RETURNING -> new ExecutionResult.GeneratedId(returning(connection, query));
        };

        if (result instanceof ExecutionResult.Rows r) {
            trace("[SQL] {} ok | rows={}", kind.label(), r.rows().size());
        } else if (result instanceof ExecutionResult.UpdateCount u) {
            trace("[SQL] {} ok | affected={}", kind.label(), u.count());
        } else if (result instanceof ExecutionResult.GeneratedId g) {
            trace("[SQL] {} ok | id={}", kind.label(), g.id());
        }
        return result;
    }

    private List<Map<String, Object>> select(Connection c, String sql, List<Object> binds) throws SQLException {
        try (PreparedStatement ps = prepare(c, sql, binds);
             ResultSet rs = ps.executeQuery()) {
            return mapRows(rs);
        }
    }

    private int update(Connection c, String sql, List<Object> binds) throws SQLException {
        try (PreparedStatement ps = prepare(c, sql, binds)) {
            return ps.executeUpdate();
        }
    }

    private Object returning(Connection c, TranslatedQuery query) throws SQLException {
        try {
            return fetchGeneratedId(c, query.sql(), query.bindValues());
        } catch (SQLException e) {
            if (!query.returningClause() || !dialect.isReturningUnsupported(e)) {
                throw e;
            }
            String stripped = dialect.stripReturning(query.sql());
            log.warn("[SQL] Statement with RETURNING failed on {} ({}); retrying without the clause | sql={}",
                    dialect.engine(), e.getMessage(), stripped);
            try {
                c.rollback();
                update(c, stripped, query.bindValues());
                return dialect.lastGeneratedId(c);
            } catch (SQLException retry) {
                retry.addSuppressed(e);
                throw retry;
            }
        }
    }

    private Object fetchGeneratedId(Connection c, String sql, List<Object> binds) throws SQLException {
        try (PreparedStatement ps = prepare(c, sql, binds)) {
            if (ps.execute()) {
                try (ResultSet rs = ps.getResultSet()) {
                    if (rs != null && rs.next()) {
                        return idColumn(rs);
                    }
                    return null;
                }
            }
        }
        // no result set: the engine may still expose the id it generated
        return dialect.lastGeneratedId(c);
    }

    private PreparedStatement prepare(Connection c, String sql, List<Object> binds) throws SQLException {
        PreparedStatement ps = c.prepareStatement(sql);
        try {
            if (queryTimeoutSeconds > 0) {
                ps.setQueryTimeout(queryTimeoutSeconds);
            }
            for (int i = 0; i < binds.size(); i++) {
                Object v = binds.get(i);
                if (v == null) {
                    ps.setNull(i + 1, Types.NULL);
                } else {
                    ps.setObject(i + 1, v);
                }
            }
            return ps;
        } catch (SQLException | RuntimeException e) {
            ps.close();
            throw e;
        }
    }

    static List<Map<String, Object>> mapRows(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int cols = md.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(cols * 2);
            for (int i = 1; i <= cols; i++) {
                row.put(md.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    /** Value of the {@code id} column (any case), else the first column. */
    static Object idColumn(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            if ("id".equalsIgnoreCase(md.getColumnLabel(i))) {
                return rs.getObject(i);
            }
        }
        return rs.getObject(1);
    }

    private void trace(String format, Object... args) {
        if (debug) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
