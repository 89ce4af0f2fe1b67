package org.twinsql.db.exec;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.twinsql.db.ExecutionResult;
import org.twinsql.db.QueryKind;
import org.twinsql.db.SqlValue;
import org.twinsql.db.dialect.PostgresDialect;
import org.twinsql.db.dialect.SqliteDialect;
import org.twinsql.db.dialect.TranslatedQuery;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatementExecutorTest {

    private final Connection connection = Mockito.mock(Connection.class);

    private static ResultSet rows(String[] labels, Object[]... values) throws SQLException {
        ResultSet rs = Mockito.mock(ResultSet.class);
        ResultSetMetaData md = Mockito.mock(ResultSetMetaData.class);
        Mockito.when(rs.getMetaData()).thenReturn(md);
        Mockito.when(md.getColumnCount()).thenReturn(labels.length);
        for (int i = 0; i < labels.length; i++) {
            Mockito.when(md.getColumnLabel(i + 1)).thenReturn(labels[i]);
        }
        int[] cursor = {-1};
        Mockito.when(rs.next()).thenAnswer(inv -> ++cursor[0] < values.length);
        Mockito.when(rs.getObject(Mockito.anyInt())).thenAnswer(inv -> values[cursor[0]][inv.<Integer>getArgument(0) - 1]);
        return rs;
    }

    @Test
    void selectMapsRowsInColumnOrder_andBindsParameters() throws Exception {
        PreparedStatement ps = Mockito.mock(PreparedStatement.class);
        ResultSet rs = rows(new String[]{"name", "id"}, new Object[]{"b", 2}, new Object[]{"a", 1});
        Mockito.when(connection.prepareStatement("SELECT name, id FROM t WHERE x = ? AND y = ?")).thenReturn(ps);
        Mockito.when(ps.executeQuery()).thenReturn(rs);

        StatementExecutor executor = new StatementExecutor(new PostgresDialect(), Duration.ofSeconds(30), false);
        TranslatedQuery q = new TranslatedQuery("SELECT name, id FROM t WHERE x = ? AND y = ?", Arrays.asList("v", null), false);

        ExecutionResult result = executor.execute(connection, q, QueryKind.SELECT);

        List<Map<String, Object>> out = ((ExecutionResult.Rows) result).rows();
        assertThat(out).hasSize(2);
        assertThat(out.get(0).keySet()).containsExactly("name", "id");
        assertThat(out.get(0)).containsEntry("name", "b").containsEntry("id", 2);
        Mockito.verify(ps).setQueryTimeout(30);
        Mockito.verify(ps).setObject(1, "v");
        Mockito.verify(ps).setNull(2, Types.NULL);
        Mockito.verify(rs).close();
        Mockito.verify(ps).close();
    }

    @Test
    void nonQueryReturnsAffectedCount_withoutTimeoutWhenZero() throws Exception {
        PreparedStatement ps = Mockito.mock(PreparedStatement.class);
        Mockito.when(connection.prepareStatement("DELETE FROM t")).thenReturn(ps);
        Mockito.when(ps.executeUpdate()).thenReturn(3);

        StatementExecutor executor = new StatementExecutor(new PostgresDialect(), Duration.ZERO, true);
        ExecutionResult result = executor.execute(connection, new TranslatedQuery("DELETE FROM t", List.of(), false), QueryKind.NON_QUERY);

        assertThat(result).isEqualTo(new ExecutionResult.UpdateCount(3));
        Mockito.verify(ps, Mockito.never()).setQueryTimeout(Mockito.anyInt());
    }

    @Test
    void returningReadsIdColumnInAnyCase() throws Exception {
        PreparedStatement ps = Mockito.mock(PreparedStatement.class);
        ResultSet rs = rows(new String[]{"name", "ID"}, new Object[]{"w", 41L});
        String sql = "INSERT INTO t (name) VALUES (?) RETURNING name, id";
        Mockito.when(connection.prepareStatement(sql)).thenReturn(ps);
        Mockito.when(ps.execute()).thenReturn(true);
        Mockito.when(ps.getResultSet()).thenReturn(rs);

        StatementExecutor executor = new StatementExecutor(new PostgresDialect(), Duration.ZERO, false);
        ExecutionResult result = executor.execute(connection, new TranslatedQuery(sql, List.of("w"), true), QueryKind.NON_QUERY_RETURNING);

        assertThat(result).isEqualTo(new ExecutionResult.GeneratedId(41L));
    }

    @Test
    void returningWithNoRowOnNetworkedEngineIsNull() throws Exception {
        PreparedStatement ps = Mockito.mock(PreparedStatement.class);
        ResultSet rs = rows(new String[]{"id"});
        String sql = "INSERT INTO t (name) VALUES (?) ON CONFLICT DO NOTHING RETURNING id";
        Mockito.when(connection.prepareStatement(sql)).thenReturn(ps);
        Mockito.when(ps.execute()).thenReturn(true);
        Mockito.when(ps.getResultSet()).thenReturn(rs);

        StatementExecutor executor = new StatementExecutor(new PostgresDialect(), Duration.ZERO, false);
        ExecutionResult result = executor.execute(connection, new TranslatedQuery(sql, List.of("w"), true), QueryKind.NON_QUERY_RETURNING);

        assertThat(result).isEqualTo(new ExecutionResult.GeneratedId(null));
    }

    @Test
    void embeddedEngineFallsBackWhenReturningIsRejected() throws Exception {
        SqliteDialect dialect = new SqliteDialect();
        TranslatedQuery q = dialect.translate("INSERT INTO widgets (name) VALUES (%s) RETURNING id", List.of(SqlValue.text("w")));

        Mockito.when(connection.prepareStatement(q.sql()))
                .thenThrow(new SQLException("near \"RETURNING\": syntax error", null, 1));
        PreparedStatement plain = Mockito.mock(PreparedStatement.class);
        Mockito.when(connection.prepareStatement("INSERT INTO `widgets` (name) VALUES (?)")).thenReturn(plain);
        Mockito.when(plain.executeUpdate()).thenReturn(1);
        Statement st = Mockito.mock(Statement.class);
        ResultSet rowid = Mockito.mock(ResultSet.class);
        Mockito.when(connection.createStatement()).thenReturn(st);
        Mockito.when(st.executeQuery("SELECT last_insert_rowid()")).thenReturn(rowid);
        Mockito.when(rowid.next()).thenReturn(true);
        Mockito.when(rowid.getLong(1)).thenReturn(7L);

        StatementExecutor executor = new StatementExecutor(dialect, Duration.ZERO, false);
        ExecutionResult result = executor.execute(connection, q, QueryKind.NON_QUERY_RETURNING);

        assertThat(result).isEqualTo(new ExecutionResult.GeneratedId(7L));
        Mockito.verify(connection).rollback();
        Mockito.verify(plain).setObject(1, "w");
    }

    @Test
    void otherFailuresDoNotTriggerTheFallback() throws Exception {
        SqliteDialect dialect = new SqliteDialect();
        TranslatedQuery q = dialect.translate("INSERT INTO widgets (name) VALUES (%s) RETURNING id", List.of(SqlValue.text("w")));
        SQLException unique = new SQLException("[SQLITE_CONSTRAINT_UNIQUE] UNIQUE constraint failed: widgets.name", null, 2067);
        Mockito.when(connection.prepareStatement(q.sql())).thenThrow(unique);

        StatementExecutor executor = new StatementExecutor(dialect, Duration.ZERO, false);

        assertThatThrownBy(() -> executor.execute(connection, q, QueryKind.NON_QUERY_RETURNING)).isSameAs(unique);
        Mockito.verify(connection, Mockito.never()).rollback();
    }

    @Test
    void failedRetryKeepsTheOriginalErrorAsSuppressed() throws Exception {
        SqliteDialect dialect = new SqliteDialect();
        TranslatedQuery q = dialect.translate("INSERT INTO missing (name) VALUES (%s) RETURNING id", List.of(SqlValue.text("w")));
        SQLException first = new SQLException("[SQLITE_ERROR] SQL error or missing database (no such table: missing)", null, 1);
        SQLException second = new SQLException("[SQLITE_ERROR] SQL error or missing database (no such table: missing)", null, 1);
        Mockito.when(connection.prepareStatement(q.sql())).thenThrow(first);
        Mockito.when(connection.prepareStatement("INSERT INTO `missing` (name) VALUES (?)")).thenThrow(second);

        StatementExecutor executor = new StatementExecutor(dialect, Duration.ZERO, false);

        assertThatThrownBy(() -> executor.execute(connection, q, QueryKind.NON_QUERY_RETURNING))
                .isSameAs(second)
                .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(first));
        Mockito.verify(connection).rollback();
    }

    @Test
    void noReturningClauseMeansNoFallback() throws Exception {
        SqliteDialect dialect = new SqliteDialect();
        TranslatedQuery q = dialect.translate("INSERT INTO widgets (nme) VALUES (%s)", List.of(SqlValue.text("w")));
        SQLException noColumn = new SQLException("table widgets has no column named nme", null, 1);
        Mockito.when(connection.prepareStatement(q.sql())).thenThrow(noColumn);

        StatementExecutor executor = new StatementExecutor(dialect, Duration.ZERO, false);

        assertThatThrownBy(() -> executor.execute(connection, q, QueryKind.NON_QUERY_RETURNING)).isSameAs(noColumn);
    }
}
