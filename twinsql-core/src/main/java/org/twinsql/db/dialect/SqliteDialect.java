package org.twinsql.db.dialect;

import org.twinsql.db.Engine;
import org.twinsql.db.SqlValue;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Embedded engine. Maps server-side column types to storage classes the file engine understands, quotes
 * dotted table names so {@code public.run} is one identifier, and renders temporal and boolean values as
 * text and integers.
 */
public final class SqliteDialect implements SqlDialect {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS", Locale.ROOT);
    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT);

    // SQLITE_ERROR: generic error code, used for syntax errors
    private static final int SQLITE_ERROR = 1;

    // optional precision, e.g. TIMESTAMP(3)
    private static final String PRECISION = "(?:\\s*\\(\\s*\\d+\\s*\\))?";

    // longest forms first so no qualifier is left dangling
    private static final List<TypeRule> TYPE_RULES = List.of(
            new TypeRule("\\bTIMESTAMP" + PRECISION + "\\s+WITH(?:OUT)?\\s+TIME\\s+ZONE\\b", "TEXT"),
            new TypeRule("\\bTIMESTAMPTZ\\b" + PRECISION, "TEXT"),
            new TypeRule("\\bTIMESTAMP\\b" + PRECISION, "TEXT"),
            new TypeRule("\\bTIME" + PRECISION + "\\s+WITH(?:OUT)?\\s+TIME\\s+ZONE\\b", "TEXT"),
            new TypeRule("\\bTIMETZ\\b" + PRECISION, "TEXT"),
            new TypeRule("\\bBIGSERIAL\\b", "INTEGER"),
            new TypeRule("\\bSMALLSERIAL\\b", "INTEGER"),
            new TypeRule("\\bSERIAL\\b", "INTEGER"),
            new TypeRule("\\bBOOLEAN\\b", "INTEGER"),
            new TypeRule("\\bBOOL\\b", "INTEGER")
    );

    // UPDATE SET is the upsert clause, not a table
    private static final Pattern TABLE_AFTER_KEYWORD = Pattern.compile(
            "\\b(FROM|JOIN|INTO|UPDATE)\\s+(?!SET\\b)([A-Za-z_][\\w.]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_NAME = Pattern.compile(
            "\\b(TABLE)\\s+(?:(IF\\s+NOT\\s+EXISTS|IF\\s+EXISTS)\\s+)?([A-Za-z_][\\w.]*)", Pattern.CASE_INSENSITIVE);

    @Override
    public Engine engine() {
        return Engine.SQLITE;
    }

    @Override
    public TranslatedQuery translate(String sql, List<SqlValue> params) {
        if (params == null) params = List.of();

        String out = ParameterMarkerRewriter.rewrite(sql, params.size());
        out = SqlSegments.rewriteCode(out, SqliteDialect::mapTypes);
        out = SqlSegments.rewriteCode(out, SqliteDialect::quoteTableNames);

        List<Object> binds = new ArrayList<>(params.size());
        for (SqlValue v : params) {
            binds.add(toBindValue(v));
        }
        return new TranslatedQuery(out, binds, SqlSegments.indexInCode(out, PostgresDialect.RETURNING) >= 0);
    }

    static String mapTypes(String code) {
        String out = code;
        for (TypeRule rule : TYPE_RULES) {
            out = rule.pattern().matcher(out).replaceAll(rule.replacement());
        }
        return out;
    }

    static String quoteTableNames(String code) {
        String out = TABLE_AFTER_KEYWORD.matcher(code)
                .replaceAll(m -> Matcher.quoteReplacement(m.group(1) + " `" + m.group(2) + "`"));
        return TABLE_NAME.matcher(out).replaceAll(m -> {
            String guard = m.group(2) == null ? "" : m.group(2).replaceAll("\\s+", " ") + " ";
            return Matcher.quoteReplacement(m.group(1) + " " + guard + "`" + m.group(3) + "`");
        });
    }

    static Object toBindValue(SqlValue v) {
        return switch (v.kind()) {
            case TEXT -> ((SqlValue.Text) v).value();
            case NUMBER -> ((SqlValue.Number) v).value();
            case BOOL -> ((SqlValue.Bool) v).value() ? 1 : 0;
            case DATE -> DATE_FORMAT.format(((SqlValue.Date) v).value());
            // the file engine has no zone type; the wall-clock value is stored
            case TIMESTAMP -> TIMESTAMP_FORMAT.format(((SqlValue.Timestamp) v).value());
            case NULL -> null;
        };
    }

    @Override
    public boolean isReturningUnsupported(SQLException e) {
        if (e == null) return false;
        String msg = e.getMessage();
        return e.getErrorCode() == SQLITE_ERROR
                || (msg != null && msg.toLowerCase(Locale.ROOT).contains("syntax error"));
    }

    @Override
    public String stripReturning(String sql) {
        int idx = SqlSegments.indexInCode(sql, PostgresDialect.RETURNING);
        if (idx < 0) return sql;
        return sql.substring(0, idx).replaceAll("[\\s;]+$", "");
    }

    @Override
    public Object lastGeneratedId(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : null;
        }
    }

    private record TypeRule(Pattern pattern, String replacement) {
        TypeRule(String regex, String replacement) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
        }
    }
}
