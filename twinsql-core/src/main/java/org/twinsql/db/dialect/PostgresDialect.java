package org.twinsql.db.dialect;

import org.twinsql.db.Engine;
import org.twinsql.db.SqlValue;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Networked engine. The query convention is already its own, so only markers change; values bind natively.
 */
public final class PostgresDialect implements SqlDialect {

    static final Pattern RETURNING = Pattern.compile("\\bRETURNING\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public Engine engine() {
        return Engine.POSTGRES;
    }

    @Override
    public TranslatedQuery translate(String sql, List<SqlValue> params) {
        if (params == null) params = List.of();
        String out = ParameterMarkerRewriter.rewrite(sql, params.size());

        List<Object> binds = new ArrayList<>(params.size());
        for (SqlValue v : params) {
            binds.add(toBindValue(v));
        }
        return new TranslatedQuery(out, binds, SqlSegments.indexInCode(out, RETURNING) >= 0);
    }

    static Object toBindValue(SqlValue v) {
        return switch (v.kind()) {
            case TEXT -> ((SqlValue.Text) v).value();
            case NUMBER -> ((SqlValue.Number) v).value();
            case BOOL -> ((SqlValue.Bool) v).value();
            case DATE -> ((SqlValue.Date) v).value();
            case TIMESTAMP -> {
                SqlValue.Timestamp ts = (SqlValue.Timestamp) v;
                yield ts.offset() == null ? ts.value() : ts.toOffsetDateTime();
            }
            case NULL -> null;
        };
    }
}
