package org.twinsql.db.dialect;

/**
 * Rewrites {@code %s} placeholders to JDBC {@code ?} markers outside literals, quoted identifiers and comments.
 * {@code %%} is the escape for a literal percent sign and becomes {@code %} in code and string literals.
 */
final class ParameterMarkerRewriter {
    private ParameterMarkerRewriter() {
    }

    /**
     * Rewrites and checks that every marker has exactly one value.
     *
     * @throws IllegalArgumentException on a count mismatch
     */
    static String rewrite(String sql, int paramCount) {
        RewriteResult rr = rewriteToJdbcQMarks(sql);
        if (rr.markerCount() != paramCount) {
            throw new IllegalArgumentException("Query has " + rr.markerCount() + " parameter marker(s) but "
                    + paramCount + " value(s) were supplied");
        }
        return rr.sql();
    }

    static RewriteResult rewriteToJdbcQMarks(String sql) {
        if (sql == null) sql = "";

        StringBuilder out = new StringBuilder(sql.length());
        int markers = 0;

        for (SqlSegments.Segment seg : SqlSegments.split(sql)) {
            String text = seg.text();
            switch (seg.kind()) {
                case CODE -> markers += rewriteCode(text, out);
                case LITERAL -> out.append(text.replace("%%", "%"));
                default -> out.append(text);
            }
        }
        return new RewriteResult(out.toString(), markers);
    }

    private static int rewriteCode(String code, StringBuilder out) {
        int markers = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            char n = (i + 1) < code.length() ? code.charAt(i + 1) : '\0';
            if (c == '%' && n == 's') {
                out.append('?');
                markers++;
                i++;
            } else if (c == '%' && n == '%') {
                out.append('%');
                i++;
            } else {
                out.append(c);
            }
        }
        return markers;
    }

    record RewriteResult(String sql, int markerCount) {
    }
}
