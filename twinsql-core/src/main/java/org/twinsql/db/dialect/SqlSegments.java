package org.twinsql.db.dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits SQL text into code, string literals, quoted identifiers and comments, so rewrites only
 * touch what the engine will parse as code.
 */
final class SqlSegments {
    private SqlSegments() {
    }

    enum Kind { CODE, LITERAL, QUOTED_IDENTIFIER, COMMENT }

    record Segment(Kind kind, String text) {
    }

    static List<Segment> split(String sql) {
        List<Segment> out = new ArrayList<>();
        if (sql == null || sql.isEmpty()) return out;

        StringBuilder cur = new StringBuilder();
        Kind kind = Kind.CODE;
        // closing character of the open literal/identifier
        char quote = '\0';
        boolean lineComment = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            char n = (i + 1) < sql.length() ? sql.charAt(i + 1) : '\0';

            switch (kind) {
                case COMMENT -> {
                    cur.append(c);
                    if (lineComment && c == '\n') {
                        flush(out, cur, kind);
                        kind = Kind.CODE;
                    } else if (!lineComment && c == '*' && n == '/') {
                        cur.append(n);
                        i++;
                        flush(out, cur, kind);
                        kind = Kind.CODE;
                    }
                }
                case LITERAL, QUOTED_IDENTIFIER -> {
                    cur.append(c);
                    if (c == quote) {
                        if (n == quote) {
                            // doubled quote is an escaped quote
                            cur.append(n);
                            i++;
                        } else {
                            flush(out, cur, kind);
                            kind = Kind.CODE;
                        }
                    }
                }
                case CODE -> {
                    if ((c == '-' && n == '-') || (c == '/' && n == '*')) {
                        flush(out, cur, kind);
                        kind = Kind.COMMENT;
                        lineComment = c == '-';
                        cur.append(c).append(n);
                        i++;
                    } else if (c == '\'') {
                        flush(out, cur, kind);
                        kind = Kind.LITERAL;
                        quote = c;
                        cur.append(c);
                    } else if (c == '"' || c == '`') {
                        flush(out, cur, kind);
                        kind = Kind.QUOTED_IDENTIFIER;
                        quote = c;
                        cur.append(c);
                    } else {
                        cur.append(c);
                    }
                }
            }
        }
        flush(out, cur, kind);
        return out;
    }

    /** Applies {@code rewrite} to every code segment and leaves the rest untouched. */
    static String rewriteCode(String sql, UnaryOperator<String> rewrite) {
        StringBuilder sb = new StringBuilder(sql == null ? 0 : sql.length());
        for (Segment s : split(sql)) {
            sb.append(s.kind() == Kind.CODE ? rewrite.apply(s.text()) : s.text());
        }
        return sb.toString();
    }

    /** Offset of the first match of {@code pattern} inside a code segment, or -1. */
    static int indexInCode(String sql, Pattern pattern) {
        int offset = 0;
        for (Segment s : split(sql)) {
            if (s.kind() == Kind.CODE) {
                Matcher m = pattern.matcher(s.text());
                if (m.find()) {
                    return offset + m.start();
                }
            }
            offset += s.text().length();
        }
        return -1;
    }

    private static void flush(List<Segment> out, StringBuilder cur, Kind kind) {
        if (cur.length() > 0) {
            out.add(new Segment(kind, cur.toString()));
            cur.setLength(0);
        }
    }
}
