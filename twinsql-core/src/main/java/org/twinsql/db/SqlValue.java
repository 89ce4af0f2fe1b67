package org.twinsql.db;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A positional statement parameter, tagged with its kind so each dialect converts it exhaustively.
 *
 * <p>Timestamps keep the offset they were given (if any); dialects decide whether the engine can store it.
 */
public sealed interface SqlValue {

    enum Kind { TEXT, NUMBER, BOOL, DATE, TIMESTAMP, NULL }

    Kind kind();

    record Text(String value) implements SqlValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }
    }

    record Number(java.lang.Number value) implements SqlValue {
        public Number {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }
    }

    record Bool(boolean value) implements SqlValue {
        @Override
        public Kind kind() {
            return Kind.BOOL;
        }
    }

    record Date(LocalDate value) implements SqlValue {
        public Date {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.DATE;
        }
    }

    /** {@code offset} is null for zone-less values. */
    record Timestamp(LocalDateTime value, ZoneOffset offset) implements SqlValue {
        public Timestamp {
            Objects.requireNonNull(value, "value");
        }

        public OffsetDateTime toOffsetDateTime() {
            return offset == null ? null : value.atOffset(offset);
        }

        @Override
        public Kind kind() {
            return Kind.TIMESTAMP;
        }
    }

    enum Null implements SqlValue {
        INSTANCE;

        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    static SqlValue text(String value) {
        return value == null ? Null.INSTANCE : new Text(value);
    }

    static SqlValue number(java.lang.Number value) {
        return value == null ? Null.INSTANCE : new Number(value);
    }

    static SqlValue bool(boolean value) {
        return new Bool(value);
    }

    static SqlValue date(LocalDate value) {
        return value == null ? Null.INSTANCE : new Date(value);
    }

    static SqlValue timestamp(LocalDateTime value) {
        return value == null ? Null.INSTANCE : new Timestamp(value, null);
    }

    static SqlValue timestamp(OffsetDateTime value) {
        return value == null ? Null.INSTANCE : new Timestamp(value.toLocalDateTime(), value.getOffset());
    }

    static SqlValue nullValue() {
        return Null.INSTANCE;
    }

    /**
     * Tags a plain Java value. {@link Instant} and {@link java.util.Date} are read as UTC.
     *
     * @throws IllegalArgumentException for types with no SQL counterpart here
     */
    static SqlValue of(Object value) {
        if (value == null) return Null.INSTANCE;
        if (value instanceof SqlValue v) return v;
        if (value instanceof String s) return new Text(s);
        if (value instanceof Character c) return new Text(c.toString());
        if (value instanceof Boolean b) return new Bool(b);
        if (value instanceof java.lang.Number n) return new Number(n);
        // java.sql subclasses first: they extend java.util.Date
        if (value instanceof java.sql.Timestamp ts) return new Timestamp(ts.toLocalDateTime(), null);
        if (value instanceof java.sql.Date d) return new Date(d.toLocalDate());
        if (value instanceof LocalDate d) return new Date(d);
        if (value instanceof LocalDateTime dt) return new Timestamp(dt, null);
        if (value instanceof OffsetDateTime odt) return timestamp(odt);
        if (value instanceof ZonedDateTime zdt) return timestamp(zdt.toOffsetDateTime());
        if (value instanceof Instant i) return timestamp(i.atOffset(ZoneOffset.UTC));
        if (value instanceof java.util.Date d) return timestamp(d.toInstant().atOffset(ZoneOffset.UTC));
        if (value instanceof Enum<?> e) return new Text(e.name());
        throw new IllegalArgumentException("Unsupported parameter type: " + value.getClass().getName());
    }

    static List<SqlValue> list(List<?> params) {
        if (params == null || params.isEmpty()) return List.of();
        List<SqlValue> out = new ArrayList<>(params.size());
        for (Object p : params) {
            out.add(of(p));
        }
        return out;
    }
}
