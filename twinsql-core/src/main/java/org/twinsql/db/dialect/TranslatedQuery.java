package org.twinsql.db.dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Engine-ready statement text with its bind values in marker order. Bind values may contain nulls.
 *
 * @param returningClause whether the text ends in a {@code RETURNING} clause
 */
public record TranslatedQuery(String sql, List<Object> bindValues, boolean returningClause) {

    public TranslatedQuery {
        Objects.requireNonNull(sql, "sql");
        bindValues = bindValues == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindValues));
    }
}
