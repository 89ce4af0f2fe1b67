package org.twinsql.db;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one statement: fetched rows, an affected-row count, or a generated identifier.
 */
public sealed interface ExecutionResult {

    record Rows(List<Map<String, Object>> rows) implements ExecutionResult {
        public Rows {
            rows = List.copyOf(rows);
        }
    }

    record UpdateCount(int count) implements ExecutionResult {
    }

    /** {@code id} may be null when the engine produced no row and no fallback applied. */
    record GeneratedId(Object id) implements ExecutionResult {
    }
}
