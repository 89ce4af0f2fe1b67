package org.twinsql.db;

public enum QueryKind {
    SELECT("Query"),
    NON_QUERY("Non-Query"),
    NON_QUERY_RETURNING("Non-Query (Returning)");

    private final String label;

    QueryKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
