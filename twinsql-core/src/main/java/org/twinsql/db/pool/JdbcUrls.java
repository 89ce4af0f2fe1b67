package org.twinsql.db.pool;

final class JdbcUrls {
    private JdbcUrls() {
    }

    /** Masks inline passwords so the URL is safe to log. */
    static String sanitize(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("(?i)password=[^;&]+", "password=***");
    }

    /** Short readable pool name fragment, no credentials. */
    static String shortName(String identityKey) {
        String safe = identityKey.replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }
}
