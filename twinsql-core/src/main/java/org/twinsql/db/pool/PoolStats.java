package org.twinsql.db.pool;

public record PoolStats(String identityKey, int minSize, int maxSize, int available, int borrowed) {

    public int total() {
        return available + borrowed;
    }
}
