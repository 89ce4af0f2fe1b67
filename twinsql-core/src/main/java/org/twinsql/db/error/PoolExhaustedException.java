package org.twinsql.db.error;

public class PoolExhaustedException extends DatabaseException {

    private final int maxSize;

    public PoolExhaustedException(String identityKey, int maxSize) {
        super("Connection pool exhausted for '" + identityKey + "' (max: " + maxSize + ")");
        this.maxSize = maxSize;
    }

    public int maxSize() {
        return maxSize;
    }
}
