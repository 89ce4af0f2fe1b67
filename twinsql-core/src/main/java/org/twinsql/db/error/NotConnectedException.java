package org.twinsql.db.error;

public class NotConnectedException extends DatabaseException {
    public NotConnectedException() {
        super("Not connected to database. Call connect() first or use autoConnection=true.");
    }
}
