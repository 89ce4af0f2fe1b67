package org.twinsql.db;

/**
 * Backend a client talks to.
 */
public enum Engine {
    /** Client/server engine reached over the network. */
    POSTGRES,
    /** Embedded engine backed by a single database file. */
    SQLITE
}
