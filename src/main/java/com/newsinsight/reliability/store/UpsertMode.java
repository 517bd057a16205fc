package com.newsinsight.reliability.store;

/**
 * How the snapshot store enforces at-most-one-row per key.
 */
public enum UpsertMode {
    /** ATOMIC on PostgreSQL, READ_MODIFY_WRITE elsewhere. */
    AUTO,
    /** Single INSERT ... ON CONFLICT DO UPDATE statement. */
    ATOMIC,
    /** Read the row, update in place or insert; retry when a concurrent insert wins. */
    READ_MODIFY_WRITE
}
