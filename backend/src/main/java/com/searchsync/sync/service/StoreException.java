package com.searchsync.sync.service;

/**
 * Load failure after the transaction was rolled back. The counts describe rows processed before
 * the failure; none of them were committed.
 */
public class StoreException extends SyncException {
    private final int inserted;
    private final int updated;

    public StoreException(String message, Throwable cause, int inserted, int updated) {
        super(message, cause);
        this.inserted = inserted;
        this.updated = updated;
    }

    public int getInserted() {
        return inserted;
    }

    public int getUpdated() {
        return updated;
    }
}
