package com.searchsync.sync.service;

/**
 * Raised by {@link SearchConsoleSyncService} when a run stops. {@code stage} is the last stage
 * reached before the failure.
 */
public class SyncFailedException extends SyncException {
    private final SyncStage stage;
    private final Integer inserted;
    private final Integer updated;

    public SyncFailedException(SyncStage stage, String message, Throwable cause) {
        this(stage, message, cause, null, null);
    }

    public SyncFailedException(SyncStage stage, String message, Throwable cause, Integer inserted, Integer updated) {
        super(message, cause);
        this.stage = stage;
        this.inserted = inserted;
        this.updated = updated;
    }

    public SyncStage getStage() {
        return stage;
    }

    public Integer getInserted() {
        return inserted;
    }

    public Integer getUpdated() {
        return updated;
    }
}
