package com.searchsync.sync.model;

public enum UpsertOutcome {
    INSERTED,
    UPDATED
}
