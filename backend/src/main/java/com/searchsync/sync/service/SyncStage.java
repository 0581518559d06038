package com.searchsync.sync.service;

public enum SyncStage {
    RECEIVED,
    AUTHENTICATED,
    FETCHED,
    LOADED
}
