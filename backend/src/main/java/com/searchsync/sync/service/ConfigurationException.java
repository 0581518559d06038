package com.searchsync.sync.service;

public class ConfigurationException extends SyncException {
    public ConfigurationException(String message) {
        super(message);
    }
}
