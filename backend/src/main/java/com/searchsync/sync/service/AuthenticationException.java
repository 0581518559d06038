package com.searchsync.sync.service;

public class AuthenticationException extends SyncException {
    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
