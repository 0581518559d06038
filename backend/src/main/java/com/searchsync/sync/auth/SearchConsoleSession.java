package com.searchsync.sync.auth;

import com.google.auth.oauth2.GoogleCredentials;

/**
 * Authorized handle for Search Console calls. The token is fetched on first use and refreshed
 * by the underlying credentials when it expires.
 */
public class SearchConsoleSession {
    private final GoogleCredentials credentials;

    public SearchConsoleSession(GoogleCredentials credentials) {
        this.credentials = credentials;
    }

    public GoogleCredentials credentials() {
        return credentials;
    }
}
