package com.searchsync.sync.service;

/**
 * Failure talking to the Search Analytics API. {@code statusCode} is 0 when no HTTP response was
 * received (transport error, token refresh failure).
 */
public class SearchAnalyticsApiException extends SyncException {
    private final int statusCode;
    private final String reason;

    public SearchAnalyticsApiException(int statusCode, String reason, String message) {
        super(message);
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public SearchAnalyticsApiException(int statusCode, String reason, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public SearchAnalyticsApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.reason = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReason() {
        return reason;
    }
}
