package com.searchsync.sync.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncErrorResponse(String status, String message, Integer inserted, Integer updated) {
    public static final String ERROR = "error";

    public static SyncErrorResponse of(String message, Integer inserted, Integer updated) {
        return new SyncErrorResponse(ERROR, message, inserted, updated);
    }
}
