package com.searchsync.sync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SyncRunSummary(
    String status,
    String message,
    @JsonProperty("date_processed") String dateProcessed,
    @JsonProperty("rows_found") int rowsFound,
    int inserted,
    int updated
) {
    public static final String SUCCESS = "success";
}
