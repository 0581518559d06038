package com.searchsync.sync.model;

import java.util.List;

/**
 * One row of a Search Analytics response. {@code keys} holds the dimension values in the order
 * they were requested (date, page, query, device).
 */
public record AnalyticsRow(
    List<String> keys,
    long clicks,
    long impressions,
    double ctr,
    double position
) {
    public static final List<String> DIMENSIONS = List.of("date", "page", "query", "device");

    public AnalyticsRow {
        keys = keys == null ? List.of() : keys;
    }

    public String key(int index) {
        return index < keys.size() ? keys.get(index) : null;
    }
}
