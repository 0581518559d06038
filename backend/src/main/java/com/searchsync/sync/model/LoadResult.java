package com.searchsync.sync.model;

public record LoadResult(int inserted, int updated, String message) {
    public static final String NO_DATA = "no data";

    public static LoadResult noData() {
        return new LoadResult(0, 0, NO_DATA);
    }
}
