package com.searchsync.sync.http;

import com.google.api.services.searchconsole.v1.model.SearchAnalyticsQueryRequest;
import com.searchsync.sync.model.AnalyticsRow;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, single-pass sequence of Search Analytics pages. Ends after a page shorter than the row
 * limit (an empty page included) or after the first failure.
 */
public class SearchAnalyticsPages implements Iterator<List<AnalyticsRow>> {

    @FunctionalInterface
    public interface PageFetcher {
        List<AnalyticsRow> fetch(SearchAnalyticsQueryRequest request);
    }

    private final PageFetcher fetcher;
    private final int rowLimit;
    private SearchAnalyticsQueryRequest nextRequest;
    private int lastStartRow = -1;
    private int requestCount;
    private boolean finished;

    public SearchAnalyticsPages(SearchAnalyticsQueryRequest firstRequest, PageFetcher fetcher) {
        this.nextRequest = firstRequest;
        this.fetcher = fetcher;
        this.rowLimit = firstRequest.getRowLimit() == null ? 1 : Math.max(1, firstRequest.getRowLimit());
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public List<AnalyticsRow> next() {
        if (finished) {
            throw new NoSuchElementException("No more Search Analytics pages");
        }
        SearchAnalyticsQueryRequest request = nextRequest;
        int startRow = request.getStartRow() == null ? 0 : request.getStartRow();
        lastStartRow = startRow;
        requestCount++;
        List<AnalyticsRow> rows;
        try {
            rows = fetcher.fetch(request);
        } catch (RuntimeException e) {
            finished = true;
            throw e;
        }
        if (rows == null) {
            rows = List.of();
        }
        if (rows.size() < rowLimit) {
            finished = true;
        } else {
            nextRequest = request.clone().setStartRow(startRow + rowLimit);
        }
        return rows;
    }

    public int lastStartRow() {
        return lastStartRow;
    }

    public int requestCount() {
        return requestCount;
    }
}
