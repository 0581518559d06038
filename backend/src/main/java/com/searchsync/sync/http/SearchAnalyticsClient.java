package com.searchsync.sync.http;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.services.searchconsole.v1.SearchConsole;
import com.google.api.services.searchconsole.v1.model.ApiDataRow;
import com.google.api.services.searchconsole.v1.model.SearchAnalyticsQueryRequest;
import com.google.api.services.searchconsole.v1.model.SearchAnalyticsQueryResponse;
import com.google.auth.http.HttpCredentialsAdapter;
import com.searchsync.config.GscSyncProperties;
import com.searchsync.sync.auth.SearchConsoleSession;
import com.searchsync.sync.model.AnalyticsRow;
import com.searchsync.sync.service.SearchAnalyticsApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

@Service
public class SearchAnalyticsClient {
    private static final Logger log = LoggerFactory.getLogger(SearchAnalyticsClient.class);
    static final String APPLICATION_NAME = "search-console-sync";

    private final GscSyncProperties properties;
    private final HttpTransport transport = new NetHttpTransport();
    private final JsonFactory jsonFactory = JacksonFactory.getDefaultInstance();

    public SearchAnalyticsClient(GscSyncProperties properties) {
        this.properties = properties;
    }

    /**
     * Fetches every row for the date range. Any failure discards the pages already received.
     */
    public List<AnalyticsRow> fetchAll(
        SearchConsoleSession session,
        String siteUrl,
        LocalDate startDate,
        LocalDate endDate
    ) {
        log.info("Fetching Search Console data for {} between {} and {}", siteUrl, startDate, endDate);
        SearchAnalyticsPages pages = pages(session, siteUrl, startDate, endDate);
        List<AnalyticsRow> rows = new ArrayList<>();
        while (pages.hasNext()) {
            List<AnalyticsRow> page = pages.next();
            if (page.isEmpty()) {
                log.info("No rows returned from start row {}", pages.lastStartRow());
                break;
            }
            rows.addAll(page);
            log.info("Received page of {} rows (total {})", page.size(), rows.size());
        }
        log.info("Search Console fetch complete: {} rows over {} request(s)", rows.size(), pages.requestCount());
        return Collections.unmodifiableList(rows);
    }

    public SearchAnalyticsPages pages(
        SearchConsoleSession session,
        String siteUrl,
        LocalDate startDate,
        LocalDate endDate
    ) {
        if (siteUrl == null || siteUrl.isBlank()) {
            throw new SearchAnalyticsApiException(0, null, "Site URL is not configured");
        }
        SearchConsole searchConsole = searchConsole(session);
        SearchAnalyticsQueryRequest first = new SearchAnalyticsQueryRequest()
            .setStartDate(startDate.toString())
            .setEndDate(endDate.toString())
            .setDimensions(new ArrayList<>(AnalyticsRow.DIMENSIONS))
            .setSearchType(properties.getSearchType().toLowerCase(Locale.ROOT))
            .setRowLimit(properties.getApi().getRowLimit())
            .setStartRow(0);
        String site = siteUrl.trim();
        return new SearchAnalyticsPages(first, request -> query(searchConsole, site, request));
    }

    List<AnalyticsRow> query(SearchConsole searchConsole, String siteUrl, SearchAnalyticsQueryRequest request) {
        SearchAnalyticsQueryResponse response;
        try {
            response = searchConsole.searchanalytics().query(siteUrl, request).execute();
        } catch (GoogleJsonResponseException e) {
            throw errorFor(e);
        } catch (SocketTimeoutException e) {
            throw new SearchAnalyticsApiException("Search Analytics request timed out: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SearchAnalyticsApiException("Search Analytics request failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new SearchAnalyticsApiException("Unreadable Search Analytics response: " + e.getMessage(), e);
        }

        List<ApiDataRow> apiRows = response == null ? null : response.getRows();
        if (apiRows == null || apiRows.isEmpty()) {
            return List.of();
        }
        List<AnalyticsRow> rows = new ArrayList<>(apiRows.size());
        for (ApiDataRow apiRow : apiRows) {
            rows.add(toRow(apiRow));
        }
        return rows;
    }

    private SearchConsole searchConsole(SearchConsoleSession session) {
        HttpCredentialsAdapter credentials = new HttpCredentialsAdapter(session.credentials());
        int timeoutMillis = properties.getApi().getRequestTimeoutSeconds() * 1000;
        HttpRequestInitializer initializer = request -> {
            credentials.initialize(request);
            request.setConnectTimeout(timeoutMillis);
            request.setReadTimeout(timeoutMillis);
        };
        return new SearchConsole.Builder(transport, jsonFactory, initializer)
            .setRootUrl(rootUrl())
            .setApplicationName(APPLICATION_NAME)
            .build();
    }

    private String rootUrl() {
        String base = properties.getApi().getBaseUrl();
        return base.endsWith("/") ? base : base + "/";
    }

    private static AnalyticsRow toRow(ApiDataRow row) {
        return new AnalyticsRow(
            row.getKeys(),
            Math.round(orZero(row.getClicks())),
            Math.round(orZero(row.getImpressions())),
            orZero(row.getCtr()),
            orZero(row.getPosition())
        );
    }

    private static double orZero(Double value) {
        return value == null ? 0d : value;
    }

    private SearchAnalyticsApiException errorFor(GoogleJsonResponseException e) {
        int status = e.getStatusCode();
        String reason = null;
        String detail = e.getStatusMessage();
        GoogleJsonError details = e.getDetails();
        if (details != null) {
            Object apiStatus = details.get("status");
            if (apiStatus instanceof String && !((String) apiStatus).isBlank()) {
                reason = (String) apiStatus;
            }
            if (reason == null && details.getErrors() != null && !details.getErrors().isEmpty()) {
                reason = details.getErrors().get(0).getReason();
            }
            if (details.getMessage() != null) {
                detail = details.getMessage();
            }
        }
        StringBuilder message = new StringBuilder("Search Analytics API returned HTTP ").append(status);
        if (reason != null) {
            message.append(" (").append(reason).append(")");
        }
        if (detail != null && !detail.isBlank()) {
            message.append(": ").append(detail);
        }
        log.warn("{}", message);
        return new SearchAnalyticsApiException(status, reason, message.toString(), e);
    }
}
