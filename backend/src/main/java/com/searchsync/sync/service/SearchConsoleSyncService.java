package com.searchsync.sync.service;

import com.searchsync.config.GscSyncProperties;
import com.searchsync.sync.auth.SearchConsoleAuthenticator;
import com.searchsync.sync.auth.SearchConsoleSession;
import com.searchsync.sync.http.SearchAnalyticsClient;
import com.searchsync.sync.model.AnalyticsRow;
import com.searchsync.sync.model.LoadResult;
import com.searchsync.sync.model.SyncRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Runs one sync: authenticate, fetch the target day, load it. Each call is independent; the only
 * shared state is the configuration.
 */
@Service
public class SearchConsoleSyncService {
    private static final Logger log = LoggerFactory.getLogger(SearchConsoleSyncService.class);

    private final GscSyncProperties properties;
    private final SearchConsoleAuthenticator authenticator;
    private final SearchAnalyticsClient analyticsClient;
    private final SearchPerformanceLoader loader;
    private final Clock clock;

    public SearchConsoleSyncService(
        GscSyncProperties properties,
        SearchConsoleAuthenticator authenticator,
        SearchAnalyticsClient analyticsClient,
        SearchPerformanceLoader loader,
        Clock clock
    ) {
        this.properties = properties;
        this.authenticator = authenticator;
        this.analyticsClient = analyticsClient;
        this.loader = loader;
        this.clock = clock;
    }

    public SyncRunSummary run(int daysAgo) {
        log.info("Received Search Console sync trigger (daysAgo={})", daysAgo);
        if (!properties.getStore().isConfigured()) {
            log.error("Store connection string is not configured; aborting before any remote call");
            throw new SyncFailedException(
                SyncStage.RECEIVED,
                "DATABASE_URL not configured",
                new ConfigurationException("DATABASE_URL not configured")
            );
        }

        LocalDate targetDate = targetDate(daysAgo);
        String siteUrl = properties.getSiteUrl();
        log.info("Syncing {} for {} ({} day(s) ago)", siteUrl, targetDate, daysAgo);

        SearchConsoleSession session;
        try {
            session = authenticator.authenticate(Path.of(properties.getCredentialsPath()), properties.getScopes());
        } catch (RuntimeException e) {
            throw failure(SyncStage.RECEIVED, "Search Console authentication failed: ", e);
        }
        log.info("Stage {} reached", SyncStage.AUTHENTICATED);

        List<AnalyticsRow> rows;
        try {
            rows = analyticsClient.fetchAll(session, siteUrl, targetDate, targetDate);
        } catch (RuntimeException e) {
            throw failure(SyncStage.AUTHENTICATED, "Search Console fetch failed: ", e);
        }
        log.info("Stage {} reached with {} rows", SyncStage.FETCHED, rows.size());

        LoadResult result;
        try {
            result = loader.load(rows, siteUrl);
        } catch (StoreException e) {
            log.warn("Run for {} failed at stage {}: {}", targetDate, SyncStage.FETCHED, e.getMessage());
            throw new SyncFailedException(
                SyncStage.FETCHED,
                "Store load failed: " + e.getMessage(),
                e,
                e.getInserted(),
                e.getUpdated()
            );
        } catch (RuntimeException e) {
            throw failure(SyncStage.FETCHED, "Store load failed: ", e);
        }
        log.info(
            "Stage {} reached for {}: inserted={}, updated={}",
            SyncStage.LOADED,
            targetDate,
            result.inserted(),
            result.updated()
        );

        return new SyncRunSummary(
            SyncRunSummary.SUCCESS,
            result.message(),
            targetDate.toString(),
            rows.size(),
            result.inserted(),
            result.updated()
        );
    }

    public LocalDate targetDate(int daysAgo) {
        return LocalDate.now(clock).minusDays(daysAgo);
    }

    private SyncFailedException failure(SyncStage stage, String prefix, RuntimeException cause) {
        log.warn("Run failed after stage {}: {}", stage, cause.getMessage());
        return new SyncFailedException(stage, prefix + cause.getMessage(), cause);
    }
}
