package com.searchsync.sync.service;

import com.searchsync.config.GscSyncProperties;
import com.searchsync.sync.model.AnalyticsRow;
import com.searchsync.sync.model.LoadResult;
import com.searchsync.sync.model.SearchPerformanceRecord;
import com.searchsync.sync.model.UpsertOutcome;
import com.searchsync.sync.persistence.SearchPerformanceJdbcRepository;
import com.searchsync.sync.persistence.StoreConnectionFactory;
import com.searchsync.sync.persistence.StoreSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class SearchPerformanceLoader {
    private static final Logger log = LoggerFactory.getLogger(SearchPerformanceLoader.class);
    static final String MISSING_VALUE = "N/A";
    static final String UNKNOWN_DEVICE = "UNKNOWN";

    private final GscSyncProperties properties;
    private final StoreConnectionFactory connectionFactory;

    public SearchPerformanceLoader(GscSyncProperties properties, StoreConnectionFactory connectionFactory) {
        this.properties = properties;
        this.connectionFactory = connectionFactory;
    }

    /**
     * Upserts every row inside one transaction. On any failure the transaction is rolled back and
     * a {@link StoreException} carries the counts reached before the failure.
     */
    public LoadResult load(List<AnalyticsRow> rows, String siteUrl) {
        if (rows == null || rows.isEmpty()) {
            log.info("No rows to load");
            return LoadResult.noData();
        }
        if (!properties.getStore().isConfigured()) {
            throw new ConfigurationException("DATABASE_URL not configured");
        }

        AtomicInteger inserted = new AtomicInteger();
        AtomicInteger updated = new AtomicInteger();
        log.info("Connecting to store to load {} rows", rows.size());
        try (StoreSession session = connectionFactory.open()) {
            SearchPerformanceJdbcRepository repository =
                new SearchPerformanceJdbcRepository(session.jdbc(), session.isPostgres(), session.table());
            session.transactionTemplate().executeWithoutResult(status -> {
                for (AnalyticsRow row : rows) {
                    UpsertOutcome outcome = repository.upsert(normalize(row, siteUrl));
                    if (outcome == UpsertOutcome.INSERTED) {
                        inserted.incrementAndGet();
                    } else {
                        updated.incrementAndGet();
                    }
                }
            });
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            log.error(
                "Store load failed after {} inserted / {} updated; transaction rolled back",
                inserted.get(),
                updated.get(),
                e
            );
            throw new StoreException(e.getMessage(), e, inserted.get(), updated.get());
        }

        String message = "Load complete. Inserted: " + inserted.get() + ", Updated: " + updated.get();
        log.info(message);
        return new LoadResult(inserted.get(), updated.get(), message);
    }

    SearchPerformanceRecord normalize(AnalyticsRow row, String siteUrl) {
        String rawDate = row.key(0);
        LocalDate metricDate;
        try {
            metricDate = rawDate == null ? null : LocalDate.parse(rawDate.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Row has an invalid date key: " + rawDate, e);
        }
        if (metricDate == null) {
            throw new IllegalArgumentException("Row is missing its date key");
        }

        String page = row.key(1);
        String query = row.key(2);
        String device = row.key(3);
        return new SearchPerformanceRecord(
            metricDate,
            siteUrl,
            page == null ? MISSING_VALUE : page,
            query == null ? MISSING_VALUE : query,
            device == null || device.isBlank() ? UNKNOWN_DEVICE : device.trim().toUpperCase(Locale.ROOT),
            properties.getSearchType(),
            row.clicks(),
            row.impressions(),
            row.ctr(),
            row.position()
        );
    }
}
