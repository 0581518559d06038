package com.searchsync.sync.persistence;

import com.searchsync.sync.model.SearchPerformanceRecord;
import com.searchsync.sync.model.UpsertOutcome;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Date;

public class SearchPerformanceJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;
    private final String table;

    /**
     * @param table validated identifier, see {@link StoreConnectionFactory}
     */
    public SearchPerformanceJdbcRepository(NamedParameterJdbcTemplate jdbc, boolean postgres, String table) {
        this.jdbc = jdbc;
        this.postgres = postgres;
        this.table = table;
    }

    public UpsertOutcome upsert(SearchPerformanceRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("metricDate", Date.valueOf(record.metricDate()))
            .addValue("siteUrl", record.siteUrl())
            .addValue("pageUrl", record.pageUrl())
            .addValue("query", record.query())
            .addValue("device", record.device())
            .addValue("searchType", record.searchType())
            .addValue("clicks", record.clicks())
            .addValue("impressions", record.impressions())
            .addValue("ctr", record.ctr())
            .addValue("position", record.position());

        if (postgres) {
            Boolean inserted = jdbc.queryForObject(
                """
                    INSERT INTO %s (
                        metric_date, site_url, page_url, query_text, device, search_type,
                        clicks, impressions, ctr, avg_position, extracted_at
                    )
                    VALUES (
                        :metricDate, :siteUrl, :pageUrl, :query, :device, :searchType,
                        :clicks, :impressions, :ctr, :position, CURRENT_TIMESTAMP
                    )
                    ON CONFLICT (metric_date, site_url, page_url, query_text, device, search_type)
                    DO UPDATE SET
                        clicks = EXCLUDED.clicks,
                        impressions = EXCLUDED.impressions,
                        ctr = EXCLUDED.ctr,
                        avg_position = EXCLUDED.avg_position,
                        extracted_at = CURRENT_TIMESTAMP
                    RETURNING (xmax = 0) AS inserted
                    """.formatted(table),
                params,
                Boolean.class
            );
            return Boolean.TRUE.equals(inserted) ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
        }

        if (updateExisting(params) > 0) {
            return UpsertOutcome.UPDATED;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO %s (
                        metric_date, site_url, page_url, query_text, device, search_type,
                        clicks, impressions, ctr, avg_position, extracted_at
                    )
                    VALUES (
                        :metricDate, :siteUrl, :pageUrl, :query, :device, :searchType,
                        :clicks, :impressions, :ctr, :position, CURRENT_TIMESTAMP
                    )
                    """.formatted(table),
                params
            );
            return UpsertOutcome.INSERTED;
        } catch (DataIntegrityViolationException e) {
            // Row appeared between the update and the insert.
            if (updateExisting(params) > 0) {
                return UpsertOutcome.UPDATED;
            }
            throw e;
        }
    }

    private int updateExisting(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE %s
                SET clicks = :clicks,
                    impressions = :impressions,
                    ctr = :ctr,
                    avg_position = :position,
                    extracted_at = CURRENT_TIMESTAMP
                WHERE metric_date = :metricDate
                  AND site_url = :siteUrl
                  AND page_url = :pageUrl
                  AND query_text = :query
                  AND device = :device
                  AND search_type = :searchType
                """.formatted(table),
            params
        );
    }
}
