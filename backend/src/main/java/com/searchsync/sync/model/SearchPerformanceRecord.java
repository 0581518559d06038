package com.searchsync.sync.model;

import java.time.LocalDate;

public record SearchPerformanceRecord(
    LocalDate metricDate,
    String siteUrl,
    String pageUrl,
    String query,
    String device,
    String searchType,
    long clicks,
    long impressions,
    double ctr,
    double position
) {}
