package com.searchsync.sync.api;

import com.searchsync.config.GscSyncProperties;
import com.searchsync.sync.model.SyncRunSummary;
import com.searchsync.sync.service.SearchConsoleSyncService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class SyncController {
    static final String INDEX_MESSAGE = "GSC API Sync Service is running";

    private final SearchConsoleSyncService syncService;
    private final GscSyncProperties properties;

    public SyncController(SearchConsoleSyncService syncService, GscSyncProperties properties) {
        this.syncService = syncService;
        this.properties = properties;
    }

    @PostMapping("/trigger-gsc-sync")
    public SyncRunSummary triggerSync(@RequestParam(name = "days", required = false) String days) {
        return syncService.run(parseDaysAgo(days, properties.getDefaultDaysAgo()));
    }

    @GetMapping("/")
    public Map<String, String> index() {
        return Map.of("message", INDEX_MESSAGE);
    }

    /**
     * Missing, non-numeric and negative values fall back to the default; this never fails.
     */
    static int parseDaysAgo(String raw, int defaultDaysAgo) {
        if (raw == null || raw.isBlank()) {
            return defaultDaysAgo;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value < 0 ? defaultDaysAgo : value;
        } catch (NumberFormatException e) {
            return defaultDaysAgo;
        }
    }
}
