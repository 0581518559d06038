package com.searchsync.sync.service;

import com.searchsync.config.GscSyncProperties;
import com.searchsync.sync.model.SyncRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class SyncCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncCliRunner.class);

    private final GscSyncProperties properties;
    private final SearchConsoleSyncService syncService;
    private final ConfigurableApplicationContext applicationContext;

    public SyncCliRunner(
        GscSyncProperties properties,
        SearchConsoleSyncService syncService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.syncService = syncService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = runOnce();
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int runOnce() {
        try {
            SyncRunSummary summary = syncService.run(properties.getCli().getDaysAgo());
            log.info(
                "Sync for {} completed: rows={}, inserted={}, updated={}",
                summary.dateProcessed(),
                summary.rowsFound(),
                summary.inserted(),
                summary.updated()
            );
            return 0;
        } catch (SyncFailedException e) {
            log.error("Sync failed at stage {}: {}", e.getStage(), e.getMessage());
            return 1;
        }
    }
}
