package com.searchsync.sync.service;

import com.searchsync.config.GscSyncProperties;
import com.searchsync.sync.model.SyncRunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncCliRunnerTest {

    @Mock
    private SearchConsoleSyncService syncService;
    @Mock
    private ConfigurableApplicationContext applicationContext;

    @Test
    void doesNothingUnlessEnabled() {
        GscSyncProperties properties = new GscSyncProperties();

        new SyncCliRunner(properties, syncService, applicationContext).run(new DefaultApplicationArguments());

        verifyNoInteractions(syncService);
    }

    @Test
    void runsConfiguredDayAndMapsOutcomeToExitCode() {
        GscSyncProperties properties = new GscSyncProperties();
        properties.getCli().setRun(true);
        properties.getCli().setDaysAgo(5);
        when(syncService.run(5))
            .thenReturn(new SyncRunSummary("success", "Load complete. Inserted: 1, Updated: 0", "2026-10-14", 1, 1, 0))
            .thenThrow(new SyncFailedException(SyncStage.RECEIVED, "DATABASE_URL not configured", null));
        SyncCliRunner runner = new SyncCliRunner(properties, syncService, applicationContext);

        assertThat(runner.runOnce()).isZero();
        assertThat(runner.runOnce()).isEqualTo(1);
        verify(syncService, times(2)).run(5);
    }
}
