package com.searchsync.sync.api;

import com.searchsync.config.GscSyncProperties;
import com.searchsync.sync.model.SyncRunSummary;
import com.searchsync.sync.service.SearchConsoleSyncService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncControllerDaysParamTest {

    @Mock
    private SearchConsoleSyncService syncService;

    @Test
    void parsesValidDays() {
        assertEquals(0, SyncController.parseDaysAgo("0", 2));
        assertEquals(1, SyncController.parseDaysAgo("1", 2));
        assertEquals(7, SyncController.parseDaysAgo(" 7 ", 2));
    }

    @Test
    void invalidOrMissingDaysFallBackToDefault() {
        assertEquals(2, SyncController.parseDaysAgo(null, 2));
        assertEquals(2, SyncController.parseDaysAgo("", 2));
        assertEquals(2, SyncController.parseDaysAgo("abc", 2));
        assertEquals(2, SyncController.parseDaysAgo("1.5", 2));
        assertEquals(2, SyncController.parseDaysAgo("-3", 2));
        assertEquals(2, SyncController.parseDaysAgo("99999999999", 2));
    }

    @Test
    void triggerUsesConfiguredDefaultWhenDaysAbsent() {
        GscSyncProperties properties = new GscSyncProperties();
        properties.setDefaultDaysAgo(3);
        SyncRunSummary summary = new SyncRunSummary("success", "no data", "2026-10-16", 0, 0, 0);
        when(syncService.run(3)).thenReturn(summary);

        SyncController controller = new SyncController(syncService, properties);

        assertEquals(summary, controller.triggerSync(null));
        verify(syncService).run(3);
    }
}
