package com.searchsync.sync;

import com.searchsync.sync.auth.SearchConsoleAuthenticator;
import com.searchsync.sync.auth.SearchConsoleSession;
import com.searchsync.sync.http.SearchAnalyticsClient;
import com.searchsync.sync.model.AnalyticsRow;
import com.searchsync.sync.service.CredentialNotFoundException;
import com.searchsync.sync.service.SearchAnalyticsApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class SyncApiStageFailureTest {

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private SearchConsoleAuthenticator authenticator;

    @MockBean
    private SearchAnalyticsClient analyticsClient;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void credentialFailureAnswers500() throws Exception {
        when(authenticator.authenticate(any(), anyList()))
            .thenThrow(new CredentialNotFoundException(Path.of("/etc/secrets/gsc_service_account.json")));

        mockMvc.perform(post("/trigger-gsc-sync"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value(startsWith("Search Console authentication failed: ")))
            .andExpect(jsonPath("$.message").value(containsString("gsc_service_account.json")));
    }

    @Test
    void fetchFailureAnswers500() throws Exception {
        when(authenticator.authenticate(any(), anyList())).thenReturn(Mockito.mock(SearchConsoleSession.class));
        when(analyticsClient.fetchAll(any(), anyString(), any(), any()))
            .thenThrow(new SearchAnalyticsApiException(429, "RESOURCE_EXHAUSTED", "Search Analytics API returned HTTP 429"));

        mockMvc.perform(post("/trigger-gsc-sync").param("days", "3"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("Search Console fetch failed: Search Analytics API returned HTTP 429"))
            .andExpect(jsonPath("$.inserted").doesNotExist());
    }

    @Test
    void loadFailureAnswers500WithCounts() throws Exception {
        when(authenticator.authenticate(any(), anyList())).thenReturn(Mockito.mock(SearchConsoleSession.class));
        when(analyticsClient.fetchAll(any(), anyString(), any(), any())).thenReturn(List.of(
            new AnalyticsRow(List.of("2026-10-01", "https://www.example.com/x", "stage failure", "mobile"), 1, 1, 1, 1),
            new AnalyticsRow(List.of("bad-date"), 1, 1, 1, 1)
        ));

        mockMvc.perform(post("/trigger-gsc-sync"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value(startsWith("Store load failed: ")))
            .andExpect(jsonPath("$.inserted").value(1))
            .andExpect(jsonPath("$.updated").value(0));
    }
}
