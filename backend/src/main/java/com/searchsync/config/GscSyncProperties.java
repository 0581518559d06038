package com.searchsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "gsc-sync")
public class GscSyncProperties {
    public static final String DEFAULT_SCOPE = "https://www.googleapis.com/auth/webmasters.readonly";
    public static final int MAX_ROW_LIMIT = 25000;
    public static final String DEFAULT_TABLE = "search_performance";
    private static final String DEFAULT_SEARCH_TYPE = "WEB";

    private String credentialsPath = "/etc/secrets/gsc_service_account.json";
    private String siteUrl;
    private List<String> scopes = new ArrayList<>(List.of(DEFAULT_SCOPE));
    private String searchType = DEFAULT_SEARCH_TYPE;
    private int defaultDaysAgo = 2;
    private Api api = new Api();
    private Store store = new Store();
    private Cli cli = new Cli();

    public String getCredentialsPath() {
        return credentialsPath;
    }

    public void setCredentialsPath(String credentialsPath) {
        this.credentialsPath = credentialsPath;
    }

    public String getSiteUrl() {
        return siteUrl;
    }

    public void setSiteUrl(String siteUrl) {
        this.siteUrl = siteUrl;
    }

    public List<String> getScopes() {
        if (scopes == null || scopes.isEmpty()) {
            return List.of(DEFAULT_SCOPE);
        }
        return scopes;
    }

    public void setScopes(List<String> scopes) {
        this.scopes = scopes;
    }

    public String getSearchType() {
        if (searchType == null || searchType.isBlank()) {
            return DEFAULT_SEARCH_TYPE;
        }
        return searchType.trim().toUpperCase(Locale.ROOT);
    }

    public void setSearchType(String searchType) {
        this.searchType = searchType;
    }

    public int getDefaultDaysAgo() {
        return Math.max(0, defaultDaysAgo);
    }

    public void setDefaultDaysAgo(int defaultDaysAgo) {
        this.defaultDaysAgo = Math.max(0, defaultDaysAgo);
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Api {
        private String baseUrl = "https://searchconsole.googleapis.com";
        private int rowLimit = 5000;
        private int requestTimeoutSeconds = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getRowLimit() {
            return Math.max(1, Math.min(rowLimit, MAX_ROW_LIMIT));
        }

        public void setRowLimit(int rowLimit) {
            this.rowLimit = Math.max(1, Math.min(rowLimit, MAX_ROW_LIMIT));
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Store {
        private String url;
        private String username;
        private String password;
        private String table = DEFAULT_TABLE;
        private boolean migrate = true;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getTable() {
            if (table == null || table.isBlank()) {
                return DEFAULT_TABLE;
            }
            return table.trim();
        }

        public void setTable(String table) {
            this.table = table;
        }

        public boolean isMigrate() {
            return migrate;
        }

        public void setMigrate(boolean migrate) {
            this.migrate = migrate;
        }
    }

    public static class Cli {
        private boolean run = false;
        private int daysAgo = 2;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public int getDaysAgo() {
            return Math.max(0, daysAgo);
        }

        public void setDaysAgo(int daysAgo) {
            this.daysAgo = Math.max(0, daysAgo);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
