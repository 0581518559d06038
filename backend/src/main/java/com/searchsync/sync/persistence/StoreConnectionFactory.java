package com.searchsync.sync.persistence;

import com.searchsync.config.GscSyncProperties;
import com.searchsync.sync.util.DatabaseUrl;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Opens the store for a single load. Nothing is pooled: each {@link StoreSession} owns one
 * physical connection that is closed with the session.
 */
@Component
public class StoreConnectionFactory {
    private static final Logger log = LoggerFactory.getLogger(StoreConnectionFactory.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");
    // below V1, so an existing schema is baselined and V1 still creates the table
    static final String BASELINE_VERSION = "0";

    private final GscSyncProperties properties;
    private final Set<String> migratedStores = ConcurrentHashMap.newKeySet();

    public StoreConnectionFactory(GscSyncProperties properties) {
        this.properties = properties;
    }

    public StoreSession open() throws SQLException {
        GscSyncProperties.Store store = properties.getStore();
        String table = tableName(store.getTable());
        DatabaseUrl url = DatabaseUrl.parse(store.getUrl(), store.getUsername(), store.getPassword());
        if (store.isMigrate()) {
            migrate(url, table);
        }

        SingleConnectionDataSource dataSource =
            new SingleConnectionDataSource(url.jdbcUrl(), url.username(), url.password(), true);
        try {
            boolean postgres = detectPostgres(dataSource.getConnection());
            log.info("Connected to store {} (postgres={})", withoutQuery(url.jdbcUrl()), postgres);
            return new StoreSession(dataSource, postgres, table);
        } catch (SQLException | RuntimeException e) {
            dataSource.destroy();
            throw e;
        }
    }

    static String tableName(String configured) {
        String table = configured == null ? "" : configured.trim();
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid store table name '" + configured + "'");
        }
        return table.toLowerCase(Locale.ROOT);
    }

    private void migrate(DatabaseUrl url, String table) {
        String migrationKey = url.jdbcUrl() + "#" + table;
        if (migratedStores.contains(migrationKey)) {
            return;
        }
        DriverManagerDataSource migrationSource =
            new DriverManagerDataSource(url.jdbcUrl(), url.username(), url.password());
        int applied = Flyway.configure()
            .dataSource(migrationSource)
            .locations("classpath:db/migration")
            .placeholders(Map.of("table_name", table))
            .baselineOnMigrate(true)
            .baselineVersion(BASELINE_VERSION)
            .load()
            .migrate()
            .migrationsExecuted;
        migratedStores.add(migrationKey);
        log.info("Store schema up to date ({} migration(s) applied)", applied);
    }

    // query parameters may carry credentials
    private static String withoutQuery(String jdbcUrl) {
        int query = jdbcUrl.indexOf('?');
        return query < 0 ? jdbcUrl : jdbcUrl.substring(0, query);
    }

    private boolean detectPostgres(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        String productName = metaData == null ? null : metaData.getDatabaseProductName();
        String url = metaData == null ? null : metaData.getURL();
        if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
            return false;
        }
        return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
    }
}
