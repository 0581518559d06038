package com.searchsync.sync.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

public class StoreSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreSession.class);

    private final SingleConnectionDataSource dataSource;
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final boolean postgres;
    private final String table;

    StoreSession(SingleConnectionDataSource dataSource, boolean postgres, String table) {
        this.dataSource = dataSource;
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.postgres = postgres;
        this.table = table;
    }

    public NamedParameterJdbcTemplate jdbc() {
        return jdbc;
    }

    public TransactionTemplate transactionTemplate() {
        return transactionTemplate;
    }

    public boolean isPostgres() {
        return postgres;
    }

    public String table() {
        return table;
    }

    @Override
    public void close() {
        dataSource.destroy();
        log.info("Store connection closed");
    }
}
