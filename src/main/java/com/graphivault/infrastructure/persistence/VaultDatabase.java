package com.graphivault.infrastructure.persistence;

import com.zaxxer.hikari.HikariDataSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;

/**
 * Handle to an initialized vault store. Owns the connection pool; closing it releases every connection.
 */
@Slf4j
@Getter
public class VaultDatabase implements AutoCloseable {

    private final VaultLayout layout;
    private final Path databaseFile;
    private final HikariDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    VaultDatabase(VaultLayout layout, Path databaseFile, HikariDataSource dataSource) {
        this.layout = layout;
        this.databaseFile = databaseFile;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    public boolean isOpen() {
        return !dataSource.isClosed();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            log.info("Closing vault store at {}", databaseFile);
            dataSource.close();
        }
    }
}
