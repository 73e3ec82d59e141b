package com.graphivault.infrastructure.persistence;

import com.graphivault.config.VaultProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DelegatingDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Runs a fixed PRAGMA sequence on every physical connection before it is handed out.
 *
 * <p>Sits beneath the connection pool, so each pragma runs once per physical
 * connection. Order matters: {@code page_size} and {@code auto_vacuum} only take
 * effect before the database file is first written, which {@code journal_mode=WAL} does.
 */
@Slf4j
public class SqlitePragmaDataSource extends DelegatingDataSource {

    private final List<String> pragmas;

    public SqlitePragmaDataSource(DataSource target, List<String> pragmas) {
        super(target);
        this.pragmas = List.copyOf(pragmas);
    }

    /**
     * The vault's connection configuration. The busy wait comes first so that
     * switching the journal mode waits out a concurrent opener.
     */
    public static List<String> vaultPragmas(VaultProperties.Database settings) {
        return List.of(
            "PRAGMA busy_timeout = " + settings.getBusyTimeout().toMillis(),
            "PRAGMA page_size = " + settings.getPageSize(),
            "PRAGMA auto_vacuum = INCREMENTAL",
            "PRAGMA journal_mode = WAL",
            "PRAGMA synchronous = NORMAL",
            "PRAGMA foreign_keys = ON",
            "PRAGMA secure_delete = ON",
            "PRAGMA temp_store = MEMORY",
            "PRAGMA cache_size = -" + settings.getCacheSizeKib()
        );
    }

    public List<String> getPragmas() {
        return pragmas;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return configure(super.getConnection());
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return configure(super.getConnection(username, password));
    }

    private Connection configure(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String pragma : pragmas) {
                statement.execute(pragma);
            }
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        log.debug("Configured new SQLite connection with {} pragmas", pragmas.size());
        return connection;
    }
}
