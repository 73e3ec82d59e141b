package com.graphivault.config;

import com.graphivault.infrastructure.persistence.SchemaManager;
import com.graphivault.infrastructure.persistence.VaultDatabase;
import com.graphivault.infrastructure.persistence.VaultLayout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Opens the vault store at startup. A failed initialization aborts the context.
 */
@Configuration
@EnableConfigurationProperties(VaultProperties.class)
@Slf4j
public class StoreConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SchemaManager schemaManager(VaultProperties properties, Clock clock) {
        return new SchemaManager(properties.getDatabase(), clock);
    }

    @Bean(destroyMethod = "close")
    public VaultDatabase vaultDatabase(SchemaManager schemaManager, VaultProperties properties) {
        log.info("Opening vault at {}", properties.getRoot());
        return schemaManager.initialize(properties.getRoot());
    }

    @Bean
    public VaultLayout vaultLayout(VaultDatabase vaultDatabase) {
        return vaultDatabase.getLayout();
    }

    /**
     * Exposes the store's pool to health checks and pool metrics. Lifecycle stays with {@link VaultDatabase}.
     */
    @Bean(destroyMethod = "")
    public DataSource dataSource(VaultDatabase vaultDatabase) {
        return vaultDatabase.getDataSource();
    }
}
