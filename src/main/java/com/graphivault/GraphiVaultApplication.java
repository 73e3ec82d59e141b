package com.graphivault;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the GraphiVault metadata store.
 *
 * <p>Local, single-user service that keeps the catalog of an encrypted image vault:
 *
 * <ul>
 *   <li><strong>Catalog</strong>: content-hash deduplicated assets, tags and annotations in SQLite</li>
 *   <li><strong>Settings</strong>: vault identity and a free-form settings map</li>
 *   <li><strong>Audit</strong>: append-only log of security-relevant events</li>
 *   <li><strong>Encryption</strong>: delegated to an out-of-process gateway; no key material here</li>
 * </ul>
 *
 * <p>The HTTP surface binds to loopback only.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@Slf4j
public class GraphiVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphiVaultApplication.class, args);

        log.info("""

            ==========================================
              GraphiVault store ready
              Catalog: SQLite (WAL, secure_delete)
              Encryption: external gateway
              Audit trail: append-only
            ==========================================
            """);
    }
}
