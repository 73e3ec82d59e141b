package com.graphivault.config;

import com.graphivault.infrastructure.crypto.PasswordTransport;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized vault settings, bound from the {@code vault.*} namespace.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    /**
     * Vault root directory. Holds the data, encrypted, thumbnails, temp and backups subdirectories.
     */
    @NotNull
    private Path root = Path.of(System.getProperty("user.home"), ".graphivault", "vault");

    @Valid
    private Database database = new Database();

    @Valid
    private Gateway gateway = new Gateway();

    @Valid
    private Executors executors = new Executors();

    @Data
    public static class Database {

        /** File name of the SQLite database inside {@code <root>/data}. */
        @NotBlank
        private String fileName = "graphivault.db";

        @Min(1)
        private int poolSize = 4;

        /** How long a connection waits on a locked database before failing. */
        @NotNull
        private Duration busyTimeout = Duration.ofSeconds(5);

        /** Page cache size in KiB, applied as a negative {@code cache_size}. */
        @Min(0)
        private int cacheSizeKib = 64_000;

        @Min(512)
        private int pageSize = 4096;
    }

    @Data
    public static class Gateway {

        /** Base command line of the encryption gateway; the operation and its flags are appended. */
        @NotEmpty
        private List<String> command = new ArrayList<>(List.of("python", "python_backend/ipc/ipc_gateway.py"));

        /** Working directory of the gateway process; inherits the service's when unset. */
        private Path workingDirectory;

        @NotNull
        private PasswordTransport passwordTransport = PasswordTransport.ARGUMENT;

        /** Upper bound a caller waits for a gateway result; unbounded when unset. */
        private Duration callerTimeout;
    }

    @Data
    public static class Executors {

        @Min(1)
        private int storePoolSize = 4;

        @Min(1)
        private int gatewayPoolSize = 2;

        @Min(0)
        private int queueCapacity = 500;
    }
}
