package com.graphivault.infrastructure.crypto;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.nio.file.Path;

/**
 * One call to the encryption gateway. Only the fields relevant to the operation are set.
 */
@Value
@Builder
public class GatewayRequest {

    GatewayOperation operation;
    Path vaultRoot;

    /** File to encrypt or decrypt. */
    Path sourcePath;

    /** Target of a decryption. */
    Path outputPath;

    @ToString.Exclude
    String password;

    public static GatewayRequest encrypt(Path vaultRoot, Path sourcePath, String password) {
        return GatewayRequest.builder()
            .operation(GatewayOperation.ENCRYPT_FILE)
            .vaultRoot(vaultRoot)
            .sourcePath(sourcePath)
            .password(password)
            .build();
    }

    public static GatewayRequest decrypt(Path vaultRoot, Path encryptedPath, Path outputPath, String password) {
        return GatewayRequest.builder()
            .operation(GatewayOperation.DECRYPT_FILE)
            .vaultRoot(vaultRoot)
            .sourcePath(encryptedPath)
            .outputPath(outputPath)
            .password(password)
            .build();
    }

    public static GatewayRequest lifecycle(GatewayOperation operation, Path vaultRoot, String password) {
        return GatewayRequest.builder()
            .operation(operation)
            .vaultRoot(vaultRoot)
            .password(password)
            .build();
    }
}
