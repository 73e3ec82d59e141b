package com.graphivault.infrastructure.crypto;

/**
 * Operations understood by the encryption gateway, with their wire command names.
 */
public enum GatewayOperation {

    ENCRYPT_FILE("encrypt_file"),
    DECRYPT_FILE("decrypt_file"),
    INITIALIZE("initialize"),
    UNLOCK("unlock"),
    LOCK("lock");

    private final String commandName;

    GatewayOperation(String commandName) {
        this.commandName = commandName;
    }

    public String commandName() {
        return commandName;
    }
}
