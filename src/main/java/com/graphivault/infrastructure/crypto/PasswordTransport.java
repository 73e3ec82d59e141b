package com.graphivault.infrastructure.crypto;

/**
 * How a password travels to the gateway process.
 */
public enum PasswordTransport {

    /** Passed as {@code --password <value>} on the command line. */
    ARGUMENT,

    /** Written to the child's standard input as the JSON payload {@code {"password": ...}}. */
    STDIN
}
