package com.graphivault.domain.model;

/**
 * Event type tags written to the audit log.
 *
 * <p>The column is free-form; these are the values this service emits.
 */
public final class AuditEventTypes {

    public static final String VAULT_INITIALIZED = "vault_initialized";
    public static final String VAULT_UNLOCKED = "vault_unlocked";
    public static final String VAULT_LOCKED = "vault_locked";
    public static final String IMAGE_ADDED = "image_added";
    public static final String IMAGE_DELETED = "image_deleted";
    public static final String IMAGE_PURGED = "image_purged";
    public static final String FILE_ENCRYPTED = "file_encrypted";
    public static final String FILE_DECRYPTED = "file_decrypted";
    public static final String BACKUP_CREATED = "backup_created";

    private AuditEventTypes() {}
}
