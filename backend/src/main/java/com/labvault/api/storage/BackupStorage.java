package com.labvault.api.storage;

/**
 * Durable storage for backup artifacts, addressed by filename relative to the backup root.
 * Implementations throw {@link StorageException} on I/O failures.
 */
public interface BackupStorage {

    /**
     * Create the backup root if it does not exist yet.
     */
    void ensureDirectory();

    void write(String filename, byte[] content);

    byte[] read(String filename);

    /**
     * Size of a stored artifact in bytes.
     */
    long size(String filename);

    boolean exists(String filename);

    /**
     * Delete an artifact.
     *
     * @return true if something was deleted, false if the artifact was already absent
     */
    boolean delete(String filename);

    /**
     * Human-readable location for logs and startup diagnostics.
     */
    String describe();
}
