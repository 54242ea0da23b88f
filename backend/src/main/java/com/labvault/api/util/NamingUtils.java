package com.labvault.api.util;

import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Naming helpers for tables and backup artifacts.
 */
public final class NamingUtils {

    private static final Pattern TABLE_NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private NamingUtils() {
    }

    /**
     * Convert a collection name such as {@code stockEntries} to its table name {@code stock_entries}.
     * The result is used verbatim in SQL, so anything outside {@code [a-z][a-z0-9_]*} is rejected.
     */
    public static String toTableName(String collectionName) {
        if (collectionName == null || collectionName.isBlank()) {
            throw new IllegalArgumentException("Collection name must not be blank");
        }
        String snake = collectionName.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .toLowerCase();
        if (!TABLE_NAME.matcher(snake).matches()) {
            throw new IllegalArgumentException("Invalid collection name: " + collectionName);
        }
        return snake;
    }

    /**
     * Timestamp-qualified artifact name, e.g. {@code backup-auto-2026-10-19T02-00-00-000Z-3f9a1c.backup}.
     * The random suffix keeps two backups started in the same millisecond apart.
     */
    public static String backupFilename(String prefix, Instant timestamp, String extension) {
        String stamp = timestamp.toString().replaceAll("[:.]", "-");
        String suffix = UUID.randomUUID().toString().substring(0, 6);
        return prefix + "-" + stamp + "-" + suffix + extension;
    }
}
