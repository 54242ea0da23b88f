package com.labvault.api.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Display formatting for sizes and backup ages.
 */
public final class FormatUtils {

    private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FormatUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Format bytes into human-readable format (e.g., "1.50 GB").
     *
     * @param bytes Number of bytes
     * @return Formatted string like "1.50 GB", or "0 B" if zero or negative
     */
    public static String formatBytes(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unitIndex = 0;
        double size = bytes;
        while (size >= 1024 && unitIndex < BYTE_UNITS.length - 1) {
            size /= 1024;
            unitIndex++;
        }
        return String.format("%.2f %s", size, BYTE_UNITS[unitIndex]);
    }

    /**
     * Whole days elapsed between two instants, rounded down.
     */
    public static long daysBetween(Instant from, Instant to) {
        return Math.max(0, Duration.between(from, to).toDays());
    }

    /**
     * Relative age of a backup: "today", "1 day ago", "12 days ago", "2 months ago", "1 year ago".
     */
    public static String formatBackupAge(Instant createdAt, Instant now) {
        if (createdAt == null) {
            return "never";
        }
        long days = daysBetween(createdAt, now);
        if (days == 0) {
            return "today";
        }
        if (days == 1) {
            return "1 day ago";
        }
        if (days < 30) {
            return days + " days ago";
        }
        if (days < 365) {
            long months = days / 30;
            return months == 1 ? "1 month ago" : months + " months ago";
        }
        long years = days / 365;
        return years == 1 ? "1 year ago" : years + " years ago";
    }
}
