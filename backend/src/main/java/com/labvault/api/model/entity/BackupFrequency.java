package com.labvault.api.model.entity;

import java.util.Arrays;
import java.util.Optional;

public enum BackupFrequency {
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * Strict lookup, case-insensitive. Empty for null, blank or unknown values.
     */
    public static Optional<BackupFrequency> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(f -> f.name().equals(normalized))
                .findFirst();
    }

    /**
     * Lenient lookup used by the scheduler: anything unrecognised is treated as WEEKLY.
     */
    public static BackupFrequency fromValueOrWeekly(String value) {
        return parse(value).orElse(WEEKLY);
    }
}
