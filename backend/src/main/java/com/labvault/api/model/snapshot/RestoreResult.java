package com.labvault.api.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a restore. On failure {@code restoredCollections} lists what had already been replaced:
 * those collections are not rolled back, and {@code partial} is set when there are any.
 */
@Getter
@ToString
@AllArgsConstructor
public class RestoreResult {

    private final boolean success;
    private final String message;
    private final Map<String, Integer> restoredCollections;

    public static RestoreResult success(String message, Map<String, Integer> restoredCollections) {
        return new RestoreResult(true, message, Collections.unmodifiableMap(new LinkedHashMap<>(restoredCollections)));
    }

    public static RestoreResult failure(String message) {
        return new RestoreResult(false, message, Map.of());
    }

    public static RestoreResult failure(String message, Map<String, Integer> restoredCollections) {
        return new RestoreResult(false, message, Collections.unmodifiableMap(new LinkedHashMap<>(restoredCollections)));
    }

    public boolean isPartial() {
        return !success && !restoredCollections.isEmpty();
    }
}
