package com.labvault.api.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of checking a snapshot file. Exactly one of {@code error} and {@code info} is set.
 */
@Getter
@ToString
@AllArgsConstructor
public class SnapshotValidationResult {

    private final boolean valid;
    private final String error;
    private final SnapshotInfo info;

    public static SnapshotValidationResult valid(SnapshotInfo info) {
        return new SnapshotValidationResult(true, null, info);
    }

    public static SnapshotValidationResult invalid(String error) {
        return new SnapshotValidationResult(false, error, null);
    }
}
