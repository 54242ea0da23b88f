package com.labvault.api.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one retention sweep. Failed filenames keep their records so a later sweep retries them.
 */
@Getter
@ToString
@AllArgsConstructor
public class RetentionSweepResult {

    private final Instant cutoff;
    private final int candidates;
    private final int deleted;
    private final List<String> failed;

    public static RetentionSweepResult skipped() {
        return new RetentionSweepResult(null, 0, 0, List.of());
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
