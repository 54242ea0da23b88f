package com.labvault.api.service;

import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupSettings;
import com.labvault.api.model.entity.BackupType;
import com.labvault.api.repository.BackupRepository;
import com.labvault.api.storage.BackupStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Prunes automatic backups older than the retention window. Manual backups are never selected.
 * The artifact goes first; a record whose artifact could not be deleted is kept for the next sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionSweeper {

    private final BackupRepository backupRepository;
    private final BackupStorage backupStorage;

    public RetentionSweepResult sweep(int retentionDays) {
        if (retentionDays < BackupSettings.MIN_RETENTION_DAYS) {
            log.warn("Skipping retention sweep: invalid retention of {} days", retentionDays);
            return RetentionSweepResult.skipped();
        }

        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        List<Backup> candidates = backupRepository.findRetentionCandidates(BackupType.AUTOMATIC, cutoff);
        if (candidates.isEmpty()) {
            log.debug("Retention sweep: no automatic backups older than {}", cutoff);
            return new RetentionSweepResult(cutoff, 0, 0, List.of());
        }

        log.info("Retention sweep: {} automatic backups older than {} days", candidates.size(), retentionDays);

        int deleted = 0;
        List<String> failed = new ArrayList<>();
        for (Backup backup : candidates) {
            if (!backup.isTerminal()) {
                log.debug("Retention sweep: skipping backup {} still {}", backup.getId(), backup.getStatus());
                continue;
            }
            String filename = backup.getFilename();
            try {
                if (!backupStorage.delete(filename)) {
                    log.info("Artifact {} already absent, removing record only", filename);
                }
            } catch (Exception e) {
                log.error("Failed to delete artifact {}, keeping its record: {}", filename, e.getMessage());
                failed.add(filename);
                continue;
            }

            try {
                backupRepository.delete(backup);
                deleted++;
                log.info("Deleted expired backup {} ({})", backup.getId(), filename);
            } catch (Exception e) {
                log.error("Deleted artifact {} but not its record: {}", filename, e.getMessage());
                failed.add(filename);
            }
        }

        log.info("Retention sweep finished: deleted={}, failed={}", deleted, failed.size());
        return new RetentionSweepResult(cutoff, candidates.size(), deleted, List.copyOf(failed));
    }
}
