package com.labvault.api.service;

import com.labvault.api.exception.ApiException;
import com.labvault.api.model.dto.BackupReminderResponse;
import com.labvault.api.model.dto.BackupStatsResponse;
import com.labvault.api.model.dto.JobStatusResponse;
import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupSettings;
import com.labvault.api.model.entity.BackupStatus;
import com.labvault.api.model.entity.BackupType;
import com.labvault.api.model.snapshot.RestoreResult;
import com.labvault.api.model.snapshot.SnapshotUpload;
import com.labvault.api.model.snapshot.SnapshotValidationResult;
import com.labvault.api.repository.BackupRepository;
import com.labvault.api.storage.BackupStorage;
import com.labvault.api.storage.StorageException;
import com.labvault.api.util.FormatUtils;
import com.labvault.api.util.NamingUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Operator-facing backup operations: manual backups, history, download, import, delete,
 * restore, statistics and reminders.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupService {

    private final BackupRepository backupRepository;
    private final BackupStorage backupStorage;
    private final BackupExecutor backupExecutor;
    private final BackupSettingsService settingsService;
    private final BackupScheduleService scheduleService;
    private final RestoreService restoreService;
    private final ReminderCalculator reminderCalculator;
    private final JobRegistry jobRegistry;

    /**
     * Run a manual backup synchronously. Manual backups never trigger a retention sweep.
     *
     * @throws ApiException with status 500 if the backup failed; the FAILED record stays in the history
     */
    public Backup createManualBackup(String description, String createdBy) {
        boolean compress = settingsService.getSettings().isCompressionEnabled();
        log.info("Manual backup requested by {}", createdBy != null ? createdBy : Backup.CREATED_BY_SYSTEM);

        Backup backup = backupExecutor.executeBackup(BackupTrigger.manual(description, createdBy, compress));
        if (backup.getStatus() == BackupStatus.FAILED) {
            throw new ApiException("Backup failed: " + backup.getErrorMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
        }
        return backup;
    }

    public List<Backup> listBackups() {
        return backupRepository.findAllByOrderByCreatedAtDesc();
    }

    public Backup getBackup(UUID backupId) {
        return backupRepository.findById(backupId)
                .orElseThrow(() -> ApiException.notFound("Backup not found"));
    }

    public BackupDownload downloadBackup(UUID backupId) {
        Backup backup = getBackup(backupId);
        if (backup.getStatus() != BackupStatus.COMPLETED) {
            throw new ApiException("Backup is " + backup.getStatus() + " and cannot be downloaded", HttpStatus.CONFLICT);
        }
        if (!backupStorage.exists(backup.getFilename())) {
            throw ApiException.notFound("Backup file not found");
        }
        return new BackupDownload(backup.getFilename(), backupStorage.read(backup.getFilename()));
    }

    /**
     * Delete the artifact, then the record. A missing or undeletable artifact does not block
     * removing the record.
     */
    public void deleteBackup(UUID backupId) {
        Backup backup = getBackup(backupId);
        if (!backup.isTerminal()) {
            throw new ApiException("Backup is still in progress", HttpStatus.CONFLICT);
        }

        try {
            backupStorage.delete(backup.getFilename());
        } catch (StorageException e) {
            log.warn("Could not delete backup file {}: {}", backup.getFilename(), e.getMessage());
        }
        backupRepository.delete(backup);
        log.info("Deleted backup {} ({})", backupId, backup.getFilename());
    }

    /**
     * Store a valid uploaded snapshot as a completed manual backup, without restoring it.
     */
    public Backup importBackup(SnapshotUpload upload, String createdBy) {
        SnapshotValidationResult validation = restoreService.validate(upload);
        if (!validation.isValid()) {
            throw ApiException.badRequest(validation.getError());
        }

        String extension = upload.getFilename().toLowerCase(Locale.ROOT).endsWith(".json") ? ".json" : ".backup";
        String filename = NamingUtils.backupFilename("backup", Instant.now(), extension);
        backupStorage.write(filename, upload.getContent());

        Backup backup = Backup.builder()
                .filename(filename)
                .status(BackupStatus.COMPLETED)
                .sizeBytes(backupStorage.size(filename))
                .createdBy(createdBy != null && !createdBy.isBlank() ? createdBy : Backup.CREATED_BY_SYSTEM)
                .type(BackupType.MANUAL)
                .description("Imported backup")
                .completedAt(Instant.now())
                .build();
        backup = backupRepository.save(backup);

        log.info("Imported backup {} as {} ({})", upload.getFilename(), filename,
                FormatUtils.formatBytes(backup.getSizeBytes()));
        return backup;
    }

    public RestoreResult restoreBackup(UUID backupId) {
        getBackup(backupId);
        return restoreService.restore(backupId);
    }

    public RestoreResult uploadAndRestore(SnapshotUpload upload) {
        return restoreService.uploadAndRestore(upload);
    }

    public SnapshotValidationResult validateBackup(SnapshotUpload upload) {
        return restoreService.validate(upload);
    }

    public BackupStatsResponse getStats() {
        long completed = backupRepository.countByStatus(BackupStatus.COMPLETED);
        long failed = backupRepository.countByStatus(BackupStatus.FAILED);
        long totalSize = backupRepository.sumSizeByStatus(BackupStatus.COMPLETED);

        List<Backup> history = backupRepository.findByStatusOrderByCreatedAtDesc(BackupStatus.COMPLETED);
        Instant last = history.isEmpty() ? null : history.get(0).getCreatedAt();
        Instant oldest = history.isEmpty() ? null : history.get(history.size() - 1).getCreatedAt();

        return BackupStatsResponse.builder()
                .totalBackups(completed)
                .failedBackups(failed)
                .totalSizeBytes(totalSize)
                .formattedTotalSize(FormatUtils.formatBytes(totalSize))
                .averageSizeBytes(completed > 0 ? totalSize / completed : 0)
                .lastBackupDate(last)
                .oldestBackupDate(oldest)
                .daysSinceLastBackup(daysSince(last))
                .build();
    }

    public BackupReminderResponse getReminder() {
        Instant last = backupRepository.findFirstByStatusOrderByCreatedAtDesc(BackupStatus.COMPLETED)
                .map(Backup::getCreatedAt)
                .orElse(null);
        long days = daysSince(last);

        return BackupReminderResponse.builder()
                .show(reminderCalculator.shouldRemind(days))
                .severity(reminderCalculator.classify(days).name())
                .daysSinceLastBackup(days)
                .lastBackupDate(last)
                .lastBackupAge(FormatUtils.formatBackupAge(last, Instant.now()))
                .message(reminderCalculator.message(days))
                .build();
    }

    public JobStatusResponse getJobStatus() {
        BackupSettings settings = settingsService.getSettings();
        Optional<Instant> nextRun = scheduleService.nextScheduledRun();

        return JobStatusResponse.builder()
                .backupJobActive(scheduleService.isBackupJobActive())
                .totalJobs(jobRegistry.size())
                .autoBackupEnabled(settings.isAutoBackupEnabled())
                .backupFrequency(settings.getBackupFrequency().name())
                .nextScheduledBackup(nextRun.orElse(settings.getNextScheduledBackup()))
                .lastBackupDate(settings.getLastBackupDate())
                .build();
    }

    private long daysSince(Instant last) {
        return last != null
                ? FormatUtils.daysBetween(last, Instant.now())
                : ReminderCalculator.NEVER_BACKED_UP_DAYS;
    }
}
