package com.labvault.api.service;

import com.labvault.api.exception.ApiException;
import com.labvault.api.exception.BackupConfigurationException;
import com.labvault.api.model.dto.BackupSettingsUpdateRequest;
import com.labvault.api.model.entity.BackupFrequency;
import com.labvault.api.model.entity.BackupSettings;
import com.labvault.api.repository.BackupSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the backup settings singleton. Every update runs read, modify, reschedule and persist
 * under one lock, so two concurrent updates never interleave.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupSettingsService {

    private final BackupSettingsRepository settingsRepository;
    private final BackupScheduleService scheduleService;

    private final ReentrantLock updateLock = new ReentrantLock();

    /**
     * Current settings, creating the default row on first access.
     *
     * @throws BackupConfigurationException if the settings cannot be read or created
     */
    public BackupSettings getSettings() {
        try {
            return settingsRepository.findFirstByOrderByIdAsc()
                    .orElseGet(() -> {
                        log.info("No backup settings found, creating defaults");
                        return settingsRepository.save(BackupSettings.defaults());
                    });
        } catch (DataAccessException e) {
            throw new BackupConfigurationException("Backup settings are unavailable: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * Apply a partial update and reschedule. Only non-null fields of the request change.
     */
    public BackupSettings updateSettings(BackupSettingsUpdateRequest request) {
        BackupFrequency frequency = null;
        if (request.getBackupFrequency() != null) {
            frequency = BackupFrequency.parse(request.getBackupFrequency())
                    .orElseThrow(() -> ApiException.badRequest("Invalid backup frequency: "
                            + request.getBackupFrequency() + ". Expected DAILY, WEEKLY or MONTHLY"));
        }
        Integer retentionDays = request.getRetentionDays();
        if (retentionDays != null && (retentionDays < BackupSettings.MIN_RETENTION_DAYS
                || retentionDays > BackupSettings.MAX_RETENTION_DAYS)) {
            throw ApiException.badRequest("Retention days must be between "
                    + BackupSettings.MIN_RETENTION_DAYS + " and " + BackupSettings.MAX_RETENTION_DAYS);
        }

        updateLock.lock();
        try {
            BackupSettings settings = getSettings();

            if (request.getAutoBackupEnabled() != null) {
                settings.setAutoBackupEnabled(request.getAutoBackupEnabled());
            }
            if (frequency != null) {
                settings.setBackupFrequency(frequency);
            }
            if (retentionDays != null) {
                settings.setRetentionDays(retentionDays);
            }
            if (request.getIncludeFiles() != null) {
                settings.setIncludeFiles(request.getIncludeFiles());
            }
            if (request.getCompressionEnabled() != null) {
                settings.setCompressionEnabled(request.getCompressionEnabled());
            }
            if (request.getEncryptionEnabled() != null) {
                settings.setEncryptionEnabled(request.getEncryptionEnabled());
            }

            BackupSettings saved = scheduleService.applySettings(settings);
            log.info("Backup settings updated: autoBackupEnabled={}, frequency={}, retentionDays={}",
                    saved.isAutoBackupEnabled(), saved.getBackupFrequency(), saved.getRetentionDays());
            return saved;
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Record a completed automatic backup and refresh the displayed next run.
     */
    public BackupSettings recordAutomaticBackup(Instant completedAt) {
        updateLock.lock();
        try {
            BackupSettings settings = getSettings();
            settings.setLastBackupDate(completedAt != null ? completedAt : Instant.now());
            settings.setNextScheduledBackup(scheduleService.nextScheduledRun()
                    .orElseGet(() -> settings.isAutoBackupEnabled()
                            ? scheduleService.computeNextRunAt(settings.getBackupFrequency(), Instant.now())
                            : null));
            return settingsRepository.save(settings);
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Re-arm the backup job from the persisted settings once the application is up.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void restoreSchedule() {
        updateLock.lock();
        try {
            BackupSettings settings = getSettings();
            scheduleService.applySettings(settings);
            log.info("Backup schedule initialized: autoBackupEnabled={}, frequency={}",
                    settings.isAutoBackupEnabled(), settings.getBackupFrequency());
        } catch (BackupConfigurationException e) {
            log.error("Could not initialize backup schedule: {}", e.getMessage(), e);
        } finally {
            updateLock.unlock();
        }
    }
}
