package com.labvault.api.config;

import com.labvault.api.model.entity.BackupSettings;
import com.labvault.api.storage.BackupStorage;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Validates backup configuration on startup and fails fast when it is unusable.
 */
@Slf4j
@Component
public class StartupValidator {

    private final BackupStorage backupStorage;

    @Value("${backup.execution-timeout:30m}")
    private Duration executionTimeout;

    @Value("${backup.upload.max-size:500MB}")
    private DataSize maxUploadSize;

    @Value("${backup.schedule.zone:UTC}")
    private String scheduleZone;

    @Value("${backup.retention.default-days:" + BackupSettings.DEFAULT_RETENTION_DAYS + "}")
    private int defaultRetentionDays;

    public StartupValidator(BackupStorage backupStorage) {
        this.backupStorage = backupStorage;
    }

    @PostConstruct
    public void validate() {
        log.info("Validating startup configuration...");

        validateLimits();
        validateScheduleZone();
        validateStorage();

        log.info("Startup configuration validation complete");
    }

    private void validateLimits() {
        if (executionTimeout == null || executionTimeout.isNegative() || executionTimeout.isZero()) {
            throw new IllegalStateException("backup.execution-timeout must be positive, got " + executionTimeout);
        }
        if (maxUploadSize == null || maxUploadSize.toBytes() <= 0) {
            throw new IllegalStateException("backup.upload.max-size must be positive, got " + maxUploadSize);
        }
        if (defaultRetentionDays < BackupSettings.MIN_RETENTION_DAYS
                || defaultRetentionDays > BackupSettings.MAX_RETENTION_DAYS) {
            throw new IllegalStateException("Default retention must be between "
                    + BackupSettings.MIN_RETENTION_DAYS + " and " + BackupSettings.MAX_RETENTION_DAYS
                    + " days, got " + defaultRetentionDays);
        }
        log.info("Backup limits: timeout={}, maxUpload={}MB", executionTimeout, maxUploadSize.toMegabytes());
    }

    private void validateScheduleZone() {
        try {
            ZoneId.of(scheduleZone);
        } catch (Exception e) {
            throw new IllegalStateException("backup.schedule.zone is not a valid time zone: " + scheduleZone, e);
        }
    }

    private void validateStorage() {
        try {
            backupStorage.ensureDirectory();
        } catch (Exception e) {
            throw new IllegalStateException("Backup storage is not usable: " + backupStorage.describe(), e);
        }
        log.info("Backup storage ready: {}", backupStorage.describe());
    }
}
