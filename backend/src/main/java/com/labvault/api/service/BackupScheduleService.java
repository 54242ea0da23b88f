package com.labvault.api.service;

import com.labvault.api.model.entity.BackupFrequency;
import com.labvault.api.model.entity.BackupSettings;
import com.labvault.api.repository.BackupSettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Keeps the {@value #BACKUP_JOB_NAME} job of the {@link JobRegistry} in line with the persisted
 * backup settings. Automatic backups run at a fixed off-peak hour of the reference zone.
 */
@Slf4j
@Service
public class BackupScheduleService {

    public static final String BACKUP_JOB_NAME = "backup";

    private final JobRegistry jobRegistry;
    private final BackupExecutor backupExecutor;
    private final BackupSettingsRepository settingsRepository;
    private final ZoneId zone;
    private final int hour;

    public BackupScheduleService(JobRegistry jobRegistry,
                                 BackupExecutor backupExecutor,
                                 BackupSettingsRepository settingsRepository,
                                 @Value("${backup.schedule.zone:UTC}") String zone,
                                 @Value("${backup.schedule.hour:2}") int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("backup.schedule.hour must be between 0 and 23, got " + hour);
        }
        this.jobRegistry = jobRegistry;
        this.backupExecutor = backupExecutor;
        this.settingsRepository = settingsRepository;
        this.zone = ZoneId.of(zone);
        this.hour = hour;
    }

    /**
     * Cron expression for a frequency name. Unknown or missing values fall back to weekly.
     */
    public String cronExpressionFor(String frequency) {
        return cronExpressionFor(BackupFrequency.fromValueOrWeekly(frequency));
    }

    public String cronExpressionFor(BackupFrequency frequency) {
        return switch (frequency) {
            case DAILY -> "0 0 " + hour + " * * *";
            case MONTHLY -> "0 0 " + hour + " 1 * *";
            case WEEKLY -> "0 0 " + hour + " * * SUN";
        };
    }

    /**
     * Calendar estimate of the next run: one period after {@code from}, at the reference hour.
     */
    public Instant computeNextRunAt(BackupFrequency frequency, Instant from) {
        ZonedDateTime base = from.atZone(zone);
        ZonedDateTime next = switch (frequency) {
            case DAILY -> base.plusDays(1);
            case WEEKLY -> base.plusDays(7);
            case MONTHLY -> base.plusMonths(1);
        };
        return next.with(LocalTime.of(hour, 0)).toInstant();
    }

    public Instant computeNextRunAt(String frequency, Instant from) {
        return computeNextRunAt(BackupFrequency.fromValueOrWeekly(frequency), from);
    }

    /**
     * Register or remove the backup job according to the settings, then persist the derived
     * {@code nextScheduledBackup} and {@code cronJobId}.
     *
     * @return the saved settings
     */
    public BackupSettings applySettings(BackupSettings settings) {
        if (!settings.isAutoBackupEnabled()) {
            if (jobRegistry.stop(BACKUP_JOB_NAME)) {
                log.info("Automatic backups disabled, backup job stopped");
            }
            settings.setNextScheduledBackup(null);
            settings.setCronJobId(null);
            return settingsRepository.save(settings);
        }

        BackupFrequency frequency = settings.getBackupFrequency() != null
                ? settings.getBackupFrequency()
                : BackupFrequency.WEEKLY;
        String cron = cronExpressionFor(frequency);

        JobHandle handle = jobRegistry.register(BACKUP_JOB_NAME, cron, () -> runAutomaticBackup(frequency));

        settings.setNextScheduledBackup(handle.nextExecution(Instant.now()));
        settings.setCronJobId(BACKUP_JOB_NAME + ":" + cron);
        BackupSettings saved = settingsRepository.save(settings);

        log.info("Automatic {} backups scheduled ({}), next run at {}",
                frequency, cron, saved.getNextScheduledBackup());
        return saved;
    }

    /**
     * Next fire time of the live backup job, if one is registered.
     */
    public Optional<Instant> nextScheduledRun() {
        return jobRegistry.find(BACKUP_JOB_NAME)
                .filter(JobHandle::isRunning)
                .map(handle -> handle.nextExecution(Instant.now()));
    }

    public boolean isBackupJobActive() {
        return jobRegistry.isActive(BACKUP_JOB_NAME);
    }

    /**
     * Timer callback. Reads the current settings so a toggle changed since registration is honoured.
     */
    void runAutomaticBackup(BackupFrequency registeredFrequency) {
        BackupSettings current = settingsRepository.findFirstByOrderByIdAsc().orElse(null);
        if (current != null && !current.isAutoBackupEnabled()) {
            log.info("Skipping automatic backup: automatic backups are disabled");
            return;
        }
        boolean compress = current == null || current.isCompressionEnabled();
        BackupFrequency frequency = current != null && current.getBackupFrequency() != null
                ? current.getBackupFrequency()
                : registeredFrequency;

        log.info("Executing scheduled {} backup", frequency);
        backupExecutor.executeBackup(BackupTrigger.automatic(frequency, compress));
    }
}
