package com.labvault.api.event;

import com.labvault.api.model.entity.BackupSettings;
import com.labvault.api.model.entity.BackupType;
import com.labvault.api.service.BackupSettingsService;
import com.labvault.api.service.RetentionSweepResult;
import com.labvault.api.service.RetentionSweeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Follow-up of a successful automatic backup: record it on the settings, then prune expired
 * automatic backups. Runs on the thread that completed the backup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutomaticBackupListener {

    private final BackupSettingsService settingsService;
    private final RetentionSweeper retentionSweeper;

    @EventListener
    public void handleBackupCompleted(BackupCompletedEvent event) {
        if (event.getBackupType() != BackupType.AUTOMATIC) {
            return;
        }
        log.debug("Handling BackupCompletedEvent for backup: {}", event.getBackupId());

        BackupSettings settings = settingsService.recordAutomaticBackup(event.getCompletedAt());
        RetentionSweepResult result = retentionSweeper.sweep(settings.getRetentionDays());
        if (result.hasFailures()) {
            log.warn("Retention sweep left {} expired backups in place: {}",
                    result.getFailed().size(), result.getFailed());
        }
    }
}
