package com.labvault.api.model.dto;

import com.labvault.api.model.entity.BackupSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class BackupSettingsResponse {

    private boolean autoBackupEnabled;
    private String backupFrequency;
    private int retentionDays;
    private boolean includeFiles;
    private boolean compressionEnabled;
    private boolean encryptionEnabled;
    private Instant lastBackupDate;
    private Instant nextScheduledBackup;
    private String cronJobId;
    private Instant updatedAt;

    public static BackupSettingsResponse fromEntity(BackupSettings settings) {
        return BackupSettingsResponse.builder()
                .autoBackupEnabled(settings.isAutoBackupEnabled())
                .backupFrequency(settings.getBackupFrequency().name())
                .retentionDays(settings.getRetentionDays())
                .includeFiles(settings.isIncludeFiles())
                .compressionEnabled(settings.isCompressionEnabled())
                .encryptionEnabled(settings.isEncryptionEnabled())
                .lastBackupDate(settings.getLastBackupDate())
                .nextScheduledBackup(settings.getNextScheduledBackup())
                .cronJobId(settings.getCronJobId())
                .updatedAt(settings.getUpdatedAt())
                .build();
    }
}
