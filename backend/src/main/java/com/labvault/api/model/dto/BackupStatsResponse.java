package com.labvault.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class BackupStatsResponse {

    private long totalBackups;
    private long failedBackups;
    private long totalSizeBytes;
    private String formattedTotalSize;
    private long averageSizeBytes;
    private Instant lastBackupDate;
    private Instant oldestBackupDate;
    private long daysSinceLastBackup;
}
