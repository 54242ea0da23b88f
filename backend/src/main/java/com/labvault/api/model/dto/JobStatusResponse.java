package com.labvault.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class JobStatusResponse {

    private boolean backupJobActive;
    private int totalJobs;
    private boolean autoBackupEnabled;
    private String backupFrequency;
    private Instant nextScheduledBackup;
    private Instant lastBackupDate;
}
