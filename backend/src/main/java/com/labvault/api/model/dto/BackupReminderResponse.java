package com.labvault.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class BackupReminderResponse {

    private boolean show;
    private String severity;
    private long daysSinceLastBackup;
    private Instant lastBackupDate;
    private String lastBackupAge;
    private String message;
}
