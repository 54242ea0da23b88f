package com.labvault.api.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of the backup settings. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupSettingsUpdateRequest {

    private Boolean autoBackupEnabled;

    @Pattern(regexp = "(?i)DAILY|WEEKLY|MONTHLY", message = "Backup frequency must be DAILY, WEEKLY or MONTHLY")
    private String backupFrequency;

    @Min(value = 1, message = "Retention must be at least 1 day")
    @Max(value = 365, message = "Retention cannot exceed 365 days")
    private Integer retentionDays;

    private Boolean includeFiles;
    private Boolean compressionEnabled;
    private Boolean encryptionEnabled;
}
