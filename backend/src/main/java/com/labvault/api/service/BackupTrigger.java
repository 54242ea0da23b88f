package com.labvault.api.service;

import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupFrequency;
import com.labvault.api.model.entity.BackupType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * What started a backup and how its artifact should be written.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class BackupTrigger {

    private final BackupType type;
    private final String createdBy;
    private final String description;
    private final boolean compress;

    public static BackupTrigger manual(String description, String createdBy, boolean compress) {
        return BackupTrigger.builder()
                .type(BackupType.MANUAL)
                .createdBy(createdBy == null || createdBy.isBlank() ? Backup.CREATED_BY_SYSTEM : createdBy)
                .description(description == null || description.isBlank() ? "Manual backup" : description)
                .compress(compress)
                .build();
    }

    public static BackupTrigger automatic(BackupFrequency frequency, boolean compress) {
        return BackupTrigger.builder()
                .type(BackupType.AUTOMATIC)
                .createdBy(Backup.CREATED_BY_SYSTEM_AUTO)
                .description("Automatic backup - " + frequency)
                .compress(compress)
                .build();
    }

    public boolean isAutomatic() {
        return type == BackupType.AUTOMATIC;
    }
}
