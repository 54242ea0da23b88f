package com.labvault.api.model.dto;

import com.labvault.api.model.entity.Backup;
import com.labvault.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class BackupResponse {

    private UUID id;
    private String filename;
    private String status;
    private String type;
    private long sizeBytes;
    private String formattedSize;
    private String createdBy;
    private String description;
    private String errorMessage;
    private Instant completedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public static BackupResponse fromEntity(Backup backup) {
        return BackupResponse.builder()
                .id(backup.getId())
                .filename(backup.getFilename())
                .status(backup.getStatus().name())
                .type(backup.getType() != null ? backup.getType().name() : null)
                .sizeBytes(backup.getSizeBytes())
                .formattedSize(FormatUtils.formatBytes(backup.getSizeBytes()))
                .createdBy(backup.getCreatedBy())
                .description(backup.getDescription())
                .errorMessage(backup.getErrorMessage())
                .completedAt(backup.getCompletedAt())
                .createdAt(backup.getCreatedAt())
                .updatedAt(backup.getUpdatedAt())
                .build();
    }
}
