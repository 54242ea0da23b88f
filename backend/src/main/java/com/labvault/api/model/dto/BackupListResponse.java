package com.labvault.api.model.dto;

import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupStatus;
import com.labvault.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class BackupListResponse {

    private List<BackupResponse> backups;
    private int count;
    private long totalSizeBytes;
    private String formattedTotalSize;

    public static BackupListResponse fromEntities(List<Backup> backups) {
        List<BackupResponse> responses = backups.stream()
                .map(BackupResponse::fromEntity)
                .toList();

        long totalSize = backups.stream()
                .filter(b -> b.getStatus() == BackupStatus.COMPLETED)
                .mapToLong(Backup::getSizeBytes)
                .sum();

        return BackupListResponse.builder()
                .backups(responses)
                .count(responses.size())
                .totalSizeBytes(totalSize)
                .formattedTotalSize(FormatUtils.formatBytes(totalSize))
                .build();
    }
}
