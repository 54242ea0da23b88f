package com.labvault.api.model.snapshot;

import com.labvault.api.model.entity.BackupType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class SnapshotInfo {

    private String version;
    private Instant createdAt;
    private String description;
    private BackupType type;
    private long size;
    private int tables;
    private long records;
    private boolean compressed;
}
