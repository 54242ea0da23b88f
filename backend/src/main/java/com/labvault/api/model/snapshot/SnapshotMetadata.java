package com.labvault.api.model.snapshot;

import com.labvault.api.model.entity.BackupType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotMetadata {

    public static final String CURRENT_VERSION = "1.0";

    private String version;
    private Instant createdAt;
    private String description;
    private BackupType type;
}
