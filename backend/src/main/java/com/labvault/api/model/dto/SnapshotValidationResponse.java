package com.labvault.api.model.dto;

import com.labvault.api.model.snapshot.SnapshotInfo;
import com.labvault.api.model.snapshot.SnapshotValidationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class SnapshotValidationResponse {

    private boolean valid;
    private String error;
    private SnapshotInfo info;

    public static SnapshotValidationResponse fromResult(SnapshotValidationResult result) {
        return SnapshotValidationResponse.builder()
                .valid(result.isValid())
                .error(result.getError())
                .info(result.getInfo())
                .build();
    }
}
