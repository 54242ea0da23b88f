package com.labvault.api.model.dto;

import com.labvault.api.model.snapshot.RestoreResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@AllArgsConstructor
public class RestoreResultResponse {

    private boolean success;
    private String message;
    private boolean partial;
    private Map<String, Integer> restoredCollections;

    public static RestoreResultResponse fromResult(RestoreResult result) {
        return RestoreResultResponse.builder()
                .success(result.isSuccess())
                .message(result.getMessage())
                .partial(result.isPartial())
                .restoredCollections(result.getRestoredCollections())
                .build();
    }
}
