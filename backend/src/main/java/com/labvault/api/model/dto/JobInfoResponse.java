package com.labvault.api.model.dto;

import com.labvault.api.service.JobHandle;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class JobInfoResponse {

    private String name;
    private String cronExpression;
    private boolean running;
    private boolean executing;
    private long runCount;
    private Instant registeredAt;
    private Instant lastRunAt;
    private Instant nextRunAt;

    public static JobInfoResponse fromHandle(JobHandle handle) {
        return JobInfoResponse.builder()
                .name(handle.getName())
                .cronExpression(handle.getCronExpression())
                .running(handle.isRunning())
                .executing(handle.isExecuting())
                .runCount(handle.getRunCount())
                .registeredAt(handle.getRegisteredAt())
                .lastRunAt(handle.getLastRunAt())
                .nextRunAt(handle.isRunning() ? handle.nextExecution(Instant.now()) : null)
                .build();
    }
}
