package com.labvault.api.service;

import com.labvault.api.exception.ApiException;
import com.labvault.api.model.dto.CustomJobRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;

/**
 * Operator access to the job registry. Custom jobs only log when they fire; the built-in
 * jobs are managed by their own services and cannot be replaced or stopped here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledJobService {

    static final Set<String> RESERVED_JOB_NAMES = Set.of(BackupScheduleService.BACKUP_JOB_NAME, QcReminderJob.JOB_NAME);

    private final JobRegistry jobRegistry;

    public Map<String, JobHandle> listJobs() {
        return jobRegistry.listActive();
    }

    public JobHandle scheduleCustomJob(CustomJobRequest request) {
        String name = request.getJobName();
        if (RESERVED_JOB_NAMES.contains(name)) {
            throw ApiException.badRequest("Job name '" + name + "' is reserved");
        }
        String description = request.getDescription() != null ? request.getDescription() : name;

        try {
            return jobRegistry.register(name, request.getCronExpression(),
                    () -> log.info("Executing custom job '{}': {}", name, description));
        } catch (IllegalArgumentException e) {
            throw ApiException.badRequest("Invalid cron expression '" + request.getCronExpression() + "': " + e.getMessage());
        }
    }

    public void stopJob(String name) {
        if (RESERVED_JOB_NAMES.contains(name)) {
            throw new ApiException("Job '" + name + "' is managed by the application and cannot be stopped here",
                    HttpStatus.CONFLICT);
        }
        if (!jobRegistry.stop(name)) {
            throw ApiException.notFound("Job not found: " + name);
        }
    }
}
