package com.labvault.api.controller;

import com.labvault.api.model.dto.CustomJobRequest;
import com.labvault.api.model.dto.JobInfoResponse;
import com.labvault.api.service.JobHandle;
import com.labvault.api.service.ScheduledJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Scheduled job management")
public class JobController {

    private final ScheduledJobService scheduledJobService;

    @GetMapping
    @Operation(summary = "List registered jobs")
    public ResponseEntity<List<JobInfoResponse>> listJobs() {
        List<JobInfoResponse> jobs = scheduledJobService.listJobs().values().stream()
                .map(JobInfoResponse::fromHandle)
                .toList();
        return ResponseEntity.ok(jobs);
    }

    @PostMapping
    @Operation(summary = "Schedule a custom job")
    public ResponseEntity<JobInfoResponse> scheduleJob(@Valid @RequestBody CustomJobRequest request) {
        JobHandle handle = scheduledJobService.scheduleCustomJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(JobInfoResponse.fromHandle(handle));
    }

    @DeleteMapping("/{name}")
    @Operation(summary = "Stop a job")
    public ResponseEntity<Map<String, String>> stopJob(@PathVariable String name) {
        scheduledJobService.stopJob(name);
        return ResponseEntity.ok(Map.of("message", "Job stopped: " + name));
    }
}
