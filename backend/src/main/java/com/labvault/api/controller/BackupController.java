package com.labvault.api.controller;

import com.labvault.api.model.dto.BackupListResponse;
import com.labvault.api.model.dto.BackupReminderResponse;
import com.labvault.api.model.dto.BackupResponse;
import com.labvault.api.model.dto.BackupSettingsResponse;
import com.labvault.api.model.dto.BackupSettingsUpdateRequest;
import com.labvault.api.model.dto.BackupStatsResponse;
import com.labvault.api.model.dto.CreateBackupRequest;
import com.labvault.api.model.dto.JobStatusResponse;
import com.labvault.api.model.dto.RestoreResultResponse;
import com.labvault.api.model.dto.SnapshotValidationResponse;
import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.snapshot.RestoreResult;
import com.labvault.api.model.snapshot.SnapshotUpload;
import com.labvault.api.service.BackupDownload;
import com.labvault.api.service.BackupService;
import com.labvault.api.service.BackupSettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/backups")
@RequiredArgsConstructor
@Tag(name = "Backups", description = "Backup, retention and restore management")
public class BackupController {

    private static final String USER_HEADER = "X-User-Id";

    private final BackupService backupService;
    private final BackupSettingsService settingsService;

    @GetMapping
    @Operation(summary = "List all backups, newest first")
    public ResponseEntity<BackupListResponse> listBackups() {
        List<Backup> backups = backupService.listBackups();
        return ResponseEntity.ok(BackupListResponse.fromEntities(backups));
    }

    @PostMapping
    @Operation(summary = "Create a manual backup")
    public ResponseEntity<BackupResponse> createBackup(
            @Valid @RequestBody(required = false) CreateBackupRequest request,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        String description = request != null ? request.getDescription() : null;
        Backup backup = backupService.createManualBackup(description, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(BackupResponse.fromEntity(backup));
    }

    @GetMapping("/{backupId}")
    @Operation(summary = "Get backup details")
    public ResponseEntity<BackupResponse> getBackup(@PathVariable UUID backupId) {
        return ResponseEntity.ok(BackupResponse.fromEntity(backupService.getBackup(backupId)));
    }

    @GetMapping("/{backupId}/download")
    @Operation(summary = "Download a backup file")
    public ResponseEntity<byte[]> downloadBackup(@PathVariable UUID backupId) {
        BackupDownload download = backupService.downloadBackup(backupId);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(download.getFilename()).build().toString())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .contentLength(download.getContent().length)
                .body(download.getContent());
    }

    @DeleteMapping("/{backupId}")
    @Operation(summary = "Delete a backup and its file")
    public ResponseEntity<Map<String, String>> deleteBackup(@PathVariable UUID backupId) {
        backupService.deleteBackup(backupId);
        return ResponseEntity.ok(Map.of("message", "Backup deleted successfully"));
    }

    @PostMapping("/{backupId}/restore")
    @Operation(summary = "Restore from a backup (replaces all current data)")
    public ResponseEntity<RestoreResultResponse> restoreBackup(@PathVariable UUID backupId) {
        return restoreResponse(backupService.restoreBackup(backupId));
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Import a backup file without restoring it")
    public ResponseEntity<BackupResponse> importBackup(
            @RequestParam("backup") MultipartFile file,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        Backup backup = backupService.importBackup(toUpload(file), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(BackupResponse.fromEntity(backup));
    }

    @PostMapping(value = "/upload/restore", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a backup file and restore it (replaces all current data)")
    public ResponseEntity<RestoreResultResponse> uploadAndRestore(@RequestParam("backup") MultipartFile file) {
        return restoreResponse(backupService.uploadAndRestore(toUpload(file)));
    }

    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Validate a backup file without applying it")
    public ResponseEntity<SnapshotValidationResponse> validateBackup(@RequestParam("backup") MultipartFile file) {
        return ResponseEntity.ok(SnapshotValidationResponse.fromResult(backupService.validateBackup(toUpload(file))));
    }

    @GetMapping("/stats")
    @Operation(summary = "Backup statistics")
    public ResponseEntity<BackupStatsResponse> getStats() {
        return ResponseEntity.ok(backupService.getStats());
    }

    @GetMapping("/reminder")
    @Operation(summary = "Staleness reminder for the latest successful backup")
    public ResponseEntity<BackupReminderResponse> getReminder() {
        return ResponseEntity.ok(backupService.getReminder());
    }

    @GetMapping("/settings")
    @Operation(summary = "Get backup settings")
    public ResponseEntity<BackupSettingsResponse> getSettings() {
        return ResponseEntity.ok(BackupSettingsResponse.fromEntity(settingsService.getSettings()));
    }

    @PutMapping("/settings")
    @Operation(summary = "Update backup settings and reschedule automatic backups")
    public ResponseEntity<BackupSettingsResponse> updateSettings(
            @Valid @RequestBody BackupSettingsUpdateRequest request) {
        return ResponseEntity.ok(BackupSettingsResponse.fromEntity(settingsService.updateSettings(request)));
    }

    @GetMapping("/job-status")
    @Operation(summary = "Status of the automatic backup job")
    public ResponseEntity<JobStatusResponse> getJobStatus() {
        return ResponseEntity.ok(backupService.getJobStatus());
    }

    private ResponseEntity<RestoreResultResponse> restoreResponse(RestoreResult result) {
        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(RestoreResultResponse.fromResult(result));
    }

    private SnapshotUpload toUpload(MultipartFile file) {
        try {
            return new SnapshotUpload(file.getOriginalFilename(), file.getSize(), file.getBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded backup file", e);
        }
    }
}
