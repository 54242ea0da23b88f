package com.labvault.api.service;

import com.labvault.api.exception.SnapshotFormatException;
import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupStatus;
import com.labvault.api.model.snapshot.RestoreResult;
import com.labvault.api.model.snapshot.SnapshotDocument;
import com.labvault.api.model.snapshot.SnapshotInfo;
import com.labvault.api.model.snapshot.SnapshotMetadata;
import com.labvault.api.model.snapshot.SnapshotUpload;
import com.labvault.api.model.snapshot.SnapshotValidationResult;
import com.labvault.api.repository.BackupRepository;
import com.labvault.api.repository.EntityCollectionRepository;
import com.labvault.api.storage.BackupStorage;
import com.labvault.api.storage.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Validates snapshot files and writes their collections back through the
 * {@link EntityCollectionRepository}.
 * <p>
 * A restore replaces every collection present in the snapshot. There is no rollback: when a
 * collection fails, the ones already replaced stay replaced and the result says so.
 * Only one restore runs at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestoreService {

    static final List<String> ACCEPTED_EXTENSIONS = List.of(".backup", ".json");
    static final String SUPPORTED_MAJOR_VERSION = "1";

    private final BackupRepository backupRepository;
    private final BackupStorage backupStorage;
    private final EntityCollectionRepository entityCollectionRepository;
    private final SnapshotCodec snapshotCodec;

    private final ReentrantLock restoreLock = new ReentrantLock();

    @Value("${backup.upload.max-size:500MB}")
    private DataSize maxUploadSize = DataSize.ofMegabytes(500);

    public SnapshotValidationResult validate(SnapshotUpload upload) {
        return inspect(upload).result();
    }

    /**
     * Validate a snapshot file on disk. Oversized files are rejected before being read.
     */
    public SnapshotValidationResult validate(Path path) {
        try {
            long size = Files.size(path);
            if (size > maxUploadSize.toBytes()) {
                return SnapshotValidationResult.invalid(tooLargeMessage());
            }
            byte[] content = Files.readAllBytes(path);
            return validate(new SnapshotUpload(path.getFileName().toString(), size, content));
        } catch (IOException e) {
            log.warn("Could not read backup file {}: {}", path, e.getMessage());
            return SnapshotValidationResult.invalid("Could not read backup file: " + e.getMessage());
        }
    }

    /**
     * Restore a completed backup from storage.
     */
    public RestoreResult restore(UUID backupId) {
        Optional<Backup> found = backupRepository.findById(backupId);
        if (found.isEmpty()) {
            return RestoreResult.failure("Backup not found");
        }
        Backup backup = found.get();
        if (backup.getStatus() != BackupStatus.COMPLETED) {
            return RestoreResult.failure("Backup " + backup.getFilename() + " is " + backup.getStatus()
                    + " and cannot be restored");
        }

        SnapshotDocument document;
        try {
            document = snapshotCodec.decode(backupStorage.read(backup.getFilename()));
        } catch (StorageException | SnapshotFormatException e) {
            log.error("Cannot restore backup {}: {}", backupId, e.getMessage());
            return RestoreResult.failure("Restore failed: " + e.getMessage());
        }

        log.warn("Restoring backup {} ({}), current data will be replaced", backupId, backup.getFilename());
        return restore(document);
    }

    /**
     * Validate an uploaded snapshot and restore it if it is valid. Nothing is written otherwise.
     */
    public RestoreResult uploadAndRestore(SnapshotUpload upload) {
        Inspection inspection = inspect(upload);
        if (!inspection.result().isValid()) {
            return RestoreResult.failure(inspection.result().getError());
        }
        log.warn("Restoring uploaded backup {}, current data will be replaced", upload.getFilename());
        return restore(inspection.document());
    }

    /**
     * Replace each collection of an already validated document.
     */
    public RestoreResult restore(SnapshotDocument document) {
        if (!restoreLock.tryLock()) {
            return RestoreResult.failure("Another restore is already in progress");
        }
        try {
            return applyCollections(document);
        } finally {
            restoreLock.unlock();
        }
    }

    private RestoreResult applyCollections(SnapshotDocument document) {
        Set<String> known = new HashSet<>(entityCollectionRepository.collectionNames());
        Map<String, Integer> restored = new LinkedHashMap<>();

        for (Map.Entry<String, List<Map<String, Object>>> entry : document.getData().entrySet()) {
            String collection = entry.getKey();
            if (!known.contains(collection)) {
                log.warn("Skipping unknown collection '{}' in snapshot", collection);
                continue;
            }
            List<Map<String, Object>> records = entry.getValue() != null ? entry.getValue() : List.of();
            try {
                int count = entityCollectionRepository.replaceEntities(collection, records);
                restored.put(collection, count);
            } catch (Exception e) {
                log.error("Restore failed at collection {} after {} collections: {}",
                        collection, restored.size(), e.getMessage(), e);
                String message = "Restore failed: " + e.getMessage();
                if (!restored.isEmpty()) {
                    message += " (already restored, not rolled back: " + String.join(", ", restored.keySet()) + ")";
                }
                return RestoreResult.failure(message, restored);
            }
        }

        int records = restored.values().stream().mapToInt(Integer::intValue).sum();
        log.info("Restore completed: {} records across {} collections", records, restored.size());
        return RestoreResult.success("Restore completed successfully", restored);
    }

    private Inspection inspect(SnapshotUpload upload) {
        if (upload.getSize() > maxUploadSize.toBytes()) {
            return Inspection.rejected(tooLargeMessage());
        }
        String filename = upload.getFilename() != null ? upload.getFilename().toLowerCase(Locale.ROOT) : "";
        if (ACCEPTED_EXTENSIONS.stream().noneMatch(filename::endsWith)) {
            return Inspection.rejected("Invalid file format. Expected .backup or .json file");
        }
        if (upload.getContent() == null || upload.getContent().length == 0) {
            return Inspection.rejected("Invalid backup file structure: file is empty");
        }

        SnapshotDocument document;
        try {
            document = snapshotCodec.decode(upload.getContent());
        } catch (SnapshotFormatException e) {
            return Inspection.rejected(e.getMessage());
        }

        SnapshotMetadata metadata = document.getMetadata();
        String version = metadata.getVersion();
        if (version != null && !version.equals(SUPPORTED_MAJOR_VERSION)
                && !version.startsWith(SUPPORTED_MAJOR_VERSION + ".")) {
            return Inspection.rejected("Unsupported backup version: " + version);
        }

        SnapshotInfo info = SnapshotInfo.builder()
                .version(version)
                .createdAt(metadata.getCreatedAt())
                .description(metadata.getDescription())
                .type(metadata.getType())
                .size(upload.getSize())
                .tables(document.collectionCount())
                .records(document.recordCount())
                .compressed(snapshotCodec.isCompressed(upload.getContent()))
                .build();
        return new Inspection(SnapshotValidationResult.valid(info), document);
    }

    private String tooLargeMessage() {
        return "Backup file is too large (max " + maxUploadSize.toMegabytes() + "MB)";
    }

    private record Inspection(SnapshotValidationResult result, SnapshotDocument document) {
        static Inspection rejected(String error) {
            return new Inspection(SnapshotValidationResult.invalid(error), null);
        }
    }
}
