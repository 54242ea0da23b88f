package com.labvault.api.service;

import com.labvault.api.event.BackupCompletedEvent;
import com.labvault.api.exception.BackupExecutionException;
import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupStatus;
import com.labvault.api.model.snapshot.SnapshotDocument;
import com.labvault.api.model.snapshot.SnapshotMetadata;
import com.labvault.api.repository.BackupRepository;
import com.labvault.api.repository.EntityCollectionRepository;
import com.labvault.api.storage.BackupStorage;
import com.labvault.api.util.FormatUtils;
import com.labvault.api.util.NamingUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Captures a full snapshot of the business collections and records the attempt as a {@link Backup}.
 * <p>
 * The record is inserted PENDING and moved to IN_PROGRESS before any data is read, so a concurrent
 * reader always sees it. Enumeration, serialization, write and stat run on the snapshot pool under
 * {@code backup.execution-timeout}. Whatever happens in those steps, the record is COMPLETED or
 * FAILED when this method returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupExecutor {

    static final String ARTIFACT_EXTENSION = ".backup";

    private final BackupRepository backupRepository;
    private final EntityCollectionRepository entityCollectionRepository;
    private final BackupStorage backupStorage;
    private final SnapshotCodec snapshotCodec;
    private final ApplicationEventPublisher eventPublisher;
    private final ThreadPoolTaskExecutor snapshotTaskExecutor;

    @Value("${backup.execution-timeout:30m}")
    private Duration executionTimeout = Duration.ofMinutes(30);

    @Value("${backup.cancel-grace:10s}")
    private Duration cancelGrace = Duration.ofSeconds(10);

    /**
     * Run one backup to completion.
     *
     * @return the backup record in a terminal state
     */
    public Backup executeBackup(BackupTrigger trigger) {
        Instant startedAt = Instant.now();
        String prefix = trigger.isAutomatic() ? "backup-auto" : "backup";

        Backup backup = Backup.builder()
                .filename(NamingUtils.backupFilename(prefix, startedAt, ARTIFACT_EXTENSION))
                .status(BackupStatus.PENDING)
                .sizeBytes(0L)
                .createdBy(trigger.getCreatedBy())
                .type(trigger.getType())
                .description(trigger.getDescription())
                .build();
        backup = backupRepository.save(backup);
        log.info("Created {} backup {} ({})", trigger.getType(), backup.getId(), backup.getFilename());

        try {
            backup.transitionTo(BackupStatus.IN_PROGRESS);
            backup = backupRepository.save(backup);

            final Backup running = backup;
            long size = runBounded(() -> writeSnapshot(running, trigger), running.getFilename());

            backup = saveCompleted(backup, size);

            log.info("Backup {} completed: {} ({}) in {} ms", backup.getId(), backup.getFilename(),
                    FormatUtils.formatBytes(size), Duration.between(startedAt, Instant.now()).toMillis());
        } catch (Exception e) {
            log.error("Backup {} failed: {}", backup.getId(), e.getMessage(), e);
            discardArtifact(backup.getFilename());
            return markFailed(backup, e);
        }

        if (trigger.isAutomatic()) {
            publishCompleted(backup);
        }
        return backup;
    }

    /**
     * Enumerate, serialize, write, stat. Returns the stored size in bytes.
     */
    private long writeSnapshot(Backup backup, BackupTrigger trigger) {
        Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
        for (String collection : entityCollectionRepository.collectionNames()) {
            data.put(collection, entityCollectionRepository.listEntities(collection));
        }

        SnapshotDocument document = SnapshotDocument.builder()
                .metadata(SnapshotMetadata.builder()
                        .version(SnapshotMetadata.CURRENT_VERSION)
                        .createdAt(Instant.now())
                        .description(trigger.getDescription())
                        .type(trigger.getType())
                        .build())
                .data(data)
                .build();

        byte[] content = snapshotCodec.encode(document, trigger.isCompress());
        log.debug("Backup {}: serialized {} collections, {} records, {} bytes", backup.getId(),
                document.collectionCount(), document.recordCount(), content.length);

        backupStorage.write(backup.getFilename(), content);
        if (Thread.currentThread().isInterrupted()) {
            // cancelled while writing; the caller may already have given up on this artifact
            backupStorage.delete(backup.getFilename());
            throw new BackupExecutionException("Backup cancelled");
        }
        return backupStorage.size(backup.getFilename());
    }

    /**
     * Persist the COMPLETED state. If the save fails, the in-memory record is put back to
     * IN_PROGRESS so the failure path can still record it as FAILED.
     */
    private Backup saveCompleted(Backup backup, long size) {
        backup.setSizeBytes(size);
        backup.setCompletedAt(Instant.now());
        backup.transitionTo(BackupStatus.COMPLETED);
        try {
            return backupRepository.save(backup);
        } catch (RuntimeException e) {
            backup.setStatus(BackupStatus.IN_PROGRESS);
            backup.setCompletedAt(null);
            throw e;
        }
    }

    private long runBounded(Callable<Long> work, String filename) throws Exception {
        CountDownLatch finished = new CountDownLatch(1);
        Future<Long> future = snapshotTaskExecutor.submit(() -> {
            try {
                return work.call();
            } finally {
                finished.countDown();
            }
        });
        try {
            return future.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            awaitWorker(finished, filename);
            throw new BackupExecutionException("Backup timed out after " + executionTimeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackupExecutionException("Backup interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw new BackupExecutionException(cause.getMessage(), cause);
        }
    }

    /**
     * Give a cancelled worker time to leave storage before its artifact is discarded, so a write
     * that was already under way cannot land after the cleanup.
     */
    private void awaitWorker(CountDownLatch finished, String filename) {
        try {
            if (!finished.await(cancelGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out backup worker for {} still running after {}", filename, cancelGrace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Backup markFailed(Backup backup, Exception cause) {
        backup.setSizeBytes(0L);
        backup.setErrorMessage(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        if (!backup.isTerminal()) {
            backup.transitionTo(BackupStatus.FAILED);
        }
        try {
            return backupRepository.save(backup);
        } catch (Exception saveError) {
            log.error("Could not persist FAILED status for backup {}: {}", backup.getId(), saveError.getMessage());
            return backup;
        }
    }

    private void discardArtifact(String filename) {
        try {
            backupStorage.delete(filename);
        } catch (Exception e) {
            log.warn("Could not remove artifact {} of failed backup: {}", filename, e.getMessage());
        }
    }

    private void publishCompleted(Backup backup) {
        try {
            eventPublisher.publishEvent(new BackupCompletedEvent(
                    this, backup.getId(), backup.getType(), backup.getCompletedAt()));
        } catch (Exception e) {
            log.error("Post-backup processing failed for backup {}: {}", backup.getId(), e.getMessage(), e);
        }
    }
}
