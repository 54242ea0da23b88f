package com.labvault.api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labvault.api.event.BackupCompletedEvent;
import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupFrequency;
import com.labvault.api.model.entity.BackupStatus;
import com.labvault.api.model.entity.BackupType;
import com.labvault.api.model.snapshot.SnapshotDocument;
import com.labvault.api.repository.BackupRepository;
import com.labvault.api.repository.EntityCollectionRepository;
import com.labvault.api.storage.BackupStorage;
import com.labvault.api.storage.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("BackupExecutor")
@ExtendWith(MockitoExtension.class)
class BackupExecutorTest {

    @Mock private BackupRepository backupRepository;
    @Mock private EntityCollectionRepository entityCollectionRepository;
    @Mock private BackupStorage backupStorage;
    @Mock private ApplicationEventPublisher eventPublisher;

    private SnapshotCodec snapshotCodec;
    private ThreadPoolTaskExecutor snapshotTaskExecutor;
    private BackupExecutor executor;

    private final List<BackupStatus> savedStatuses = new ArrayList<>();

    @BeforeEach
    void setUp() {
        snapshotCodec = new SnapshotCodec(new ObjectMapper().findAndRegisterModules());
        snapshotTaskExecutor = new ThreadPoolTaskExecutor();
        snapshotTaskExecutor.setCorePoolSize(1);
        snapshotTaskExecutor.initialize();

        executor = new BackupExecutor(backupRepository, entityCollectionRepository, backupStorage,
                snapshotCodec, eventPublisher, snapshotTaskExecutor);
        ReflectionTestUtils.setField(executor, "executionTimeout", Duration.ofSeconds(10));

        when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> {
            Backup backup = inv.getArgument(0);
            if (backup.getId() == null) {
                backup.setId(UUID.randomUUID());
            }
            savedStatuses.add(backup.getStatus());
            return backup;
        });
    }

    @AfterEach
    void tearDown() {
        snapshotTaskExecutor.shutdown();
    }

    @Nested
    @DisplayName("successful backups")
    class Success {

        @BeforeEach
        void setUpCollections() {
            when(entityCollectionRepository.collectionNames()).thenReturn(List.of("patients", "analyses"));
            when(entityCollectionRepository.listEntities("patients"))
                    .thenReturn(List.of(Map.of("id", "p-1", "last_name", "Benali")));
            when(entityCollectionRepository.listEntities("analyses")).thenReturn(List.of());
            when(backupStorage.size(anyString())).thenReturn(2048L);
        }

        @Test
        @DisplayName("should move a manual backup through PENDING and IN_PROGRESS to COMPLETED")
        void shouldCompleteManualBackup() {
            Backup backup = executor.executeBackup(BackupTrigger.manual("pre-upgrade", "admin", false));

            assertThat(backup.getStatus()).isEqualTo(BackupStatus.COMPLETED);
            assertThat(backup.getSizeBytes()).isEqualTo(2048L);
            assertThat(backup.getType()).isEqualTo(BackupType.MANUAL);
            assertThat(backup.getCreatedBy()).isEqualTo("admin");
            assertThat(backup.getDescription()).isEqualTo("pre-upgrade");
            assertThat(backup.getCompletedAt()).isNotNull();
            assertThat(backup.getFilename()).startsWith("backup-").doesNotStartWith("backup-auto-").endsWith(".backup");
            assertThat(savedStatuses).containsExactly(BackupStatus.PENDING, BackupStatus.IN_PROGRESS, BackupStatus.COMPLETED);
        }

        @Test
        @DisplayName("should write a snapshot document containing every collection")
        void shouldWriteSnapshotDocument() {
            Backup backup = executor.executeBackup(BackupTrigger.manual("pre-upgrade", "admin", false));

            ArgumentCaptor<byte[]> content = ArgumentCaptor.forClass(byte[].class);
            verify(backupStorage).write(eq(backup.getFilename()), content.capture());

            SnapshotDocument document = snapshotCodec.decode(content.getValue());
            assertThat(document.getMetadata().getVersion()).isEqualTo("1.0");
            assertThat(document.getMetadata().getType()).isEqualTo(BackupType.MANUAL);
            assertThat(document.getMetadata().getDescription()).isEqualTo("pre-upgrade");
            assertThat(document.getMetadata().getCreatedAt()).isNotNull();
            assertThat(document.getData()).containsOnlyKeys("patients", "analyses");
            assertThat(document.getData().get("patients")).hasSize(1);
        }

        @Test
        @DisplayName("should gzip the artifact when compression is requested")
        void shouldCompress() {
            executor.executeBackup(BackupTrigger.manual(null, null, true));

            ArgumentCaptor<byte[]> content = ArgumentCaptor.forClass(byte[].class);
            verify(backupStorage).write(anyString(), content.capture());
            assertThat(snapshotCodec.isCompressed(content.getValue())).isTrue();
        }

        @Test
        @DisplayName("should not publish a completion event for manual backups")
        void shouldNotPublishForManual() {
            executor.executeBackup(BackupTrigger.manual("pre-upgrade", "admin", false));

            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("should publish a completion event for automatic backups")
        void shouldPublishForAutomatic() {
            Backup backup = executor.executeBackup(BackupTrigger.automatic(BackupFrequency.DAILY, true));

            ArgumentCaptor<BackupCompletedEvent> event = ArgumentCaptor.forClass(BackupCompletedEvent.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().getBackupId()).isEqualTo(backup.getId());
            assertThat(event.getValue().getBackupType()).isEqualTo(BackupType.AUTOMATIC);
            assertThat(backup.getFilename()).startsWith("backup-auto-");
            assertThat(backup.getCreatedBy()).isEqualTo(Backup.CREATED_BY_SYSTEM_AUTO);
        }

        @Test
        @DisplayName("should keep the backup completed when post-backup processing fails")
        void shouldSurviveListenerFailure() {
            doThrow(new IllegalStateException("sweep failed")).when(eventPublisher).publishEvent(any(ApplicationEvent.class));

            Backup backup = executor.executeBackup(BackupTrigger.automatic(BackupFrequency.DAILY, true));

            assertThat(backup.getStatus()).isEqualTo(BackupStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("failing backups")
    @MockitoSettings(strictness = Strictness.LENIENT)
    class Failure {

        @Test
        @DisplayName("should mark the backup FAILED when the repository fails")
        void shouldFailOnRepositoryError() {
            when(entityCollectionRepository.collectionNames()).thenReturn(List.of("patients"));
            when(entityCollectionRepository.listEntities("patients"))
                    .thenThrow(new DataAccessResourceFailureException("connection refused"));

            Backup backup = executor.executeBackup(BackupTrigger.manual("pre-upgrade", "admin", false));

            assertThat(backup.getStatus()).isEqualTo(BackupStatus.FAILED);
            assertThat(backup.getSizeBytes()).isZero();
            assertThat(backup.getErrorMessage()).contains("connection refused");
            verify(backupStorage, never()).write(anyString(), any());
            assertThat(savedStatuses).last().isEqualTo(BackupStatus.FAILED);
        }

        @Test
        @DisplayName("should mark the backup FAILED when the write fails")
        void shouldFailOnStorageError() {
            when(entityCollectionRepository.collectionNames()).thenReturn(List.of());
            doThrow(new StorageException("disk full")).when(backupStorage).write(anyString(), any());

            Backup backup = executor.executeBackup(BackupTrigger.automatic(BackupFrequency.WEEKLY, false));

            assertThat(backup.getStatus()).isEqualTo(BackupStatus.FAILED);
            assertThat(backup.getSizeBytes()).isZero();
            assertThat(backup.getErrorMessage()).isEqualTo("disk full");
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("should fail and discard the artifact when the snapshot exceeds the timeout")
        void shouldFailOnTimeout() {
            ReflectionTestUtils.setField(executor, "executionTimeout", Duration.ofMillis(200));
            when(entityCollectionRepository.collectionNames()).thenReturn(List.of("patients"));
            when(entityCollectionRepository.listEntities("patients")).thenAnswer(inv -> {
                Thread.sleep(5_000);
                return List.of();
            });

            Backup backup = executor.executeBackup(BackupTrigger.manual("slow", "admin", false));

            assertThat(backup.getStatus()).isEqualTo(BackupStatus.FAILED);
            assertThat(backup.getErrorMessage()).contains("timed out");
            verify(backupStorage).delete(backup.getFilename());
        }

        @Test
        @DisplayName("should discard the artifact only after a timed out write has finished")
        void shouldDiscardAfterLateWrite() {
            ReflectionTestUtils.setField(executor, "executionTimeout", Duration.ofMillis(200));
            when(entityCollectionRepository.collectionNames()).thenReturn(List.of());
            doAnswer(inv -> {
                long end = System.currentTimeMillis() + 600;
                while (System.currentTimeMillis() < end) {
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException ignored) {
                        // a storage write that does not react to interruption
                    }
                }
                return null;
            }).when(backupStorage).write(anyString(), any());

            Backup backup = executor.executeBackup(BackupTrigger.manual("slow write", "admin", false));

            assertThat(backup.getStatus()).isEqualTo(BackupStatus.FAILED);
            InOrder inOrder = inOrder(backupStorage);
            inOrder.verify(backupStorage).write(eq(backup.getFilename()), any());
            inOrder.verify(backupStorage).delete(backup.getFilename());
        }

        @Test
        @DisplayName("should remove its own artifact when interrupted during the write")
        void shouldRemoveArtifactWhenInterrupted() {
            when(entityCollectionRepository.collectionNames()).thenReturn(List.of());
            doAnswer(inv -> {
                Thread.currentThread().interrupt();
                return null;
            }).when(backupStorage).write(anyString(), any());

            Backup backup = executor.executeBackup(BackupTrigger.manual("cancelled", "admin", false));

            assertThat(backup.getStatus()).isEqualTo(BackupStatus.FAILED);
            assertThat(backup.getErrorMessage()).isEqualTo("Backup cancelled");
            verify(backupStorage, atLeastOnce()).delete(backup.getFilename());
            verify(backupStorage, never()).size(anyString());
        }

        @Test
        @DisplayName("should record FAILED when the COMPLETED state cannot be saved")
        void shouldFailWhenCompletedSaveFails() {
            when(entityCollectionRepository.collectionNames()).thenReturn(List.of());
            when(backupStorage.size(anyString())).thenReturn(512L);
            doAnswer(inv -> {
                Backup saved = inv.getArgument(0);
                if (saved.getStatus() == BackupStatus.COMPLETED) {
                    throw new DataAccessResourceFailureException("lost connection");
                }
                if (saved.getId() == null) {
                    saved.setId(UUID.randomUUID());
                }
                savedStatuses.add(saved.getStatus());
                return saved;
            }).when(backupRepository).save(any(Backup.class));

            Backup backup = executor.executeBackup(BackupTrigger.manual("pre-upgrade", "admin", false));

            assertThat(backup.getStatus()).isEqualTo(BackupStatus.FAILED);
            assertThat(backup.getSizeBytes()).isZero();
            assertThat(backup.getCompletedAt()).isNull();
            assertThat(backup.getErrorMessage()).contains("lost connection");
            assertThat(savedStatuses).last().isEqualTo(BackupStatus.FAILED);
            verify(backupStorage).delete(backup.getFilename());
        }
    }
}
