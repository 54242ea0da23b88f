package com.labvault.api.service;

import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupStatus;
import com.labvault.api.model.entity.BackupType;
import com.labvault.api.repository.BackupRepository;
import com.labvault.api.storage.BackupStorage;
import com.labvault.api.storage.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("RetentionSweeper")
@ExtendWith(MockitoExtension.class)
class RetentionSweeperTest {

    @Mock private BackupRepository backupRepository;
    @Mock private BackupStorage backupStorage;

    @InjectMocks
    private RetentionSweeper retentionSweeper;

    @Test
    @DisplayName("should only select automatic backups older than the retention window")
    void shouldQueryAutomaticBackupsBeforeCutoff() {
        when(backupRepository.findRetentionCandidates(any(), any())).thenReturn(List.of());

        RetentionSweepResult result = retentionSweeper.sweep(30);

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(backupRepository).findRetentionCandidates(eq(BackupType.AUTOMATIC), cutoff.capture());
        Instant expected = Instant.now().minus(Duration.ofDays(30));
        assertThat(cutoff.getValue()).isCloseTo(expected, within(5, ChronoUnit.SECONDS));
        assertThat(result.getDeleted()).isZero();
    }

    @Test
    @DisplayName("should delete the artifact before the record")
    void shouldDeleteArtifactThenRecord() {
        Backup expired = automaticBackup("backup-auto-old.backup", BackupStatus.COMPLETED);
        when(backupRepository.findRetentionCandidates(any(), any())).thenReturn(List.of(expired));
        when(backupStorage.delete("backup-auto-old.backup")).thenReturn(true);

        RetentionSweepResult result = retentionSweeper.sweep(30);

        var order = inOrder(backupStorage, backupRepository);
        order.verify(backupStorage).delete("backup-auto-old.backup");
        order.verify(backupRepository).delete(expired);
        assertThat(result.getDeleted()).isEqualTo(1);
        assertThat(result.hasFailures()).isFalse();
    }

    @Test
    @DisplayName("should delete the record when the artifact is already gone")
    void shouldDeleteRecordWhenArtifactMissing() {
        Backup expired = automaticBackup("backup-auto-gone.backup", BackupStatus.FAILED);
        when(backupRepository.findRetentionCandidates(any(), any())).thenReturn(List.of(expired));
        when(backupStorage.delete("backup-auto-gone.backup")).thenReturn(false);

        RetentionSweepResult result = retentionSweeper.sweep(30);

        verify(backupRepository).delete(expired);
        assertThat(result.getDeleted()).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep the record of an undeletable artifact and continue with the rest")
    void shouldIsolateArtifactFailures() {
        Backup stuck = automaticBackup("backup-auto-stuck.backup", BackupStatus.COMPLETED);
        Backup next = automaticBackup("backup-auto-next.backup", BackupStatus.COMPLETED);
        when(backupRepository.findRetentionCandidates(any(), any())).thenReturn(List.of(stuck, next));
        when(backupStorage.delete("backup-auto-stuck.backup")).thenThrow(new StorageException("permission denied"));
        when(backupStorage.delete("backup-auto-next.backup")).thenReturn(true);

        RetentionSweepResult result = retentionSweeper.sweep(30);

        verify(backupRepository, never()).delete(stuck);
        verify(backupRepository).delete(next);
        assertThat(result.getCandidates()).isEqualTo(2);
        assertThat(result.getDeleted()).isEqualTo(1);
        assertThat(result.getFailed()).containsExactly("backup-auto-stuck.backup");
    }

    @Test
    @DisplayName("should leave backups that are still running alone")
    void shouldSkipRunningBackups() {
        Backup running = automaticBackup("backup-auto-running.backup", BackupStatus.IN_PROGRESS);
        when(backupRepository.findRetentionCandidates(any(), any())).thenReturn(List.of(running));

        RetentionSweepResult result = retentionSweeper.sweep(30);

        verifyNoInteractions(backupStorage);
        verify(backupRepository, never()).delete(any(Backup.class));
        assertThat(result.getDeleted()).isZero();
    }

    @Test
    @DisplayName("should skip the sweep for a retention below one day")
    void shouldSkipInvalidRetention() {
        RetentionSweepResult result = retentionSweeper.sweep(0);

        verifyNoInteractions(backupRepository, backupStorage);
        assertThat(result.getCandidates()).isZero();
    }

    private Backup automaticBackup(String filename, BackupStatus status) {
        return Backup.builder()
                .id(UUID.randomUUID())
                .filename(filename)
                .status(status)
                .type(BackupType.AUTOMATIC)
                .createdBy(Backup.CREATED_BY_SYSTEM_AUTO)
                .createdAt(Instant.now().minus(Duration.ofDays(31)))
                .build();
    }
}
