package com.labvault.api.event;

import com.labvault.api.model.entity.BackupSettings;
import com.labvault.api.model.entity.BackupType;
import com.labvault.api.service.BackupSettingsService;
import com.labvault.api.service.RetentionSweepResult;
import com.labvault.api.service.RetentionSweeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.*;

@DisplayName("AutomaticBackupListener")
@ExtendWith(MockitoExtension.class)
class AutomaticBackupListenerTest {

    @Mock private BackupSettingsService settingsService;
    @Mock private RetentionSweeper retentionSweeper;

    @InjectMocks
    private AutomaticBackupListener listener;

    @Test
    @DisplayName("should record the backup and sweep with the configured retention")
    void shouldRecordAndSweep() {
        Instant completedAt = Instant.now();
        BackupSettings settings = BackupSettings.defaults();
        settings.setRetentionDays(14);
        when(settingsService.recordAutomaticBackup(completedAt)).thenReturn(settings);
        when(retentionSweeper.sweep(14)).thenReturn(new RetentionSweepResult(completedAt, 0, 0, List.of()));

        listener.handleBackupCompleted(new BackupCompletedEvent(this, UUID.randomUUID(), BackupType.AUTOMATIC, completedAt));

        var order = inOrder(settingsService, retentionSweeper);
        order.verify(settingsService).recordAutomaticBackup(completedAt);
        order.verify(retentionSweeper).sweep(14);
    }

    @Test
    @DisplayName("should ignore manual backups")
    void shouldIgnoreManualBackups() {
        listener.handleBackupCompleted(new BackupCompletedEvent(this, UUID.randomUUID(), BackupType.MANUAL, Instant.now()));

        verifyNoInteractions(settingsService, retentionSweeper);
    }
}
