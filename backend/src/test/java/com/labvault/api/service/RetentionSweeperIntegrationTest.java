package com.labvault.api.service;

import com.labvault.api.model.entity.Backup;
import com.labvault.api.model.entity.BackupStatus;
import com.labvault.api.model.entity.BackupType;
import com.labvault.api.repository.BackupRepository;
import com.labvault.api.storage.BackupStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("RetentionSweeper against the database")
class RetentionSweeperIntegrationTest {

    @Autowired private RetentionSweeper retentionSweeper;
    @Autowired private BackupRepository backupRepository;
    @Autowired private BackupStorage backupStorage;
    @Autowired private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        backupRepository.deleteAll();
    }

    private Backup storedBackup(String filename, BackupType type, Duration age) {
        backupStorage.write(filename, "{}".getBytes());
        Backup backup = backupRepository.save(Backup.builder()
                .filename(filename)
                .status(BackupStatus.COMPLETED)
                .sizeBytes(2)
                .createdBy(type == BackupType.AUTOMATIC ? Backup.CREATED_BY_SYSTEM_AUTO : "admin-1")
                .type(type)
                .completedAt(Instant.now())
                .build());
        // created_at is set on insert and not updatable through the entity
        jdbcTemplate.update("UPDATE backups SET created_at = ? WHERE id = ?",
                Timestamp.from(Instant.now().minus(age)), backup.getId());
        return backup;
    }

    @Test
    @DisplayName("should remove only automatic backups older than the retention window")
    void shouldRemoveExpiredAutomaticBackups() {
        Backup expiredAuto = storedBackup("backup-auto-expired.backup", BackupType.AUTOMATIC, Duration.ofDays(31));
        Backup recentAuto = storedBackup("backup-auto-recent.backup", BackupType.AUTOMATIC, Duration.ofDays(2));
        Backup oldManual = storedBackup("backup-manual-old.backup", BackupType.MANUAL, Duration.ofDays(400));

        RetentionSweepResult result = retentionSweeper.sweep(30);

        assertThat(result.getDeleted()).isEqualTo(1);
        assertThat(result.hasFailures()).isFalse();
        assertThat(backupRepository.findById(expiredAuto.getId())).isEmpty();
        assertThat(backupStorage.exists("backup-auto-expired.backup")).isFalse();
        assertThat(backupRepository.findById(recentAuto.getId())).isPresent();
        assertThat(backupRepository.findById(oldManual.getId())).isPresent();
        assertThat(backupStorage.exists("backup-manual-old.backup")).isTrue();
    }

    @Test
    @DisplayName("should remove the record even when its file is already gone")
    void shouldRemoveRecordWithoutFile() {
        Backup expired = storedBackup("backup-auto-orphan.backup", BackupType.AUTOMATIC, Duration.ofDays(40));
        backupStorage.delete("backup-auto-orphan.backup");

        RetentionSweepResult result = retentionSweeper.sweep(30);

        assertThat(result.getDeleted()).isEqualTo(1);
        assertThat(backupRepository.findById(expired.getId())).isEmpty();
    }
}
