package com.labvault.api.config;

import com.labvault.api.storage.BackupStorage;
import com.labvault.api.storage.LocalBackupStorage;
import com.labvault.api.storage.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.util.unit.DataSize;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("StartupValidator")
class StartupValidatorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should pass and create the backup directory with valid configuration")
    void shouldPassWithValidConfig() {
        Path backups = tempDir.resolve("backups");
        StartupValidator validator = createValidator(new LocalBackupStorage(backups.toString()));

        assertThatNoException().isThrownBy(validator::validate);
        assertThat(Files.isDirectory(backups)).isTrue();
    }

    @Nested
    @DisplayName("validateLimits")
    class ValidateLimits {

        @Test
        @DisplayName("should throw when the execution timeout is not positive")
        void shouldRejectZeroTimeout() {
            StartupValidator validator = createValidator(new LocalBackupStorage(tempDir.toString()));
            ReflectionTestUtils.setField(validator, "executionTimeout", Duration.ZERO);

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("backup.execution-timeout");
        }

        @Test
        @DisplayName("should throw when the upload limit is not positive")
        void shouldRejectZeroUploadLimit() {
            StartupValidator validator = createValidator(new LocalBackupStorage(tempDir.toString()));
            ReflectionTestUtils.setField(validator, "maxUploadSize", DataSize.ofBytes(0));

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("backup.upload.max-size");
        }

        @Test
        @DisplayName("should throw when the default retention is out of range")
        void shouldRejectRetentionOutOfRange() {
            StartupValidator validator = createValidator(new LocalBackupStorage(tempDir.toString()));
            ReflectionTestUtils.setField(validator, "defaultRetentionDays", 400);

            assertThatThrownBy(validator::validate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Default retention");
        }
    }

    @Test
    @DisplayName("should throw when the schedule zone is unknown")
    void shouldRejectUnknownZone() {
        StartupValidator validator = createValidator(new LocalBackupStorage(tempDir.toString()));
        ReflectionTestUtils.setField(validator, "scheduleZone", "Mars/Olympus");

        assertThatThrownBy(validator::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("backup.schedule.zone");
    }

    @Test
    @DisplayName("should throw when storage cannot be prepared")
    void shouldRejectUnusableStorage() {
        BackupStorage storage = mock(BackupStorage.class);
        doThrow(new StorageException("read-only filesystem")).when(storage).ensureDirectory();
        when(storage.describe()).thenReturn("local:/readonly");

        StartupValidator validator = createValidator(storage);

        assertThatThrownBy(validator::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Backup storage is not usable");
    }

    private StartupValidator createValidator(BackupStorage storage) {
        StartupValidator validator = new StartupValidator(storage);
        ReflectionTestUtils.setField(validator, "executionTimeout", Duration.ofMinutes(30));
        ReflectionTestUtils.setField(validator, "maxUploadSize", DataSize.ofMegabytes(500));
        ReflectionTestUtils.setField(validator, "scheduleZone", "UTC");
        ReflectionTestUtils.setField(validator, "defaultRetentionDays", 30);
        return validator;
    }
}
