package com.labvault.api.model.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BackupStatus")
class BackupStatusTest {

    @Test
    @DisplayName("should allow only forward transitions")
    void shouldAllowForwardTransitions() {
        assertThat(BackupStatus.PENDING.canTransitionTo(BackupStatus.IN_PROGRESS)).isTrue();
        assertThat(BackupStatus.PENDING.canTransitionTo(BackupStatus.FAILED)).isTrue();
        assertThat(BackupStatus.IN_PROGRESS.canTransitionTo(BackupStatus.COMPLETED)).isTrue();
        assertThat(BackupStatus.IN_PROGRESS.canTransitionTo(BackupStatus.FAILED)).isTrue();

        assertThat(BackupStatus.PENDING.canTransitionTo(BackupStatus.COMPLETED)).isFalse();
        assertThat(BackupStatus.IN_PROGRESS.canTransitionTo(BackupStatus.PENDING)).isFalse();
    }

    @Test
    @DisplayName("should never leave a terminal state")
    void shouldNotLeaveTerminalState() {
        for (BackupStatus next : BackupStatus.values()) {
            assertThat(BackupStatus.COMPLETED.canTransitionTo(next)).isFalse();
            assertThat(BackupStatus.FAILED.canTransitionTo(next)).isFalse();
        }
        assertThat(BackupStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(BackupStatus.FAILED.isTerminal()).isTrue();
        assertThat(BackupStatus.IN_PROGRESS.isTerminal()).isFalse();
    }
}
