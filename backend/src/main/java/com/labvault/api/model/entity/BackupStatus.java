package com.labvault.api.model.entity;

public enum BackupStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * PENDING -> IN_PROGRESS -> {COMPLETED, FAILED}. A PENDING backup may fail directly
     * when it never got started.
     */
    public boolean canTransitionTo(BackupStatus next) {
        return switch (this) {
            case PENDING -> next == IN_PROGRESS || next == FAILED;
            case IN_PROGRESS -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
