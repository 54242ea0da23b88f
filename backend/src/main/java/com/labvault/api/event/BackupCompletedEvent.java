package com.labvault.api.event;

import com.labvault.api.model.entity.BackupType;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Published synchronously by the executor after a backup reached COMPLETED.
 * Listeners run before {@code executeBackup} returns.
 */
@Getter
public class BackupCompletedEvent extends ApplicationEvent {

    private final UUID backupId;
    private final BackupType backupType;
    private final Instant completedAt;

    public BackupCompletedEvent(Object source, UUID backupId, BackupType backupType, Instant completedAt) {
        super(source);
        this.backupId = backupId;
        this.backupType = backupType;
        this.completedAt = completedAt;
    }
}
