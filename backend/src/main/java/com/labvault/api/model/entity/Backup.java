package com.labvault.api.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One backup attempt. Status only moves forward (see {@link BackupStatus#canTransitionTo}),
 * and {@code sizeBytes} is authoritative only once the backup is completed.
 */
@Entity
@Table(name = "backups")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Backup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String filename;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private BackupStatus status = BackupStatus.PENDING;

    @Column(name = "size_bytes", nullable = false)
    @Builder.Default
    private long sizeBytes = 0L;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BackupType type;

    @Column(length = 500)
    private String description;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "completed_at")
    private Instant completedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static final String CREATED_BY_SYSTEM_AUTO = "system-auto";
    public static final String CREATED_BY_SYSTEM = "system";

    /**
     * Move to the given status, refusing regressions and moves out of a terminal state.
     */
    public void transitionTo(BackupStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Backup " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
