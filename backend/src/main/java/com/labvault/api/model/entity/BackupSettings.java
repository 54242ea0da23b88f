package com.labvault.api.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Singleton row holding the backup configuration. Created lazily with defaults on first access.
 */
@Entity
@Table(name = "backup_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackupSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "auto_backup_enabled", nullable = false)
    @Builder.Default
    private boolean autoBackupEnabled = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "backup_frequency", nullable = false, length = 20)
    @Builder.Default
    private BackupFrequency backupFrequency = BackupFrequency.WEEKLY;

    @Column(name = "retention_days", nullable = false)
    @Builder.Default
    private int retentionDays = DEFAULT_RETENTION_DAYS;

    @Column(name = "include_files", nullable = false)
    @Builder.Default
    private boolean includeFiles = true;

    @Column(name = "compression_enabled", nullable = false)
    @Builder.Default
    private boolean compressionEnabled = true;

    @Column(name = "encryption_enabled", nullable = false)
    @Builder.Default
    private boolean encryptionEnabled = false;

    @Column(name = "last_backup_date")
    private Instant lastBackupDate;

    @Column(name = "next_scheduled_backup")
    private Instant nextScheduledBackup;

    @Column(name = "cron_job_id", length = 100)
    private String cronJobId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final int MIN_RETENTION_DAYS = 1;
    public static final int MAX_RETENTION_DAYS = 365;

    public static BackupSettings defaults() {
        return BackupSettings.builder().build();
    }
}
