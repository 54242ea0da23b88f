package com.labvault.api.service;

import org.springframework.stereotype.Component;

/**
 * Classifies how stale the latest successful backup is. "Never backed up" is passed as
 * {@link #NEVER_BACKED_UP_DAYS}, which lands in the critical band like any other large value.
 */
@Component
public class ReminderCalculator {

    public static final long NEVER_BACKED_UP_DAYS = 999;
    public static final long WARNING_DAYS = 30;
    public static final long CRITICAL_DAYS = 90;

    public ReminderSeverity classify(long daysSinceLastBackup) {
        if (daysSinceLastBackup >= CRITICAL_DAYS) {
            return ReminderSeverity.CRITICAL;
        }
        if (daysSinceLastBackup >= WARNING_DAYS) {
            return ReminderSeverity.WARNING;
        }
        return ReminderSeverity.INFO;
    }

    public boolean shouldRemind(long daysSinceLastBackup) {
        return daysSinceLastBackup >= WARNING_DAYS;
    }

    public String message(long daysSinceLastBackup) {
        if (daysSinceLastBackup >= NEVER_BACKED_UP_DAYS) {
            return "No backup has been created yet. Create a backup to protect your data.";
        }
        return switch (classify(daysSinceLastBackup)) {
            case CRITICAL -> "Your last backup is " + daysSinceLastBackup
                    + " days old. Create a backup immediately.";
            case WARNING -> "Your last backup is " + daysSinceLastBackup
                    + " days old. Consider creating a new backup.";
            case INFO -> "Backups are up to date.";
        };
    }
}
