package com.labvault.api.service;

public enum ReminderSeverity {
    INFO,
    WARNING,
    CRITICAL
}
