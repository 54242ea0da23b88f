package com.labvault.api.model.entity;

public enum BackupType {
    MANUAL,
    AUTOMATIC
}
