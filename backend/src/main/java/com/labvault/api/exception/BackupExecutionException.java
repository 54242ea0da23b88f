package com.labvault.api.exception;

public class BackupExecutionException extends RuntimeException {

    public BackupExecutionException(String message) {
        super(message);
    }

    public BackupExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
