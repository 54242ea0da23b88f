package com.labvault.api.exception;

/**
 * The backup settings record could not be read or created. Scheduling cannot proceed without it.
 */
public class BackupConfigurationException extends RuntimeException {

    public BackupConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
