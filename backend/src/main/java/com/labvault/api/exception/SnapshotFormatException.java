package com.labvault.api.exception;

/**
 * The bytes given as a snapshot are not a well-formed snapshot document.
 */
public class SnapshotFormatException extends RuntimeException {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
