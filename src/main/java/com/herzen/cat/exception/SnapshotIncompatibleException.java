package com.herzen.cat.exception;

public class SnapshotIncompatibleException extends RuntimeException {

    public SnapshotIncompatibleException(String message) {
        super(message);
    }

    public SnapshotIncompatibleException(String message, Throwable cause) {
        super(message, cause);
    }
}
