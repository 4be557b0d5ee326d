package com.insightflo.core.error;

/**
 * Local store read or write failure on a path that must propagate.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
