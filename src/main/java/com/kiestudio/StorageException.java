package com.kiestudio;

/**
 * Ledger read or write failure. Never swallowed: callers report it to the user.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
