package com.example.filterengine.error;

/**
 * A run insert, usage update or artifact write did not complete.
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
