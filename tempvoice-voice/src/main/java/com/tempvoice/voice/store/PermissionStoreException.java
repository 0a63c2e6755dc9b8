package com.tempvoice.voice.store;

/**
 * Unchecked wrapper for persistence failures.
 */
public class PermissionStoreException extends RuntimeException {

    public PermissionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
