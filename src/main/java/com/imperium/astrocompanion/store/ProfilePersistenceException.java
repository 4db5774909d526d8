package com.imperium.astrocompanion.store;

/**
 * Profile Store 读写失败。
 */
public class ProfilePersistenceException extends RuntimeException {

    public ProfilePersistenceException(String message) {
        super(message);
    }

    public ProfilePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
