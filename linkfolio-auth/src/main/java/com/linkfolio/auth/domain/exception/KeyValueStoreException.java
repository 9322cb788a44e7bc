package com.linkfolio.auth.domain.exception;

/**
 * Failure talking to the key-value store. A missing key is not an error.
 */
public class KeyValueStoreException extends RuntimeException {

    public KeyValueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
