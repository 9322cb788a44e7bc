package com.linkfolio.auth.domain.exception;

/**
 * Generic failure of the credential or principal store.
 */
public class CredentialStoreException extends RuntimeException {

    public CredentialStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
