package com.linkfolio.auth.domain.exception;

/**
 * Signer misconfiguration. Not a user error.
 */
public class TokenSigningException extends RuntimeException {

    public TokenSigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
