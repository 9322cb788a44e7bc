package com.linkfolio.auth.domain.exception;

/**
 * Thrown when a stored password hash cannot be checked at all (malformed hash or salt).
 */
public class PasswordVerificationException extends RuntimeException {

    public PasswordVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
