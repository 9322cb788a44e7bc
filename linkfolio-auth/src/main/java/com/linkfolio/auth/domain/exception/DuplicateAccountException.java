package com.linkfolio.auth.domain.exception;

/**
 * Thrown when attempting to register with an email or username that already exists.
 * Mapped to 409 Conflict by GlobalExceptionHandler.
 */
public class DuplicateAccountException extends RuntimeException {
    
    public DuplicateAccountException(String message) {
        super(message);
    }
}
