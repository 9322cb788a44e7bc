package com.linkfolio.auth.domain.exception;

/**
 * Thrown when a session is absent or has expired.
 * Mapped to 404 Not Found by GlobalExceptionHandler.
 */
public class SessionNotFoundException extends RuntimeException {
    
    public SessionNotFoundException(String message) {
        super(message);
    }
}
