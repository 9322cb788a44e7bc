package com.linkfolio.auth.domain.exception;

/**
 * Thrown when a login is attempted while the account is locked.
 * Mapped to 403 Forbidden with a Retry-After header by GlobalExceptionHandler.
 */
public class AccountLockedException extends RuntimeException {
    
    private final long retryAfterSeconds;
    
    public AccountLockedException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }
    
    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
