package com.linkfolio.auth.domain.exception;

/**
 * A flow could not complete because a collaborator failed.
 * Mapped to 500 Internal Server Error with a fixed message by GlobalExceptionHandler.
 */
public class InternalAuthException extends RuntimeException {

    public InternalAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
