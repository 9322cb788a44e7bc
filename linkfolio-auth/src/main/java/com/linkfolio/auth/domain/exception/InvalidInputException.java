package com.linkfolio.auth.domain.exception;

/**
 * Thrown when request input is malformed or violates a policy. The message is safe to show.
 * Mapped to 400 Bad Request by GlobalExceptionHandler.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
