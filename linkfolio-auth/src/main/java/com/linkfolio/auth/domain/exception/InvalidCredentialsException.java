package com.linkfolio.auth.domain.exception;

import com.linkfolio.auth.domain.constants.AuthConstants;

/**
 * Thrown when credentials or a bearer token are rejected.
 * The message is always the same whichever check failed.
 * Mapped to 401 Unauthorized by GlobalExceptionHandler.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super(AuthConstants.UNIFORM_AUTH_FAILURE_MESSAGE);
    }

    public InvalidCredentialsException(Throwable cause) {
        super(AuthConstants.UNIFORM_AUTH_FAILURE_MESSAGE, cause);
    }
}
