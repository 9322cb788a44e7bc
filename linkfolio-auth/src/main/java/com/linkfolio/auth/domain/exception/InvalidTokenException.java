package com.linkfolio.auth.domain.exception;

/**
 * Thrown when a token is malformed, expired, not yet valid, tampered with,
 * signed with an unexpected algorithm, or of the wrong kind.
 * Mapped to 401 Unauthorized by GlobalExceptionHandler.
 */
public class InvalidTokenException extends InvalidCredentialsException {

    private final String reason;

    public InvalidTokenException(String reason) {
        super();
        this.reason = reason;
    }

    public InvalidTokenException(String reason, Throwable cause) {
        super(cause);
        this.reason = reason;
    }

    /**
     * Internal reason, for logs only.
     */
    public String getReason() {
        return reason;
    }
}
