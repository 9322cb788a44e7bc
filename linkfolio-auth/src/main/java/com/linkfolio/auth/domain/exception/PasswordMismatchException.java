package com.linkfolio.auth.domain.exception;

/**
 * Thrown by the password hasher when a password does not match the stored hash.
 * Never surfaced as-is; login maps it to InvalidCredentialsException.
 */
public class PasswordMismatchException extends RuntimeException {

    public PasswordMismatchException() {
        super("Password does not match");
    }
}
