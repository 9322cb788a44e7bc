package com.linkfolio.auth.domain.exception;

public class PasswordTooShortException extends InvalidInputException {

    public PasswordTooShortException(int minLength) {
        super("Password must be at least " + minLength + " characters long");
    }
}
