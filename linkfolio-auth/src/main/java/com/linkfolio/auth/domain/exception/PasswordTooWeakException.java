package com.linkfolio.auth.domain.exception;

public class PasswordTooWeakException extends InvalidInputException {

    public PasswordTooWeakException(String message) {
        super(message);
    }
}
