package com.linkfolio.auth.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lockout state of a credential record as computed by the account guard.
 */
public enum AccountStatus {
    OPEN("OPEN"),
    LOCKED("LOCKED");

    private final String value;
    AccountStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String toString(){
        return String.valueOf(value);
    }
}
