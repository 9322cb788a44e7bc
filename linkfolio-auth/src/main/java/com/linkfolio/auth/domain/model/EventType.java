package com.linkfolio.auth.domain.model;

/**
 * Notification templates understood by the mailer that consumes the notification topic.
 */
public enum EventType {
    EMAIL_VERIFICATION("email-verification"),
    PASSWORD_RESET("password-reset"),
    PASSWORD_CHANGED("password-changed"),
    ACCOUNT_LOCKED("account-locked");

    private final String value;

    EventType(String value){
        this.value = value;
    }

    @Override
    public String toString(){
        return String.valueOf(value);
    }

    public static EventType fromValue(String val){
        for(EventType st : EventType.values()){
            if (st.toString().equals(val)){
                return st;
            }
        }

        return null;
    }
}
