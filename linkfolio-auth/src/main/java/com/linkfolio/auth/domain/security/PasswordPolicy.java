package com.linkfolio.auth.domain.security;

import com.linkfolio.auth.domain.exception.PasswordTooShortException;
import com.linkfolio.auth.domain.exception.PasswordTooWeakException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class PasswordPolicy {

    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");
    private static final Pattern SPECIAL = Pattern.compile("[^a-zA-Z0-9]");

    private static final String WEAK_MESSAGE =
            "Password must contain at least one uppercase letter, one lowercase letter, one digit, and one special character";

    private final int minLength;
    private final boolean requireUppercase;
    private final boolean requireLowercase;
    private final boolean requireDigits;
    private final boolean requireSpecial;

    public PasswordPolicy(
            @Value("${linkfolio.auth.password.min-length:8}") int minLength,
            @Value("${linkfolio.auth.password.require-uppercase:true}") boolean requireUppercase,
            @Value("${linkfolio.auth.password.require-lowercase:true}") boolean requireLowercase,
            @Value("${linkfolio.auth.password.require-digits:true}") boolean requireDigits,
            @Value("${linkfolio.auth.password.require-special:true}") boolean requireSpecial) {
        this.minLength = minLength;
        this.requireUppercase = requireUppercase;
        this.requireLowercase = requireLowercase;
        this.requireDigits = requireDigits;
        this.requireSpecial = requireSpecial;
    }

    public static PasswordPolicy defaults() {
        return new PasswordPolicy(8, true, true, true, true);
    }

    public void validate(String password) {
        if (password == null || password.length() < minLength) {
            throw new PasswordTooShortException(minLength);
        }
        if (requireUppercase && !UPPER.matcher(password).find()
                || requireLowercase && !LOWER.matcher(password).find()
                || requireDigits && !DIGIT.matcher(password).find()
                || requireSpecial && !SPECIAL.matcher(password).find()) {
            throw new PasswordTooWeakException(WEAK_MESSAGE);
        }
    }

    /**
     * Advisory score from 0 to 6. Passwords shorter than 8 characters score 0.
     */
    public int strength(String password) {
        if (password == null || password.length() < 8) {
            return 0;
        }
        int score = 1;
        if (password.length() >= 12) {
            score++;
        }
        if (UPPER.matcher(password).find()) {
            score++;
        }
        if (LOWER.matcher(password).find()) {
            score++;
        }
        if (DIGIT.matcher(password).find()) {
            score++;
        }
        if (SPECIAL.matcher(password).find()) {
            score++;
        }
        return score;
    }
}
