package com.linkfolio.auth.domain.security;

import com.linkfolio.auth.domain.constants.AuthConstants;
import com.linkfolio.auth.domain.exception.PasswordMismatchException;
import com.linkfolio.auth.domain.exception.PasswordVerificationException;
import com.linkfolio.auth.domain.model.HashedPassword;
import com.linkfolio.auth.domain.utils.CryptoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Salted BCrypt password hashing.
 *
 * <p>The password is concatenated with a random 16-byte salt (Base64) and condensed with SHA-256
 * before BCrypt, so long passwords are not cut at BCrypt's 72-byte input limit.
 * Hash and salt are stored separately.
 */
@Component
@Slf4j
public class PasswordHasher {

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("\\A\\$2([ayb])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final BCryptPasswordEncoder passwordEncoder;
    private final CryptoUtils cryptoUtils;

    public PasswordHasher(CryptoUtils cryptoUtils) {
        this.cryptoUtils = cryptoUtils;
        this.passwordEncoder = new BCryptPasswordEncoder(AuthConstants.BCRYPT_COST_FACTOR);
    }

    public HashedPassword hash(String password) {
        String salt = Base64.getEncoder().encodeToString(cryptoUtils.randomBytes(AuthConstants.SALT_BYTE_LENGTH));
        String hash = passwordEncoder.encode(prehash(password, salt));
        log.debug("[PASSWORD_HASHED] Password hashed with BCrypt cost={}", AuthConstants.BCRYPT_COST_FACTOR);
        return new HashedPassword(hash, salt);
    }

    /**
     * @throws PasswordMismatchException     if the password does not match
     * @throws PasswordVerificationException if the stored hash or salt is unusable
     */
    public void verify(String password, String hash, String salt) {
        if (hash == null || salt == null || !BCRYPT_PATTERN.matcher(hash).matches()) {
            throw new PasswordVerificationException("Stored password hash is malformed", null);
        }
        boolean matches;
        try {
            matches = passwordEncoder.matches(prehash(password, salt), hash);
        } catch (IllegalArgumentException e) {
            throw new PasswordVerificationException("Stored password hash is malformed", e);
        }
        if (!matches) {
            throw new PasswordMismatchException();
        }
    }

    private String prehash(String password, String salt) {
        return cryptoUtils.sha256Base64(password + salt);
    }
}
