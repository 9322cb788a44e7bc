package com.linkfolio.auth.domain.utils;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

import static com.linkfolio.auth.domain.constants.AuthConstants.HASH_ALGORITHM;
import static com.linkfolio.auth.domain.constants.AuthConstants.RESET_TOKEN_LENGTH;
import static com.linkfolio.auth.domain.constants.AuthConstants.SESSION_ID_BYTE_LENGTH;
import static com.linkfolio.auth.domain.constants.AuthConstants.VERIFICATION_TOKEN_LENGTH;

@Component
public class CryptoUtils {

    public static final String URL_SAFE_CHARSET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";

    private final SecureRandom secureRandom;

    public CryptoUtils(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }

    /**
     * Uniformly random string over the given charset.
     */
    public String randomString(int length, String charset) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(charset.charAt(secureRandom.nextInt(charset.length())));
        }
        return sb.toString();
    }

    public String generateVerificationToken() {
        return randomString(VERIFICATION_TOKEN_LENGTH, URL_SAFE_CHARSET);
    }

    public String generateResetToken() {
        return randomString(RESET_TOKEN_LENGTH, URL_SAFE_CHARSET);
    }

    /**
     * 32 random bytes, hex encoded (64 chars)
     */
    public String generateSessionId() {
        return HexFormat.of().formatHex(randomBytes(SESSION_ID_BYTE_LENGTH));
    }

    /**
     * Constant-time comparison to prevent timing attacks
     */
    public boolean slowEquals(String provided, String stored) {
        if (provided == null || stored == null) {
            return false;
        }
        return MessageDigest.isEqual(
            provided.getBytes(StandardCharsets.UTF_8),
            stored.getBytes(StandardCharsets.UTF_8)
        );
    }

    public String sha256Base64(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Masks the local part of an email for log lines: {@code jo***@example.com}
     */
    public static String maskEmail(String email) {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        String local = email.substring(0, at);
        String visible = local.length() <= 2 ? local.substring(0, 1) : local.substring(0, 2);
        return visible + "***" + email.substring(at);
    }
}
