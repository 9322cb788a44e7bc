package com.linkfolio.auth.domain.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CryptoUtils Tests")
class CryptoUtilsTest {

    private final CryptoUtils cryptoUtils = new CryptoUtils(new SecureRandom());

    @Test
    @DisplayName("Generated tokens have the documented length and alphabet")
    void tokenShapes() {
        assertThat(cryptoUtils.generateVerificationToken()).hasSize(32).matches("[A-Za-z0-9_-]+");
        assertThat(cryptoUtils.generateResetToken()).hasSize(64).matches("[A-Za-z0-9_-]+");
        assertThat(cryptoUtils.generateSessionId()).hasSize(64).matches("[0-9a-f]+");
        assertThat(cryptoUtils.generateResetToken()).isNotEqualTo(cryptoUtils.generateResetToken());
    }

    @Test
    @DisplayName("slowEquals() compares content and treats null as unequal")
    void slowEquals() {
        assertThat(cryptoUtils.slowEquals("abc", "abc")).isTrue();
        assertThat(cryptoUtils.slowEquals("abc", "abd")).isFalse();
        assertThat(cryptoUtils.slowEquals("abc", "abcd")).isFalse();
        assertThat(cryptoUtils.slowEquals(null, "abc")).isFalse();
        assertThat(cryptoUtils.slowEquals("abc", null)).isFalse();
    }

    @Test
    @DisplayName("maskEmail() keeps the domain and hides most of the local part")
    void maskEmail() {
        assertThat(CryptoUtils.maskEmail("ada.lovelace@example.com")).isEqualTo("ad***@example.com");
        assertThat(CryptoUtils.maskEmail("a@example.com")).isEqualTo("a***@example.com");
        assertThat(CryptoUtils.maskEmail("broken")).isEqualTo("***");
    }
}
