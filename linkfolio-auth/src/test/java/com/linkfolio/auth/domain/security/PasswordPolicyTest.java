package com.linkfolio.auth.domain.security;

import com.linkfolio.auth.domain.exception.InvalidInputException;
import com.linkfolio.auth.domain.exception.PasswordTooShortException;
import com.linkfolio.auth.domain.exception.PasswordTooWeakException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("PasswordPolicy Tests")
class PasswordPolicyTest {

    private final PasswordPolicy policy = PasswordPolicy.defaults();

    @Test
    @DisplayName("A password with every character class passes")
    void strongPasswordPasses() {
        assertDoesNotThrow(() -> policy.validate("Abcdef1!"));
    }

    @Test
    @DisplayName("Short passwords are rejected before character classes are checked")
    void shortPasswordRejected() {
        PasswordTooShortException ex = assertThrows(PasswordTooShortException.class, () -> policy.validate("Ab1!"));

        assertThat(ex).isInstanceOf(InvalidInputException.class);
        assertThat(ex.getMessage()).contains("8");
        assertThrows(PasswordTooShortException.class, () -> policy.validate(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abcdefg1!", "ABCDEFG1!", "Abcdefgh!", "Abcdefgh1"})
    @DisplayName("A missing character class makes the password too weak")
    void missingClassRejected(String password) {
        assertThrows(PasswordTooWeakException.class, () -> policy.validate(password));
    }

    @Test
    @DisplayName("Disabled requirements are not enforced")
    void relaxedPolicy() {
        PasswordPolicy relaxed = new PasswordPolicy(10, false, true, false, false);

        assertDoesNotThrow(() -> relaxed.validate("lowercaseonly"));
        assertThrows(PasswordTooShortException.class, () -> relaxed.validate("lowercase"));
    }

    @Test
    @DisplayName("strength() scores length and character classes")
    void strength() {
        assertThat(policy.strength("Ab1!")).isZero();
        assertThat(policy.strength("abcdefgh")).isEqualTo(2);
        assertThat(policy.strength("Abcdef1!")).isEqualTo(5);
        assertThat(policy.strength("Abcdefgh123!")).isEqualTo(6);
    }
}
