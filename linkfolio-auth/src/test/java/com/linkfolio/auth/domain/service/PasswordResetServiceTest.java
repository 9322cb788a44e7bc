package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.exception.InvalidCredentialsException;
import com.linkfolio.auth.domain.exception.InvalidInputException;
import com.linkfolio.auth.domain.exception.PasswordTooWeakException;
import com.linkfolio.auth.domain.model.ClientInfo;
import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import com.linkfolio.auth.support.AuthTestContext;
import com.linkfolio.auth.support.RecordingNotificationSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.linkfolio.auth.support.AuthTestContext.PASSWORD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("PasswordResetService Tests")
class PasswordResetServiceTest {

    private static final String NEW_PASSWORD = "N3w!Password";

    private AuthTestContext ctx;
    private UserEntity user;

    @BeforeEach
    void setUp() {
        ctx = new AuthTestContext();
        user = ctx.givenUser("ada", "ada@example.com");
    }

    @Test
    @DisplayName("Requesting a reset for an unknown email does nothing and reports nothing")
    void unknownEmailIgnored() {
        assertDoesNotThrow(() -> ctx.passwordResetService.generateResetToken("nobody@example.com"));

        assertThat(ctx.notifications.getSent()).isEmpty();
        assertThat(ctx.credentialStore.stored(user.getId()).getResetToken()).isNull();
    }

    @Test
    @DisplayName("A reset token is stored for one hour and mailed to the user")
    void tokenIssued() {
        // When
        ctx.passwordResetService.generateResetToken("ada@example.com");

        // Then
        CredentialEntity stored = ctx.credentialStore.stored(user.getId());
        assertThat(stored.getResetToken()).hasSize(64);
        assertThat(stored.getResetTokenExpiresAt()).isEqualTo(ctx.clock.instant().plus(Duration.ofHours(1)));

        RecordingNotificationSender.Sent mail = ctx.notifications.withTemplate("password-reset").get(0);
        assertThat(mail.recipients).containsExactly("ada@example.com");
        assertThat(mail.data).containsEntry("resetToken", stored.getResetToken());
    }

    @Test
    @DisplayName("resetPassword() replaces the password and consumes the token")
    void resetReplacesPassword() {
        // Given
        ctx.passwordResetService.generateResetToken("ada@example.com");
        String token = ctx.credentialStore.stored(user.getId()).getResetToken();

        // When
        ctx.passwordResetService.resetPassword(token, "ada@example.com", NEW_PASSWORD, NEW_PASSWORD);

        // Then
        assertThat(ctx.credentialStore.stored(user.getId()).getResetToken()).isNull();
        assertThat(ctx.notifications.withTemplate("password-changed")).hasSize(1);
        assertThrows(InvalidCredentialsException.class,
                () -> ctx.loginService.login("ada@example.com", PASSWORD, ClientInfo.unknown()));
        assertThat(ctx.loginService.login("ada@example.com", NEW_PASSWORD, ClientInfo.unknown()).getTokens())
                .isNotNull();
        assertThrows(InvalidCredentialsException.class,
                () -> ctx.passwordResetService.resetPassword(token, "ada@example.com", "An0ther!Pass", "An0ther!Pass"));
    }

    @Test
    @DisplayName("A token is refused once its hour is over")
    void expiredTokenRefused() {
        ctx.passwordResetService.generateResetToken("ada@example.com");
        String token = ctx.credentialStore.stored(user.getId()).getResetToken();

        ctx.clock.advance(Duration.ofHours(1));

        assertThrows(InvalidCredentialsException.class,
                () -> ctx.passwordResetService.resetPassword(token, "ada@example.com", NEW_PASSWORD, NEW_PASSWORD));
    }

    @Test
    @DisplayName("A wrong token or another user's email is refused")
    void wrongTokenOrEmailRefused() {
        ctx.givenUser("bob", "bob@example.com");
        ctx.passwordResetService.generateResetToken("ada@example.com");
        String token = ctx.credentialStore.stored(user.getId()).getResetToken();

        assertThrows(InvalidCredentialsException.class,
                () -> ctx.passwordResetService.resetPassword(token + "x", "ada@example.com",
                        NEW_PASSWORD, NEW_PASSWORD));
        assertThrows(InvalidCredentialsException.class,
                () -> ctx.passwordResetService.resetPassword(token, "bob@example.com", NEW_PASSWORD, NEW_PASSWORD));
        assertThrows(InvalidCredentialsException.class,
                () -> ctx.passwordResetService.resetPassword(token, "nobody@example.com", NEW_PASSWORD, NEW_PASSWORD));
    }

    @Test
    @DisplayName("Confirmation mismatch and weak passwords are rejected before the token is checked")
    void inputRejectedFirst() {
        assertThrows(InvalidInputException.class,
                () -> ctx.passwordResetService.resetPassword("any", "ada@example.com", NEW_PASSWORD, "N3w!Passwort"));
        assertThrows(PasswordTooWeakException.class,
                () -> ctx.passwordResetService.resetPassword("any", "ada@example.com", "weakpassword", "weakpassword"));
    }
}
