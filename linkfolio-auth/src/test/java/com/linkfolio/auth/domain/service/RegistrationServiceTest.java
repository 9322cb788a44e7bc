package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.exception.CredentialStoreException;
import com.linkfolio.auth.domain.exception.DuplicateAccountException;
import com.linkfolio.auth.domain.exception.InternalAuthException;
import com.linkfolio.auth.domain.exception.PasswordTooShortException;
import com.linkfolio.auth.domain.model.RegisterCommand;
import com.linkfolio.auth.domain.port.CredentialStore;
import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import com.linkfolio.auth.support.AuthTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.linkfolio.auth.support.AuthTestContext.PASSWORD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;

@DisplayName("RegistrationService Tests")
class RegistrationServiceTest {

    private AuthTestContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new AuthTestContext();
    }

    @Test
    @DisplayName("register() creates the user, an unverified credential and a verification mail")
    void registerSuccess() {
        // When
        UserEntity user = ctx.registrationService.register(command("ada", "ada@example.com", PASSWORD));

        // Then
        assertThat(user.getId()).isNotNull();
        assertThat(user.getHandle()).isEqualTo("ada-handle");

        CredentialEntity credential = ctx.credentialStore.stored(user.getId());
        assertThat(credential.isEmailVerified()).isFalse();
        assertThat(credential.getEmailVerificationToken()).hasSize(32);
        assertThat(credential.getPasswordHash()).doesNotContain(PASSWORD);
        assertThat(credential.getFailedLoginAttempts()).isZero();

        assertThat(ctx.notifications.withTemplate("email-verification")).singleElement()
                .satisfies(mail -> assertThat(mail.data)
                        .containsEntry("verificationToken", credential.getEmailVerificationToken()));
    }

    @Test
    @DisplayName("Duplicate email or username is a conflict")
    void duplicates() {
        ctx.registrationService.register(command("ada", "ada@example.com", PASSWORD));

        assertThrows(DuplicateAccountException.class,
                () -> ctx.registrationService.register(command("ada2", "ada@example.com", PASSWORD)));
        assertThrows(DuplicateAccountException.class,
                () -> ctx.registrationService.register(command("ada", "other@example.com", PASSWORD)));
        assertThat(ctx.principalStore.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("A policy violation creates nothing")
    void policyViolation() {
        assertThrows(PasswordTooShortException.class,
                () -> ctx.registrationService.register(command("ada", "ada@example.com", "Ab1!")));

        assertThat(ctx.principalStore.size()).isZero();
        assertThat(ctx.notifications.getSent()).isEmpty();
    }

    @Test
    @DisplayName("A failing credential write deletes the new user again")
    void credentialFailureCompensates() {
        // Given
        CredentialStore failingStore = mock(CredentialStore.class);
        willThrow(new CredentialStoreException("insert failed", null)).given(failingStore).createCredential(any());
        RegistrationService service = new RegistrationService(ctx.principalStore, failingStore,
                ctx.passwordHasher, ctx.passwordPolicy, ctx.cryptoUtils, ctx.notificationService);

        // When
        assertThrows(InternalAuthException.class,
                () -> service.register(command("ada", "ada@example.com", PASSWORD)));

        // Then
        assertThat(ctx.principalStore.existsByEmail("ada@example.com")).isFalse();
        assertThat(ctx.notifications.getSent()).isEmpty();
    }

    @Test
    @DisplayName("A failing mailer does not fail registration")
    void notificationFailureTolerated() {
        ctx.notifications.setFailing(true);

        UserEntity user = ctx.registrationService.register(command("ada", "ada@example.com", PASSWORD));

        assertThat(ctx.credentialStore.stored(user.getId())).isNotNull();
    }

    private RegisterCommand command(String username, String email, String password) {
        return RegisterCommand.builder()
                .username(username)
                .handle(username + "-handle")
                .email(email)
                .password(password)
                .firstName("Ada")
                .lastName("Lovelace")
                .build();
    }
}
