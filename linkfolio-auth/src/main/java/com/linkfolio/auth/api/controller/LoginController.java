package com.linkfolio.auth.api.controller;

import com.linkfolio.auth.api.dto.*;
import com.linkfolio.auth.domain.model.ClientInfo;
import com.linkfolio.auth.domain.model.LoginResult;
import com.linkfolio.auth.domain.model.TokenClaims;
import com.linkfolio.auth.domain.service.LoginService;
import com.linkfolio.auth.domain.service.LogoutService;
import com.linkfolio.auth.domain.service.PasswordResetService;
import com.linkfolio.auth.ratelimit.RateLimitKeyResolver;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Login Controller - Identity Verification
 * Handles password authentication, logout and password reset.
 * 
 * Endpoints:
 * - POST /auth/login
 * - POST /auth/logout
 * - POST /auth/password/forgot
 * - POST /auth/password/reset
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Login, logout and password reset")
public class LoginController {

    private final LoginService loginService;
    private final LogoutService logoutService;
    private final PasswordResetService passwordResetService;

    public LoginController(LoginService loginService, LogoutService logoutService,
                           PasswordResetService passwordResetService) {
        this.loginService = loginService;
        this.logoutService = logoutService;
        this.passwordResetService = passwordResetService;
    }

    /**
     * Password authentication
     * Returns 200 OK with access and refresh token
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponseDto> login(@Valid @RequestBody LoginRequestDto request,
                                                  HttpServletRequest httpRequest) {
        ClientInfo client = new ClientInfo(
                httpRequest.getHeader("User-Agent"),
                RateLimitKeyResolver.clientIp(httpRequest)
        );
        LoginResult result = loginService.login(request.getEmail(), request.getPassword(), client);

        return ResponseEntity.ok(new LoginResponseDto(
                result.getTokens().getAccessToken(),
                result.getTokens().getRefreshToken(),
                "Bearer",
                result.getTokens().getExpiresAt(),
                result.getSessionId(),
                UserDto.from(result.getUser())
        ));
    }

    /**
     * Logout - invalidate refresh token and server-side sessions
     * Returns 204 No Content on success
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal TokenClaims claims) {
        logoutService.logout(UUID.fromString(claims.getUserId()));
        return ResponseEntity.noContent().build();
    }

    /**
     * Request a reset token by email
     * Always returns 202 Accepted, whether or not the email is registered
     */
    @PostMapping("/password/forgot")
    public ResponseEntity<MessageResponseDto> forgotPassword(
            @Valid @RequestBody ForgotPasswordRequestDto request) {
        passwordResetService.generateResetToken(request.getEmail());
        return ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .body(new MessageResponseDto("If the email is registered, a reset link has been sent."));
    }

    /**
     * Set a new password with a reset token
     * Returns 200 OK
     */
    @PostMapping("/password/reset")
    public ResponseEntity<MessageResponseDto> resetPassword(
            @Valid @RequestBody ResetPasswordRequestDto request) {
        passwordResetService.resetPassword(request.getToken(), request.getEmail(),
                request.getNewPassword(), request.getConfirmPassword());
        return ResponseEntity.ok(new MessageResponseDto("Password has been reset."));
    }
}
