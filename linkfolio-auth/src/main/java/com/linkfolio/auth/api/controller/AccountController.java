package com.linkfolio.auth.api.controller;

import com.linkfolio.auth.api.dto.CurrentUserResponseDto;
import com.linkfolio.auth.api.dto.EmailVerifiedResponseDto;
import com.linkfolio.auth.domain.model.TokenClaims;
import com.linkfolio.auth.domain.service.EmailVerificationService;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Account Controller - read-only views of the caller's account
 * 
 * Endpoints:
 * - GET /auth/me
 * - GET /auth/email-verified
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Account", description = "Caller identity and verification state")
public class AccountController {

    private final EmailVerificationService emailVerificationService;

    public AccountController(EmailVerificationService emailVerificationService) {
        this.emailVerificationService = emailVerificationService;
    }

    @GetMapping("/me")
    public ResponseEntity<CurrentUserResponseDto> me(@AuthenticationPrincipal TokenClaims claims) {
        return ResponseEntity.ok(CurrentUserResponseDto.from(claims));
    }

    @GetMapping("/email-verified")
    public ResponseEntity<EmailVerifiedResponseDto> emailVerified(@AuthenticationPrincipal TokenClaims claims) {
        boolean verified = emailVerificationService.isEmailVerified(UUID.fromString(claims.getUserId()));
        return ResponseEntity.ok(new EmailVerifiedResponseDto(verified));
    }
}
