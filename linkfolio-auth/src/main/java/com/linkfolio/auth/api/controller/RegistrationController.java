package com.linkfolio.auth.api.controller;

import com.linkfolio.auth.api.dto.RegistrationRequestDto;
import com.linkfolio.auth.api.dto.RegistrationResponseDto;
import com.linkfolio.auth.api.dto.UserDto;
import com.linkfolio.auth.api.dto.VerifyEmailRequestDto;
import com.linkfolio.auth.api.dto.VerifyEmailResponseDto;
import com.linkfolio.auth.domain.model.RegisterCommand;
import com.linkfolio.auth.domain.service.EmailVerificationService;
import com.linkfolio.auth.domain.service.RegistrationService;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Registration Controller - Identity Creation
 * Handles user registration and email verification.
 * 
 * Endpoints:
 * - POST /auth/register
 * - POST /auth/verify-email
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Registration", description = "User registration and email verification")
public class RegistrationController {

    private final RegistrationService registrationService;
    private final EmailVerificationService emailVerificationService;

    public RegistrationController(RegistrationService registrationService, EmailVerificationService emailVerificationService){
        this.registrationService = registrationService;
        this.emailVerificationService = emailVerificationService;
    }

    /**
     * Register a new user account
     * Returns 201 Created; the verification email is sent asynchronously
     */
    @PostMapping("/register")
    public ResponseEntity<RegistrationResponseDto> register(
            @Valid @RequestBody RegistrationRequestDto request) {
        RegisterCommand command = RegisterCommand.builder()
                .username(request.getUsername())
                .handle(request.getHandle())
                .email(request.getEmail())
                .password(request.getPassword())
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .build();

        UserEntity user = registrationService.register(command);

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new RegistrationResponseDto(UserDto.from(user), false,
                        "Registration successful. Please check your email to verify your account."));
    }

    /**
     * Verify email with token from email link
     * Returns 200 OK
     */
    @PostMapping("/verify-email")
    public ResponseEntity<VerifyEmailResponseDto> verifyEmail(
            @Valid @RequestBody VerifyEmailRequestDto request) {
        UUID userId = emailVerificationService.verifyEmail(request.getToken());
        return ResponseEntity.ok(new VerifyEmailResponseDto(userId.toString(), true));
    }
}
