package com.linkfolio.auth.api.controller;

import com.linkfolio.auth.api.dto.TokenRefreshRequestDto;
import com.linkfolio.auth.api.dto.TokenRefreshResponseDto;
import com.linkfolio.auth.domain.model.LoginResult;
import com.linkfolio.auth.domain.service.JwtTokenService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Token Controller - Token Lifecycle Management
 * 
 * Endpoints:
 * - POST /auth/token/refresh
 */
@RestController
@RequestMapping("/auth/token")
@Tag(name = "Token Management", description = "Token refresh")
public class TokenController {

    private final JwtTokenService jwtTokenService;

    public TokenController(JwtTokenService jwtTokenService) {
        this.jwtTokenService = jwtTokenService;
    }

    /**
     * Refresh ACCESS token using refresh token
     * Returns 200 OK with new ACCESS token and rotated refresh token
     */
    @PostMapping("/refresh")
    public ResponseEntity<TokenRefreshResponseDto> refreshToken(
            @Valid @RequestBody TokenRefreshRequestDto request) {
        LoginResult result = jwtTokenService.refresh(request.getRefreshToken());
        return ResponseEntity.ok(new TokenRefreshResponseDto(
                result.getTokens().getAccessToken(),
                result.getTokens().getRefreshToken(),
                "Bearer",
                result.getTokens().getExpiresAt()
        ));
    }
}
