package com.linkfolio.auth.api.controller;

import com.linkfolio.auth.api.dto.SessionRefreshRequestDto;
import com.linkfolio.auth.api.dto.SessionResponseDto;
import com.linkfolio.auth.domain.exception.SessionNotFoundException;
import com.linkfolio.auth.domain.model.SessionData;
import com.linkfolio.auth.domain.model.TokenClaims;
import com.linkfolio.auth.domain.service.SessionService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

/**
 * Session Controller - server-side sessions of the caller
 * Sessions owned by another user are reported as not found.
 * 
 * Endpoints:
 * - GET /auth/sessions/{id}
 * - DELETE /auth/sessions/{id}
 * - POST /auth/sessions/{id}/refresh
 */
@RestController
@RequestMapping("/auth/sessions")
@Tag(name = "Sessions", description = "Server-side session management")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<SessionResponseDto> getSession(@PathVariable String id,
                                                         @AuthenticationPrincipal TokenClaims claims) {
        return ResponseEntity.ok(SessionResponseDto.from(ownedSession(id, claims)));
    }

    /**
     * Returns 204 No Content
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSession(@PathVariable String id,
                                              @AuthenticationPrincipal TokenClaims claims) {
        ownedSession(id, claims);
        sessionService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/refresh")
    public ResponseEntity<SessionResponseDto> refreshSession(@PathVariable String id,
                                                             @Valid @RequestBody(required = false) SessionRefreshRequestDto request,
                                                             @AuthenticationPrincipal TokenClaims claims) {
        ownedSession(id, claims);
        Duration ttl = request != null && request.getTtlSeconds() != null
                ? Duration.ofSeconds(request.getTtlSeconds())
                : null;
        return ResponseEntity.ok(SessionResponseDto.from(sessionService.refresh(id, ttl)));
    }

    private SessionData ownedSession(String id, TokenClaims claims) {
        return sessionService.get(id)
                .filter(session -> session.getUserId().equals(claims.getUserId()))
                .orElseThrow(() -> new SessionNotFoundException("Session not found"));
    }
}
