package com.linkfolio.auth.api.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkfolio.auth.api.dto.ApiErrorResponse;
import com.linkfolio.auth.domain.exception.CredentialStoreException;
import com.linkfolio.auth.domain.exception.InvalidCredentialsException;
import com.linkfolio.auth.domain.model.TokenClaims;
import com.linkfolio.auth.domain.service.JwtTokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <access token>}.
 * Invalid tokens leave the request anonymous; protected endpoints then answer 401.
 * A store failure while checking the token ends the request with a 500 error body.
 */
@Slf4j
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final ObjectMapper objectMapper;

    public BearerTokenAuthenticationFilter(JwtTokenService jwtTokenService, ObjectMapper objectMapper) {
        this.jwtTokenService = jwtTokenService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            try {
                TokenClaims claims = jwtTokenService.validateAccessToken(token);

                List<SimpleGrantedAuthority> authorities = new ArrayList<>();
                authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
                if (claims.isAdmin()) {
                    authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
                }

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(claims, null, authorities);
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.trace("[AUTH] Bearer token accepted | userId={}", claims.getUserId());
            } catch (InvalidCredentialsException e) {
                SecurityContextHolder.clearContext();
                log.debug("[AUTH] Bearer token rejected | path={}", request.getRequestURI());
            } catch (CredentialStoreException e) {
                SecurityContextHolder.clearContext();
                log.error("[AUTH_ERROR] Token check failed | path={} | traceId={}",
                        request.getRequestURI(), request.getHeader("X-Trace-Id"), e);
                writeInternalError(request, response);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    private void writeInternalError(HttpServletRequest request, HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.INTERNAL_SERVER_ERROR.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        ApiErrorResponse body = new ApiErrorResponse(
                "INTERNAL_ERROR",
                "Something went wrong. Please try again later.",
                request.getHeader("X-Trace-Id")
        );
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
