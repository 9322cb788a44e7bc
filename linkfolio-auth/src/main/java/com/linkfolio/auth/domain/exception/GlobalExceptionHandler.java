package com.linkfolio.auth.domain.exception;

import com.linkfolio.auth.api.dto.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for all REST controllers.
 * Maps exceptions to consistent ApiErrorResponse with proper HTTP status codes.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_HEADER = "X-Trace-Id";

    /**
     * Handle validation errors from @Valid annotations
     * Returns 400 Bad Request
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        String message = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("Invalid request");

        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request body", request);
    }

    /**
     * Handle policy violations (short or weak password, bad input)
     * Returns 400 Bad Request
     */
    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidInput(
            InvalidInputException ex,
            HttpServletRequest request) {

        String code = "VALIDATION_ERROR";
        if (ex instanceof PasswordTooShortException) {
            code = "PASSWORD_TOO_SHORT";
        } else if (ex instanceof PasswordTooWeakException) {
            code = "PASSWORD_TOO_WEAK";
        }
        return build(HttpStatus.BAD_REQUEST, code, ex.getMessage(), request);
    }

    /**
     * Handle duplicate email or username registration
     * Returns 409 Conflict
     */
    @ExceptionHandler(DuplicateAccountException.class)
    public ResponseEntity<ApiErrorResponse> handleDuplicate(
            DuplicateAccountException ex,
            HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "ACCOUNT_ALREADY_EXISTS", ex.getMessage(), request);
    }

    /**
     * Handle invalid credentials and rejected tokens.
     * Every cause produces the same body.
     * Returns 401 Unauthorized
     */
    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidCredentials(
            InvalidCredentialsException ex,
            HttpServletRequest request) {

        if (ex instanceof InvalidTokenException) {
            log.debug("[AUTH] Token rejected | reason={}", ((InvalidTokenException) ex).getReason());
        }
        return build(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", ex.getMessage(), request);
    }

    /**
     * Handle account lockout
     * Returns 403 Forbidden with Retry-After header
     */
    @ExceptionHandler(AccountLockedException.class)
    public ResponseEntity<ApiErrorResponse> handleAccountLocked(
            AccountLockedException ex,
            HttpServletRequest request) {

        ApiErrorResponse error = new ApiErrorResponse(
                "ACCOUNT_LOCKED",
                ex.getMessage(),
                request.getHeader(TRACE_HEADER)
        );

        return ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .header("Retry-After", String.valueOf(ex.getRetryAfterSeconds()))
                .body(error);
    }

    /**
     * Handle missing or expired session
     * Returns 404 Not Found
     */
    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleSessionNotFound(
            SessionNotFoundException ex,
            HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", ex.getMessage(), request);
    }

    /**
     * Handle all other unexpected exceptions
     * Returns 500 Internal Server Error
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(
            Exception ex,
            HttpServletRequest request) {

        log.error("[ERROR] Unhandled exception | path={} | traceId={}",
                request.getRequestURI(), request.getHeader(TRACE_HEADER), ex);

        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "Something went wrong. Please try again later.", request);
    }

    private ResponseEntity<ApiErrorResponse> build(HttpStatus status, String code, String message,
                                                   HttpServletRequest request) {
        ApiErrorResponse error = new ApiErrorResponse(code, message, request.getHeader(TRACE_HEADER));
        return ResponseEntity.status(status).body(error);
    }
}
