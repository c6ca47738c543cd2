package com.flagship.gambling_ledger.exception;

import com.flagship.gambling_ledger.exclusion.SelfExclusionActiveException;
import com.flagship.gambling_ledger.guard.RateLimitExceededException;
import com.flagship.gambling_ledger.ledger.InsufficientBalanceException;
import com.flagship.gambling_ledger.limits.LimitExceededException;
import com.flagship.gambling_ledger.lock.LockTimeoutException;
import com.flagship.gambling_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain failures to HTTP responses. User-facing refusals keep their
 * message; infrastructure failures get a generic one and are logged with
 * the correlation id.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing
                ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Malformed request", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler({ConflictException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getMessage(), null);
    }

    @ExceptionHandler(SelfExclusionActiveException.class)
    public ResponseEntity<ErrorResponse> handleSelfExclusion(SelfExclusionActiveException e) {
        log.warn("Access denied by self-exclusion: type={}, action={}", e.getExclusion().getType(), e.getAction());
        return respond(HttpStatus.FORBIDDEN, "Self Exclusion Active", e.getMessage(), Map.of(
                "exclusion_type", e.getExclusion().getType().name(),
                "platform_type", e.getExclusion().getPlatformType().name(),
                "action", e.getAction().name()));
    }

    @ExceptionHandler(LimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleLimitExceeded(LimitExceededException e) {
        log.warn("Limit exceeded: kind={}, period={}", e.getKind(), e.getPeriod());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Limit Exceeded", e.getMessage(), Map.of(
                "limit_type", e.getKind().name(),
                "period", e.getPeriod() != null ? e.getPeriod().name() : "DAILY"));
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(InsufficientBalanceException e) {
        log.warn("Insufficient balance: asset={}, requested={}", e.getAsset(), e.getRequested());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Balance", e.getMessage(),
                Map.of("asset", e.getAsset().name()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(body("Too Many Requests", e.getMessage(), Map.of("policy", e.getPolicy())));
    }

    @ExceptionHandler(LockTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleLockTimeout(LockTimeoutException e) {
        log.warn("Lock timeout: resource={}, attempts={}, correlationId={}",
                e.getResource(), e.getAttempts(), CorrelationContext.getCorrelationId());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "1")
                .body(body("Service Busy", LockTimeoutException.USER_MESSAGE, null));
    }

    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(DataAccessResourceFailureException e) {
        log.error("Backing store unavailable: correlationId={}", CorrelationContext.getCorrelationId(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "5")
                .body(body("Service Unavailable", LockTimeoutException.USER_MESSAGE, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error: correlationId={}", CorrelationContext.getCorrelationId(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        return ResponseEntity.status(status).body(body(error, message, details));
    }

    private ErrorResponse body(String error, String message, Map<String, String> details) {
        return ErrorResponse.builder()
                .error(error)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
