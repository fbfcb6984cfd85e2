package io.coko.billing.api;

import io.coko.billing.api.dto.ErrorResponse;
import io.coko.billing.exception.BillingException;
import io.coko.billing.exception.ConfigMissingException;
import io.coko.billing.exception.ProviderException;
import io.coko.billing.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps engine exceptions to HTTP statuses and coarse error codes.
 * Internal details (stack traces, SQL, provider payloads) never reach the caller.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest req) {
        Map<String, Object> details = null;
        if (ex.getFieldName() != null) {
            details = new HashMap<>();
            details.put("field", ex.getFieldName());
        }
        return build(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), req, details);
    }

    @ExceptionHandler(ConfigMissingException.class)
    public ResponseEntity<ErrorResponse> handleConfigMissing(ConfigMissingException ex, HttpServletRequest req) {
        log.error("Configuration missing: type={} key={} asOf={}", ex.getConfigType(), ex.getKey(), ex.getAsOf());
        Map<String, Object> details = new HashMap<>();
        details.put("configType", String.valueOf(ex.getConfigType()));
        details.put("key", ex.getKey());
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), req, details);
    }

    /**
     * Transient provider failures are retryable (503). Permanent ones are a declined payment (402).
     */
    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ErrorResponse> handleProvider(ProviderException ex, HttpServletRequest req) {
        if (ex.isTransient()) {
            log.warn("Transient provider failure: provider={} message={}", ex.getProvider(), ex.getMessage());
            return build(HttpStatus.SERVICE_UNAVAILABLE, "unavailable", "Payment provider temporarily unavailable", req, null);
        }
        Map<String, Object> details = new HashMap<>();
        details.put("provider", String.valueOf(ex.getProvider()));
        details.put("providerCode", ex.getProviderCode());
        return build(HttpStatus.PAYMENT_REQUIRED, ex.getErrorCode(), "Payment was declined", req, details);
    }

    @ExceptionHandler(BillingException.class)
    public ResponseEntity<ErrorResponse> handleBilling(BillingException ex, HttpServletRequest req) {
        HttpStatus status = statusFor(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Billing operation unavailable: path={} code={} message={}", req.getRequestURI(), ex.getErrorCode(),
                ex.getMessage(), ex);
        } else {
            log.debug("Billing request rejected: path={} code={} message={}", req.getRequestURI(), ex.getErrorCode(),
                ex.getMessage());
        }
        return build(status, ex.getErrorCode(), ex.getMessage(), req, null);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MissingRequestHeaderException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest req) {
        String message = ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
        return build(HttpStatus.BAD_REQUEST, "validation_failed", message, req, null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex, HttpServletRequest req) {
        log.error("Database error: path={}", req.getRequestURI(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "unavailable", "Storage temporarily unavailable", req, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unexpected error: path={}", req.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", req, null);
    }

    static HttpStatus statusFor(String errorCode) {
        if (errorCode == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        switch (errorCode) {
            case "validation_failed":
                return HttpStatus.BAD_REQUEST;
            case "unauthenticated":
                return HttpStatus.UNAUTHORIZED;
            case "payment_failed":
                return HttpStatus.PAYMENT_REQUIRED;
            case "not_found":
                return HttpStatus.NOT_FOUND;
            case "conflict":
                return HttpStatus.CONFLICT;
            case "rate_limited":
                return HttpStatus.TOO_MANY_REQUESTS;
            case "unavailable":
            case "configuration_missing":
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message, HttpServletRequest req,
                                                Map<String, Object> details) {
        ErrorResponse body = new ErrorResponse(status.value(), code, message, req.getRequestURI(), clock.instant(), details);
        return ResponseEntity.status(status).body(body);
    }
}
