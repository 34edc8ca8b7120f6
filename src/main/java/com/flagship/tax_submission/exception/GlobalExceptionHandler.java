package com.flagship.tax_submission.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain failures to HTTP responses.
 *
 * - 400: invalid input, refused submissions (already accepted, inactive tenant, wrong state)
 * - 403: cross-tenant writes
 * - 404: unknown records
 * - 409: illegal lifecycle transitions
 * - 422: certificate problems
 * - 502: authority refused the request or could not be reached
 * - 503: retries exhausted, document left PENDING
 * - 504: authority timed out
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

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException e) {
        log.warn("Missing request part: {}", e.getRequestPartName());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Required part '" + e.getRequestPartName() + "' is missing",
            Map.of("field", e.getRequestPartName()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing request parameter: {}", e.getParameterName());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Required parameter '" + e.getParameterName() + "' is missing",
            Map.of("field", e.getParameterName()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request body is malformed", null);
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

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Invalid value for '" + e.getName() + "'", Map.of("field", e.getName()));
    }

    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<ErrorResponse> handleInputValidation(InputValidationException e) {
        log.warn("Input validation failed: field={}, error={}", e.getField(), e.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", e.getMessage(),
            Map.of("field", e.getField()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.info("Not found: {}", e.getMessage());

        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(SubmissionRefusedException.class)
    public ResponseEntity<ErrorResponse> handleRefused(SubmissionRefusedException e) {
        log.warn("Request refused: reason={}, error={}", e.getReason(), e.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Request Refused", e.getMessage(),
            Map.of("reason", e.getReason()));
    }

    @ExceptionHandler(SigningCertificateException.class)
    public ResponseEntity<ErrorResponse> handleCertificate(SigningCertificateException e) {
        log.warn("Certificate problem: reason={}, error={}", e.getReason(), e.getMessage());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Certificate Error", e.getMessage(),
            Map.of("reason", e.getReason()));
    }

    @ExceptionHandler(OwnershipViolationException.class)
    public ResponseEntity<ErrorResponse> handleOwnershipViolation(OwnershipViolationException e) {
        log.warn("Ownership violation: requestingTenant={}, owningTenant={}, resource={}",
            e.getRequestingTenantId(), e.getOwningTenantId(), e.getResource());

        return respond(HttpStatus.FORBIDDEN, "Forbidden", "Resource belongs to another tenant", null);
    }

    @ExceptionHandler(AuthorityProtocolException.class)
    public ResponseEntity<ErrorResponse> handleAuthorityProtocol(AuthorityProtocolException e) {
        log.error("Tax authority refused request: tag={}, error={}", e.getTag(), e.getMessage());

        return respond(HttpStatus.BAD_GATEWAY, "Authority Error", e.getMessage(),
            Map.of("tag", e.getTag().name()));
    }

    @ExceptionHandler(TransientTransportException.class)
    public ResponseEntity<ErrorResponse> handleTransientTransport(TransientTransportException e) {
        log.error("Tax authority unreachable: tag={}, error={}", e.getTag(), e.getMessage());

        HttpStatus status = e.isTimeout() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        return respond(status, "Authority Unavailable", e.getMessage(), Map.of("tag", e.getTag().name()));
    }

    @ExceptionHandler(RetryExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleRetryExhausted(RetryExhaustedException e) {
        log.error("Transmission retries exhausted: documentNumber={}, attempts={}",
            e.getDocumentNumber(), e.getAttempts());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("documentNumber", e.getDocumentNumber());
        details.put("attempts", String.valueOf(e.getAttempts()));
        details.put("state", "PENDING");
        if (!e.getErrorLog().isEmpty()) {
            details.put("lastError", e.getErrorLog().get(e.getErrorLog().size() - 1).getMessage());
        }

        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Transmission Failed", e.getMessage(), details);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());

        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                  Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
