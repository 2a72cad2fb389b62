package com.meridian.platformapi.infrastructure.web;

import com.meridian.observability.CorrelationContextHolder;
import com.meridian.platformapi.config.PlatformApiProperties;
import com.meridian.platformapi.domain.ResourceNotFoundException;
import com.meridian.security.AccessDisabledException;
import com.meridian.security.AuthenticationException;
import com.meridian.security.AuthorizationException;
import com.meridian.security.UpstreamUnavailableException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://meridian.dev/errors/unauthorized",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Authentication required",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Authentication failures of every kind, disabled accounts included, produce the same 401 with
 * a {@code WWW-Authenticate: Bearer} challenge, so a response never reveals whether a user exists.
 * The underlying reason is only included when {@code meridian.api.verbose-errors} is set.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String GENERIC_UNAUTHORIZED = "Authentication required";
    static final String GENERIC_FORBIDDEN = "Not allowed to perform this action";

    private final boolean verboseErrors;

    public GlobalExceptionHandler(PlatformApiProperties properties) {
        this.verboseErrors = properties.verboseErrors();
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ProblemDetail> handleAuthentication(AuthenticationException ex) {
        if (ex instanceof UpstreamUnavailableException upstream) {
            log.warn("Authentication failed, identity provider unavailable at {}: {}", upstream.uri(), ex.getMessage());
        } else if (ex instanceof AccessDisabledException disabled) {
            log.info("API access not enabled for user '{}'", disabled.username());
        } else {
            log.debug("Authentication failed: {}", ex.getMessage());
        }
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.UNAUTHORIZED, verboseErrors ? ex.getMessage() : GENERIC_UNAUTHORIZED);
        problem.setTitle("Unauthorized");
        problem.setType(URI.create("https://meridian.dev/errors/unauthorized"));
        enrichWithCorrelation(problem);
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(problem);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ProblemDetail handleAuthorization(AuthorizationException ex) {
        log.info("Denied: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.FORBIDDEN, verboseErrors ? ex.getMessage() : GENERIC_FORBIDDEN);
        problem.setTitle("Forbidden");
        problem.setType(URI.create("https://meridian.dev/errors/forbidden"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ProblemDetail handleNotFound(ResourceNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Not Found");
        problem.setType(URI.create("https://meridian.dev/errors/not-found"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest("Malformed request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create("https://meridian.dev/errors/validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // Spring MVC's own errors (unknown route, wrong method, ...) keep their status
            ProblemDetail problem = framework.getBody();
            enrichWithCorrelation(problem);
            return ResponseEntity.status(framework.getStatusCode())
                    .headers(framework.getHeaders())
                    .body(problem);
        }
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("https://meridian.dev/errors/internal"));
        enrichWithCorrelation(problem);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    private ProblemDetail badRequest(String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Bad Request");
        problem.setType(URI.create("https://meridian.dev/errors/bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
