package com.expertagent.authzservice.infrastructure.web;

import com.expertagent.authz.AccessDeniedException;
import com.expertagent.authz.principal.PrincipalHeaderCodec.PrincipalEncodingException;
import com.expertagent.authzservice.security.AuthenticationRequiredException;
import com.expertagent.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://expertagent.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "You do not have permission to perform this action",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Denials never expose the policy reason; it is in the audit log under the same correlation ID.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://expertagent.dev/errors/";

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ProblemDetail handleAuthenticationRequired(AuthenticationRequiredException ex) {
        log.info("Unauthenticated request rejected: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", "Authentication required");
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.warn("{} policy={}", ex.getMessage(), ex.decision().diagnostics().matchedPolicy().orElse("-"));
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden",
                "You do not have permission to perform this action");
    }

    @ExceptionHandler(PrincipalEncodingException.class)
    public ProblemDetail handleBadPrincipal(PrincipalEncodingException ex) {
        log.warn("Rejected malformed principal header: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed principal header");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class
    })
    public ProblemDetail handleFrameworkError(Exception ex) {
        ProblemDetail problem = ((ErrorResponse) ex).getBody();
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
