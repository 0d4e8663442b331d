package dev.repowarden.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;

/**
 * RFC 7807 Problem Details for everything that escapes a controller.
 * Internal messages of unexpected errors are logged, not returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String TYPE_BASE = "https://repowarden.dev/errors/";

    @ExceptionHandler(WebhookValidationException.class)
    public ProblemDetail handleInvalidWebhook(WebhookValidationException ex) {
        log.warn("Rejected webhook: {}", ex.getMessage());
        return problem(ex.getStatus(), ex.getMessage(), "Invalid Webhook", slug(ex.getCode()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ProblemDetail handleMissingHeader(MissingRequestHeaderException ex) {
        log.warn("Missing header: {}", ex.getHeaderName());
        return problem(HttpStatus.BAD_REQUEST, "Missing header " + ex.getHeaderName(),
                "Invalid Request", "bad-request");
    }

    @ExceptionHandler(RepoWardenException.class)
    public ProblemDetail handleDomain(RepoWardenException ex) {
        log.warn("{}: {}", ex.getCode(), ex.getMessage());
        return problem(ex.getStatus(), ex.getMessage(), "Request Failed", slug(ex.getCode()));
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ProblemDetail handleRateLimited(RequestNotPermitted ex) {
        log.warn("Rate limited: {}", ex.getMessage());
        return problem(HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please retry later.",
                "Rate Limited", "rate-limited");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable. Please retry later.",
                "Service Unavailable", "service-unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.",
                "Internal Server Error", "internal");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String title, String type) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    // WEBHOOK_VALIDATION -> webhook-validation
    private static String slug(String code) {
        return code.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
