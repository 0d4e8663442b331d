package dev.repowarden.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception. Carries a machine-readable code and the HTTP status the
 * exception handler should answer with.
 */
public abstract class RepoWardenException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected RepoWardenException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected RepoWardenException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public String getCode() { return code; }

    public HttpStatus getStatus() { return status; }
}
