package dev.repowarden.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed or unsupported webhook payload. No plan is produced for it.
 */
public class WebhookValidationException extends RepoWardenException {

    public WebhookValidationException(String message) {
        super("WEBHOOK_VALIDATION", HttpStatus.BAD_REQUEST, message);
    }

    public WebhookValidationException(String message, Throwable cause) {
        super("WEBHOOK_VALIDATION", HttpStatus.BAD_REQUEST, message, cause);
    }
}
