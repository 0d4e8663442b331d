package dev.repowarden.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure talking to the code-hosting platform.
 */
public abstract class PlatformException extends RepoWardenException {

    private final int platformStatus;

    protected PlatformException(String code, String message, int platformStatus, Throwable cause) {
        super(code, HttpStatus.BAD_GATEWAY, message, cause);
        this.platformStatus = platformStatus;
    }

    /** HTTP status returned by the platform, or 0 when no response was received. */
    public int getPlatformStatus() { return platformStatus; }

    public abstract boolean isTransient();
}
