package dev.repowarden.exception;

/**
 * Permission denied, not found, validation failure. Never retried.
 */
public class PermanentPlatformException extends PlatformException {

    public PermanentPlatformException(String message, int platformStatus, Throwable cause) {
        super("PLATFORM_PERMANENT", message, platformStatus, cause);
    }

    public PermanentPlatformException(String message) {
        this(message, 0, null);
    }

    @Override
    public boolean isTransient() { return false; }
}
