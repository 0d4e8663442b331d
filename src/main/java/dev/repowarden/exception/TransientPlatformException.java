package dev.repowarden.exception;

/**
 * Rate limit, 5xx or network failure. Expected to resolve on retry.
 */
public class TransientPlatformException extends PlatformException {

    public TransientPlatformException(String message, int platformStatus, Throwable cause) {
        super("PLATFORM_TRANSIENT", message, platformStatus, cause);
    }

    public TransientPlatformException(String message) {
        this(message, 0, null);
    }

    @Override
    public boolean isTransient() { return true; }
}
