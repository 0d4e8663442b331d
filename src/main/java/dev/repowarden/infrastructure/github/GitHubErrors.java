package dev.repowarden.infrastructure.github;

import dev.repowarden.exception.PermanentPlatformException;
import dev.repowarden.exception.PlatformException;
import dev.repowarden.exception.TransientPlatformException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Sorts GitHub failures into transient and permanent.
 *
 * <p>Transient: 429, 403 with an exhausted rate limit, any 5xx, and network
 * errors with no response. Everything else is permanent.
 */
final class GitHubErrors {

    private GitHubErrors() {}

    static PlatformException translate(String operation, RuntimeException e) {
        if (e instanceof PlatformException platformException) {
            return platformException;
        }
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            String message = operation + " failed: HTTP " + status;
            if (isTransient(status, response.getHeaders().getFirst("x-ratelimit-remaining"))) {
                return new TransientPlatformException(message, status, e);
            }
            return new PermanentPlatformException(message, status, e);
        }
        if (e instanceof WebClientRequestException) {
            return new TransientPlatformException(operation + " failed: " + e.getMessage(), 0, e);
        }
        return new PermanentPlatformException(operation + " failed: " + e.getMessage(), 0, e);
    }

    static boolean isTransient(int status, String rateLimitRemaining) {
        if (status == 429 || status >= 500) return true;
        return status == 403 && "0".equals(rateLimitRemaining);
    }
}
