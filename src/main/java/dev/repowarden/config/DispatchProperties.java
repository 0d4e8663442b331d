package dev.repowarden.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry policy for transient platform failures.
 * Attempts are capped at {@value #MAX_ATTEMPTS_CEILING} to stay inside rate-limit windows.
 */
@ConfigurationProperties(prefix = "repowarden.dispatch")
public record DispatchProperties(int maxAttempts, Duration initialBackoff, double backoffMultiplier) {

    public static final int MAX_ATTEMPTS_CEILING = 5;

    public DispatchProperties {
        if (maxAttempts <= 0) maxAttempts = 3;
        if (maxAttempts > MAX_ATTEMPTS_CEILING) maxAttempts = MAX_ATTEMPTS_CEILING;
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero())
            initialBackoff = Duration.ofMillis(500);
        if (backoffMultiplier < 1.0) backoffMultiplier = 2.0;
    }

    public static DispatchProperties defaults() {
        return new DispatchProperties(0, null, 0);
    }
}
