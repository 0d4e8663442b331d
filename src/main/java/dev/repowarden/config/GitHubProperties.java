package dev.repowarden.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * GitHub App credentials and API client settings.
 * privateKey holds the PEM content itself, not a path.
 */
@ConfigurationProperties(prefix = "repowarden.github")
public record GitHubProperties(long appId, String privateKey, String webhookSecret, String apiBaseUrl,
                               Duration connectTimeout, Duration responseTimeout) {
    public GitHubProperties {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) apiBaseUrl = "https://api.github.com";
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(10);
        if (responseTimeout == null) responseTimeout = Duration.ofSeconds(30);
    }
}
