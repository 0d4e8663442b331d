package dev.repowarden.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Feature toggles and limits for the classification pipeline. Toggles default to on.
 */
@ConfigurationProperties(prefix = "repowarden.pipeline")
public record PipelineProperties(Boolean securityScanning, Boolean welcomeNewContributors,
                                 Boolean autoAssignReviewers, Duration classifierTimeout, int changelogSize) {
    public PipelineProperties {
        if (securityScanning == null) securityScanning = true;
        if (welcomeNewContributors == null) welcomeNewContributors = true;
        if (autoAssignReviewers == null) autoAssignReviewers = true;
        if (classifierTimeout == null) classifierTimeout = Duration.ofSeconds(10);
        if (changelogSize <= 0) changelogSize = 10;
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null, 0);
    }
}
