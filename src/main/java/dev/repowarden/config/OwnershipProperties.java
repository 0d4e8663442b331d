package dev.repowarden.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Directory-to-owner table used for reviewer requests. The longest matching prefix wins.
 */
@ConfigurationProperties(prefix = "repowarden.ownership")
public record OwnershipProperties(List<OwnerRule> rules, int maxReviewers) {

    public OwnershipProperties {
        rules = rules == null ? List.of() : List.copyOf(rules);
        if (maxReviewers <= 0) maxReviewers = 3;
    }

    public record OwnerRule(String pathPrefix, String owner) {}
}
