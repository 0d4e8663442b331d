package dev.repowarden.domain.enums;

/**
 * Finding severity, ordered from least to most severe.
 */
public enum Severity {
    INFO, WARN, CRITICAL;

    public boolean isAtLeast(Severity other) {
        return this.ordinal() >= other.ordinal();
    }
}
