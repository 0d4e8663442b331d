package dev.repowarden.domain.enums;

public enum OutcomeStatus {
    APPLIED, SKIPPED, FAILED
}
