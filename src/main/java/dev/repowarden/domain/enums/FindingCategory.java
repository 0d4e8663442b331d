package dev.repowarden.domain.enums;

/**
 * What a finding describes. SUMMARY, REQUIREMENT and SUGGESTION feed comment sections
 * and never produce a label.
 */
public enum FindingCategory {
    LANGUAGE, SIZE, SECURITY, PRIORITY, CLASSIFICATION, OWNERSHIP, SUMMARY, REQUIREMENT, SUGGESTION
}
