package dev.repowarden.domain.enums;

/**
 * Registered classifiers, in the fixed order the registry runs them.
 */
public enum ClassifierType {
    LANGUAGE, SIZE, SECURITY, CONTENT_TYPE, KEYWORD_TRIAGE, PRIORITY, OWNERSHIP,
    PR_SUMMARY, PR_REQUIREMENTS, ISSUE_TEMPLATE
}
