package dev.repowarden.classifier.review;

/**
 * Checks a newly opened pull request is held to, with the advice posted when one fails.
 */
public enum Requirement {

    MISSING_TESTS("missing-tests", "⚠️ Consider adding tests for your code changes"),
    LARGE_FILE("large-file", "📏 Large files detected: %s - consider splitting"),
    MISSING_DOCS("missing-docs", "📚 Consider updating documentation for this change");

    private final String tag;
    private final String advice;

    Requirement(String tag, String advice) {
        this.tag = tag;
        this.advice = advice;
    }

    public String tag() { return tag; }

    /** LARGE_FILE takes the offending paths as its argument. */
    public String advice(String... args) {
        return advice.formatted((Object[]) args);
    }
}
