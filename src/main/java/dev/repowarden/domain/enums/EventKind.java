package dev.repowarden.domain.enums;

/**
 * Kinds of webhook deliveries the pipeline understands.
 * UNSUPPORTED covers every other event/action pair and is skipped by the router.
 */
public enum EventKind {
    PULL_REQUEST_OPENED,
    PULL_REQUEST_UPDATED,
    PULL_REQUEST_MERGED,
    ISSUE_OPENED,
    ISSUE_COMMENT_CREATED,
    PULL_REQUEST_REVIEW_SUBMITTED,
    UNSUPPORTED;

    public boolean isPullRequestChange() {
        return this == PULL_REQUEST_OPENED || this == PULL_REQUEST_UPDATED;
    }

    public boolean carriesComment() {
        return this == ISSUE_COMMENT_CREATED || this == PULL_REQUEST_REVIEW_SUBMITTED;
    }
}
