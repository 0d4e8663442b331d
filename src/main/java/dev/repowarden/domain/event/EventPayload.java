package dev.repowarden.domain.event;

/**
 * Kind-specific part of a {@link RepositoryEvent}.
 */
public sealed interface EventPayload permits PullRequestPayload, IssuePayload, CommentPayload {

    /** Issue or pull request number the event is about. */
    int number();
}
