package dev.repowarden.domain.event;

/**
 * Issue comment or review body.
 *
 * @param number        issue or pull request the comment belongs to
 * @param commentId     platform id of the comment or review, used to key replies
 * @param onPullRequest whether the comment thread is a pull request
 */
public record CommentPayload(int number, long commentId, String body, boolean onPullRequest) implements EventPayload {}
