package dev.repowarden.domain.event;

/**
 * @param authorIsBot whether the pull request was opened by a bot account, which can
 *                    differ from the sender of a merge event
 */
public record PullRequestPayload(int number, String title, String headSha, String author, boolean authorIsBot)
        implements EventPayload {}
