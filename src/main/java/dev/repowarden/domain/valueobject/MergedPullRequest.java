package dev.repowarden.domain.valueobject;

import java.time.Instant;

/**
 * A merged pull request, as listed in the changelog reply.
 */
public record MergedPullRequest(int number, String title, String author, Instant mergedAt) {}
