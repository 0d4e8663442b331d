package dev.repowarden.domain.event;

import dev.repowarden.domain.enums.EventKind;

import java.time.Instant;
import java.util.Optional;

/**
 * One validated webhook delivery. Created once per delivery, discarded after dispatch.
 */
public record RepositoryEvent(
        String deliveryId,
        EventKind kind,
        String repository,
        long installationId,
        String actor,
        boolean actorIsBot,
        Instant timestamp,
        EventPayload payload
) {
    public RepositoryEvent {
        if (kind == null) throw new IllegalArgumentException("kind required");
        if (kind != EventKind.UNSUPPORTED && payload == null)
            throw new IllegalArgumentException("payload required for " + kind);
        if (timestamp == null) timestamp = Instant.now();
    }

    public static RepositoryEvent unsupported(String deliveryId, String repository, String actor) {
        return new RepositoryEvent(deliveryId, EventKind.UNSUPPORTED, repository, 0L, actor, false, null, null);
    }

    public int number() {
        return payload != null ? payload.number() : 0;
    }

    public Optional<PullRequestPayload> pullRequest() {
        return payload instanceof PullRequestPayload pr ? Optional.of(pr) : Optional.empty();
    }

    public Optional<IssuePayload> issue() {
        return payload instanceof IssuePayload issue ? Optional.of(issue) : Optional.empty();
    }

    public Optional<CommentPayload> comment() {
        return payload instanceof CommentPayload comment ? Optional.of(comment) : Optional.empty();
    }
}
