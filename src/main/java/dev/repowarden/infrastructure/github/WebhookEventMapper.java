package dev.repowarden.infrastructure.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.event.CommentPayload;
import dev.repowarden.domain.event.EventPayload;
import dev.repowarden.domain.event.IssuePayload;
import dev.repowarden.domain.event.PullRequestPayload;
import dev.repowarden.domain.event.RepositoryEvent;
import dev.repowarden.dto.request.WebhookPayload;
import dev.repowarden.exception.WebhookValidationException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Maps a GitHub delivery (event header plus JSON body) to a {@link RepositoryEvent}.
 *
 * <p>Event and action combinations the app does not handle map to
 * {@link EventKind#UNSUPPORTED}. A body that is not valid JSON, or a handled event
 * missing its repository, installation or subject, is rejected.
 */
@Component
public class WebhookEventMapper {

    private final ObjectMapper objectMapper;

    public WebhookEventMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RepositoryEvent map(String eventType, String deliveryId, String rawBody) {
        WebhookPayload payload;
        try {
            payload = objectMapper.readValue(rawBody, WebhookPayload.class);
        } catch (JsonProcessingException e) {
            throw new WebhookValidationException("Malformed payload for delivery " + deliveryId, e);
        }
        if (payload == null) {
            throw new WebhookValidationException("Empty payload for delivery " + deliveryId);
        }

        EventKind kind = kindOf(eventType, payload);
        String repository = payload.repository() != null ? payload.repository().fullName() : null;
        String actor = payload.sender() != null ? payload.sender().login() : null;
        if (kind == EventKind.UNSUPPORTED) {
            return RepositoryEvent.unsupported(deliveryId, repository, actor);
        }

        if (repository == null || !repository.contains("/")) {
            throw new WebhookValidationException("Missing repository in " + eventType + " delivery " + deliveryId);
        }
        if (payload.installation() == null) {
            throw new WebhookValidationException("Missing installation in " + eventType + " delivery " + deliveryId);
        }
        boolean bot = payload.sender() != null && payload.sender().isBot();
        return new RepositoryEvent(deliveryId, kind, repository, payload.installation().id(),
                actor, bot, Instant.now(), subject(kind, payload, deliveryId));
    }

    static EventKind kindOf(String eventType, WebhookPayload payload) {
        String action = payload.action() == null ? "" : payload.action();
        return switch (eventType == null ? "" : eventType) {
            case "pull_request" -> switch (action) {
                case "opened" -> EventKind.PULL_REQUEST_OPENED;
                case "synchronize", "reopened" -> EventKind.PULL_REQUEST_UPDATED;
                case "closed" -> payload.pullRequest() != null && payload.pullRequest().merged()
                        ? EventKind.PULL_REQUEST_MERGED : EventKind.UNSUPPORTED;
                default -> EventKind.UNSUPPORTED;
            };
            case "issues" -> "opened".equals(action) ? EventKind.ISSUE_OPENED : EventKind.UNSUPPORTED;
            case "issue_comment" -> "created".equals(action) ? EventKind.ISSUE_COMMENT_CREATED : EventKind.UNSUPPORTED;
            case "pull_request_review" ->
                    "submitted".equals(action) ? EventKind.PULL_REQUEST_REVIEW_SUBMITTED : EventKind.UNSUPPORTED;
            default -> EventKind.UNSUPPORTED;
        };
    }

    private static EventPayload subject(EventKind kind, WebhookPayload payload, String deliveryId) {
        switch (kind) {
            case PULL_REQUEST_OPENED, PULL_REQUEST_UPDATED, PULL_REQUEST_MERGED -> {
                WebhookPayload.PullRequest pr = require(payload.pullRequest(), "pull_request", deliveryId);
                String sha = pr.head() != null ? pr.head().sha() : null;
                String author = pr.user() != null ? pr.user().login() : null;
                boolean authorIsBot = pr.user() != null && pr.user().isBot();
                return new PullRequestPayload(pr.number(), pr.title(), sha, author, authorIsBot);
            }
            case ISSUE_OPENED -> {
                WebhookPayload.Issue issue = require(payload.issue(), "issue", deliveryId);
                return new IssuePayload(issue.number(), issue.title(), issue.body());
            }
            case ISSUE_COMMENT_CREATED -> {
                WebhookPayload.Issue issue = require(payload.issue(), "issue", deliveryId);
                WebhookPayload.Comment comment = require(payload.comment(), "comment", deliveryId);
                return new CommentPayload(issue.number(), comment.id(), comment.body(), issue.isPullRequest());
            }
            case PULL_REQUEST_REVIEW_SUBMITTED -> {
                WebhookPayload.PullRequest pr = require(payload.pullRequest(), "pull_request", deliveryId);
                WebhookPayload.Review review = require(payload.review(), "review", deliveryId);
                return new CommentPayload(pr.number(), review.id(), review.body(), true);
            }
            default -> throw new IllegalArgumentException("No payload for " + kind);
        }
    }

    private static <T> T require(T section, String name, String deliveryId) {
        if (section == null) {
            throw new WebhookValidationException("Missing '" + name + "' in delivery " + deliveryId);
        }
        return section;
    }
}
