package dev.repowarden.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The subset of GitHub webhook payloads the app reads. Which sections are present
 * depends on the event type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookPayload(
        String action,
        @JsonProperty("pull_request") PullRequest pullRequest,
        Issue issue,
        Comment comment,
        Review review,
        Repository repository,
        Installation installation,
        User sender
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequest(int number, String title, Head head, User user, boolean merged) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Head(String sha, String ref) {}

    /** {@code pullRequest} is only present when the issue is a pull request. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Issue(int number, String title, String body, User user,
                        @JsonProperty("pull_request") Object pullRequest) {
        public boolean isPullRequest() {
            return pullRequest != null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Comment(long id, String body, User user) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Review(long id, String body, String state, User user) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(@JsonProperty("full_name") String fullName) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Installation(long id) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(String login, String type) {
        public boolean isBot() {
            return "Bot".equals(type) || (login != null && login.endsWith("[bot]"));
        }
    }
}
