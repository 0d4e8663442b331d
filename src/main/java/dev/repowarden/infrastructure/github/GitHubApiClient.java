package dev.repowarden.infrastructure.github;

import com.fasterxml.jackson.databind.JsonNode;
import dev.repowarden.config.GitHubProperties;
import dev.repowarden.domain.enums.IssueState;
import dev.repowarden.domain.valueobject.ChangedFile;
import dev.repowarden.domain.valueobject.MergedPullRequest;
import dev.repowarden.domain.valueobject.StatusCheck;
import dev.repowarden.exception.PlatformException;
import dev.repowarden.platform.EffectResult;
import dev.repowarden.platform.EffectStatus;
import dev.repowarden.platform.PlatformTarget;
import dev.repowarden.platform.RepositoryPlatform;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * GitHub REST implementation of {@link RepositoryPlatform}, with circuit breaker and rate limiting.
 *
 * <p>Every write first reads the current state, so asking for something that already
 * holds returns UNCHANGED without a write. Batched writes go out one item per request
 * so a single rejected login or label does not fail its neighbours.
 */
@Component
public class GitHubApiClient implements RepositoryPlatform {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);

    private static final int PER_PAGE = 100;
    private static final int MAX_PAGES = 10;

    private final WebClient webClient;
    private final GitHubTokenProvider tokenProvider;

    public GitHubApiClient(WebClient.Builder builder, GitHubTokenProvider tokenProvider, GitHubProperties properties) {
        this.tokenProvider = tokenProvider;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.responseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis());
        this.webClient = builder.clone().baseUrl(properties.apiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }

    // ---- reads ----

    @Override
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public List<ChangedFile> fetchChangedFiles(PlatformTarget pr) {
        List<ChangedFile> files = new ArrayList<>();
        for (int page = 1; page <= MAX_PAGES; page++) {
            JsonNode batch = get("List files of " + pr.repository() + "#" + pr.number(), pr,
                    "/repos/{owner}/{repo}/pulls/{number}/files?per_page={perPage}&page={page}",
                    pr.owner(), pr.name(), pr.number(), PER_PAGE, page);
            if (batch == null || batch.isEmpty()) break;
            for (JsonNode f : batch) {
                files.add(ChangedFile.fromPatch(f.path("filename").asText(),
                        f.path("additions").asInt(), f.path("deletions").asInt(),
                        f.hasNonNull("patch") ? f.get("patch").asText() : null));
            }
            if (batch.size() < PER_PAGE) break;
        }
        if (files.size() >= PER_PAGE * MAX_PAGES) {
            log.warn("{}#{} has {}+ files, classification may be incomplete", pr.repository(), pr.number(), files.size());
        }
        return files;
    }

    @Override
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public boolean fetchPriorContribution(String actor, PlatformTarget target) {
        String query = "repo:" + target.repository() + " is:pr is:merged author:" + actor;
        JsonNode result = get("Search merged PRs by " + actor, target,
                "/search/issues?q={q}&per_page=1", query);
        return result != null && result.path("total_count").asInt() > 0;
    }

    @Override
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public boolean hasBotComment(PlatformTarget target, String marker) {
        String self = tokenProvider.appLogin();
        for (int page = 1; page <= MAX_PAGES; page++) {
            JsonNode comments = get("List comments of " + target.repository() + "#" + target.number(), target,
                    "/repos/{owner}/{repo}/issues/{number}/comments?per_page={perPage}&page={page}",
                    target.owner(), target.name(), target.number(), PER_PAGE, page);
            if (comments == null || comments.isEmpty()) return false;
            for (JsonNode c : comments) {
                boolean ours = self.equalsIgnoreCase(c.path("user").path("login").asText());
                if (ours && c.path("body").asText().contains(marker)) return true;
            }
            if (comments.size() < PER_PAGE) return false;
        }
        return false;
    }

    @Override
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public List<MergedPullRequest> fetchRecentMergedPullRequests(PlatformTarget target, int limit) {
        JsonNode pulls = get("List closed PRs of " + target.repository(), target,
                "/repos/{owner}/{repo}/pulls?state=closed&sort=updated&direction=desc&per_page={perPage}",
                target.owner(), target.name(), Math.min(PER_PAGE, limit * 3));
        List<MergedPullRequest> merged = new ArrayList<>();
        if (pulls == null) return merged;
        for (JsonNode pr : pulls) {
            if (!pr.hasNonNull("merged_at")) continue;
            merged.add(new MergedPullRequest(pr.path("number").asInt(), pr.path("title").asText(),
                    pr.path("user").path("login").asText(), Instant.parse(pr.get("merged_at").asText())));
        }
        return merged.stream()
                .sorted(Comparator.comparing(MergedPullRequest::mergedAt).reversed()
                        .thenComparing(MergedPullRequest::number, Comparator.reverseOrder()))
                .limit(limit)
                .toList();
    }

    // ---- batched writes ----

    @Override
    @RateLimiter(name = "github-api")
    public Map<String, EffectResult> applyLabels(PlatformTarget target, Set<String> add, Set<String> remove) {
        Map<String, EffectResult> results = new LinkedHashMap<>();
        Set<String> current;
        try {
            current = lowerCase(names(get("List labels of " + target.repository() + "#" + target.number(), target,
                    "/repos/{owner}/{repo}/issues/{number}/labels?per_page={perPage}",
                    target.owner(), target.name(), target.number(), PER_PAGE), "name"));
        } catch (PlatformException e) {
            add.forEach(l -> results.put(l, EffectResult.failed(e)));
            remove.forEach(l -> results.put(l, EffectResult.failed(e)));
            return results;
        }

        for (String label : remove) {
            if (!current.contains(label.toLowerCase(Locale.ROOT))) {
                results.put(label, EffectResult.unchanged("label not present"));
                continue;
            }
            results.put(label, write(() -> send("Remove label " + label, target, token -> webClient.delete()
                    .uri("/repos/{owner}/{repo}/issues/{number}/labels/{name}",
                            target.owner(), target.name(), target.number(), label)
                    .headers(h -> h.setBearerAuth(token))
                    .retrieve().toBodilessEntity().block()), "label not present"));
        }
        for (String label : add) {
            if (current.contains(label.toLowerCase(Locale.ROOT))) {
                results.put(label, EffectResult.unchanged("label already present"));
                continue;
            }
            results.put(label, write(() -> send("Add label " + label, target, token -> webClient.post()
                    .uri("/repos/{owner}/{repo}/issues/{number}/labels",
                            target.owner(), target.name(), target.number())
                    .headers(h -> h.setBearerAuth(token))
                    .bodyValue(Map.of("labels", List.of(label)))
                    .retrieve().toBodilessEntity().block()), null));
        }
        return results;
    }

    /** Logins containing "/" are requested as teams ("org/team-slug"). */
    @Override
    @RateLimiter(name = "github-api")
    public Map<String, EffectResult> requestReviewers(PlatformTarget pr, Set<String> reviewers) {
        Map<String, EffectResult> results = new LinkedHashMap<>();
        Set<String> requested;
        try {
            JsonNode current = get("List requested reviewers of " + pr.repository() + "#" + pr.number(), pr,
                    "/repos/{owner}/{repo}/pulls/{number}/requested_reviewers",
                    pr.owner(), pr.name(), pr.number());
            requested = lowerCase(names(current == null ? null : current.path("users"), "login"));
            requested.addAll(lowerCase(names(current == null ? null : current.path("teams"), "slug")));
        } catch (PlatformException e) {
            reviewers.forEach(r -> results.put(r, EffectResult.failed(e)));
            return results;
        }

        for (String reviewer : reviewers) {
            boolean team = reviewer.contains("/");
            String id = team ? reviewer.substring(reviewer.indexOf('/') + 1) : reviewer;
            if (requested.contains(id.toLowerCase(Locale.ROOT))) {
                results.put(reviewer, EffectResult.unchanged("reviewer already requested"));
                continue;
            }
            Map<String, List<String>> body = Map.of(team ? "team_reviewers" : "reviewers", List.of(id));
            results.put(reviewer, write(() -> send("Request reviewer " + reviewer, pr, token -> webClient.post()
                    .uri("/repos/{owner}/{repo}/pulls/{number}/requested_reviewers",
                            pr.owner(), pr.name(), pr.number())
                    .headers(h -> h.setBearerAuth(token))
                    .bodyValue(body)
                    .retrieve().toBodilessEntity().block()), null));
        }
        return results;
    }

    @Override
    @RateLimiter(name = "github-api")
    public Map<String, EffectResult> addAssignees(PlatformTarget target, Set<String> assignees) {
        Map<String, EffectResult> results = new LinkedHashMap<>();
        Set<String> assigned;
        try {
            JsonNode issue = getIssue(target);
            assigned = lowerCase(names(issue == null ? null : issue.path("assignees"), "login"));
        } catch (PlatformException e) {
            assignees.forEach(a -> results.put(a, EffectResult.failed(e)));
            return results;
        }

        for (String login : assignees) {
            if (assigned.contains(login.toLowerCase(Locale.ROOT))) {
                results.put(login, EffectResult.unchanged("already assigned"));
                continue;
            }
            results.put(login, write(() -> send("Assign " + login, target, token -> webClient.post()
                    .uri("/repos/{owner}/{repo}/issues/{number}/assignees",
                            target.owner(), target.name(), target.number())
                    .headers(h -> h.setBearerAuth(token))
                    .bodyValue(Map.of("assignees", List.of(login)))
                    .retrieve().toBodilessEntity().block()), null));
        }
        return results;
    }

    // ---- single writes ----

    @Override
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public EffectStatus postComment(PlatformTarget target, String body) {
        send("Post comment on " + target.repository() + "#" + target.number(), target, token -> webClient.post()
                .uri("/repos/{owner}/{repo}/issues/{number}/comments", target.owner(), target.name(), target.number())
                .headers(h -> h.setBearerAuth(token))
                .bodyValue(Map.of("body", body))
                .retrieve().toBodilessEntity().block());
        log.info("Comment posted on {}#{}", target.repository(), target.number());
        return EffectStatus.APPLIED;
    }

    @Override
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public EffectStatus setStatusCheck(PlatformTarget pr, StatusCheck check) {
        JsonNode statuses = get("List statuses of " + pr.headSha(), pr,
                "/repos/{owner}/{repo}/commits/{sha}/statuses?per_page={perPage}",
                pr.owner(), pr.name(), pr.headSha(), PER_PAGE);
        if (statuses != null) {
            for (JsonNode s : statuses) {
                if (!check.context().equals(s.path("context").asText())) continue;
                // newest first: only the latest status for the context counts
                boolean same = check.state().apiValue().equals(s.path("state").asText())
                        && check.description().equals(s.path("description").asText());
                if (same) return EffectStatus.UNCHANGED;
                break;
            }
        }
        send("Set status " + check.context(), pr, token -> webClient.post()
                .uri("/repos/{owner}/{repo}/statuses/{sha}", pr.owner(), pr.name(), pr.headSha())
                .headers(h -> h.setBearerAuth(token))
                .bodyValue(Map.of("state", check.state().apiValue(),
                        "context", check.context(),
                        "description", check.description()))
                .retrieve().toBodilessEntity().block());
        return EffectStatus.APPLIED;
    }

    @Override
    @CircuitBreaker(name = "github-api")
    @RateLimiter(name = "github-api")
    public EffectStatus closeOrReopen(PlatformTarget target, IssueState state) {
        JsonNode issue = getIssue(target);
        if (issue != null && state.apiValue().equals(issue.path("state").asText())) {
            return EffectStatus.UNCHANGED;
        }
        send("Set state " + state.apiValue(), target, token -> webClient.patch()
                .uri("/repos/{owner}/{repo}/issues/{number}", target.owner(), target.name(), target.number())
                .headers(h -> h.setBearerAuth(token))
                .bodyValue(Map.of("state", state.apiValue()))
                .retrieve().toBodilessEntity().block());
        log.info("{}#{} is now {}", target.repository(), target.number(), state.apiValue());
        return EffectStatus.APPLIED;
    }

    // ---- plumbing ----

    private JsonNode getIssue(PlatformTarget target) {
        return get("Get " + target.repository() + "#" + target.number(), target,
                "/repos/{owner}/{repo}/issues/{number}", target.owner(), target.name(), target.number());
    }

    private JsonNode get(String operation, PlatformTarget target, String uriTemplate, Object... variables) {
        return send(operation, target, token -> webClient.get()
                .uri(uriTemplate, variables)
                .headers(h -> h.setBearerAuth(token))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block());
    }

    /** Runs one authenticated request, translating failures into platform exceptions. */
    private <T> T send(String operation, PlatformTarget target, Function<String, T> request) {
        String token = tokenProvider.getInstallationToken(target.installationId());
        try {
            return request.apply(token);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 401) {
                tokenProvider.evict(target.installationId());
            }
            throw GitHubErrors.translate(operation, e);
        } catch (RuntimeException e) {
            throw GitHubErrors.translate(operation, e);
        }
    }

    /**
     * @param notFoundMeans when set, a 404 counts as UNCHANGED with this reason
     */
    private static EffectResult write(Runnable call, String notFoundMeans) {
        try {
            call.run();
            return EffectResult.applied();
        } catch (PlatformException e) {
            if (notFoundMeans != null && e.getPlatformStatus() == 404) {
                return EffectResult.unchanged(notFoundMeans);
            }
            log.warn("{}", e.getMessage());
            return EffectResult.failed(e);
        }
    }

    private static List<String> names(JsonNode array, String field) {
        List<String> names = new ArrayList<>();
        if (array == null || !array.isArray()) return names;
        array.forEach(n -> names.add(n.path(field).asText()));
        return names;
    }

    private static Set<String> lowerCase(List<String> values) {
        Set<String> lowered = new HashSet<>();
        values.forEach(v -> lowered.add(v.toLowerCase(Locale.ROOT)));
        return lowered;
    }
}
