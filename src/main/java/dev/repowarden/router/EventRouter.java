package dev.repowarden.router;

import dev.repowarden.classifier.ClassificationInput;
import dev.repowarden.classifier.ClassificationResult;
import dev.repowarden.classifier.ClassifierRegistry;
import dev.repowarden.command.CommandParseResult;
import dev.repowarden.command.CommandParser;
import dev.repowarden.config.PipelineProperties;
import dev.repowarden.domain.enums.CommandName;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.event.CommentPayload;
import dev.repowarden.domain.event.PullRequestPayload;
import dev.repowarden.domain.event.RepositoryEvent;
import dev.repowarden.domain.valueobject.ChangedFile;
import dev.repowarden.domain.valueobject.Finding;
import dev.repowarden.domain.valueobject.MergedPullRequest;
import dev.repowarden.exception.PlatformException;
import dev.repowarden.planner.CommentMarkers;
import dev.repowarden.planner.PlanningContext;
import dev.repowarden.platform.PlatformTarget;
import dev.repowarden.platform.RepositoryPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides which path an event takes and gathers the platform facts that path needs.
 *
 * <p>Pull request changes go through the classifiers, issues through keyword triage,
 * and comments or reviews through the command parser. Events from bot accounts
 * are dropped so the app never answers itself.
 */
@Component
public class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final RepositoryPlatform platform;
    private final ClassifierRegistry classifierRegistry;
    private final CommandParser commandParser;
    private final PipelineProperties pipelineProperties;

    public EventRouter(RepositoryPlatform platform, ClassifierRegistry classifierRegistry,
                       CommandParser commandParser, PipelineProperties pipelineProperties) {
        this.platform = platform;
        this.classifierRegistry = classifierRegistry;
        this.commandParser = commandParser;
        this.pipelineProperties = pipelineProperties;
    }

    public RouterResult route(RepositoryEvent event) {
        if (fromBot(event)) {
            return skip(event, "actor is a bot");
        }
        try {
            return switch (event.kind()) {
                case PULL_REQUEST_OPENED, PULL_REQUEST_UPDATED -> routePullRequest(event);
                case PULL_REQUEST_MERGED -> new RouterResult.Classified(List.of(),
                        PlanningContext.forIssue(event.kind(), event.repository(), mergedAuthor(event)),
                        PlatformTarget.of(event));
                case ISSUE_OPENED -> routeIssue(event);
                case ISSUE_COMMENT_CREATED, PULL_REQUEST_REVIEW_SUBMITTED -> routeComment(event);
                case UNSUPPORTED -> skip(event, "unsupported event");
            };
        } catch (PlatformException e) {
            log.warn("Could not gather inputs for delivery {}: {}", event.deliveryId(), e.getMessage());
            return new RouterResult.Skipped("platform unavailable: " + e.getMessage());
        }
    }

    private RouterResult routePullRequest(RepositoryEvent event) {
        PlatformTarget target = PlatformTarget.of(event);
        List<ChangedFile> files = platform.fetchChangedFiles(target);
        ClassificationResult classification = classifierRegistry.classify(new ClassificationInput(event, files));
        List<Finding> findings = classification.findings();

        boolean firstTime = false;
        boolean welcomed = false;
        if (pipelineProperties.welcomeNewContributors()) {
            firstTime = !platform.fetchPriorContribution(event.actor(), target);
            welcomed = firstTime && platform.hasBotComment(target, CommentMarkers.WELCOME);
        }

        log.info("Classified {} on {}#{}: {} file(s), {} finding(s)",
                event.kind(), event.repository(), event.number(), files.size(), findings.size());
        PlanningContext context = new PlanningContext(event.kind(), event.repository(), event.actor(),
                classification.completed(), firstTime, welcomed, 0L, List.of());
        return new RouterResult.Classified(findings, context, target);
    }

    private RouterResult routeIssue(RepositoryEvent event) {
        List<Finding> findings = classifierRegistry.classify(ClassificationInput.ofIssue(event)).findings();
        log.info("Triaged issue {}#{}: {} finding(s)", event.repository(), event.number(), findings.size());
        return new RouterResult.Classified(findings,
                PlanningContext.forIssue(event.kind(), event.repository(), event.actor()),
                PlatformTarget.of(event));
    }

    private RouterResult routeComment(RepositoryEvent event) {
        CommentPayload comment = event.comment().orElse(null);
        if (comment == null || comment.body() == null || comment.body().isBlank()) {
            return skip(event, "no comment body");
        }
        CommandParseResult parse = commandParser.parseDetailed(comment.body(), event.actor());
        if (!parse.isAddressed()) {
            return skip(event, "no command");
        }

        PlatformTarget target = PlatformTarget.of(event);
        List<MergedPullRequest> merged = List.of();
        if (parse.attempted() == CommandName.CHANGELOG && parse.command() != null) {
            merged = platform.fetchRecentMergedPullRequests(target, pipelineProperties.changelogSize());
        }
        log.info("Command on {}#{}: {} ({})", event.repository(), event.number(), parse.rawName(), parse.status());
        return new RouterResult.Commanded(parse,
                PlanningContext.forCommand(event.kind(), event.repository(), event.actor(),
                        comment.commentId(), merged),
                target);
    }

    // a merge is thanked by its author, whoever pressed the button
    private static boolean fromBot(RepositoryEvent event) {
        if (event.kind() == EventKind.PULL_REQUEST_MERGED) {
            return event.pullRequest().map(PullRequestPayload::authorIsBot).orElse(event.actorIsBot());
        }
        return event.actorIsBot();
    }

    private static String mergedAuthor(RepositoryEvent event) {
        return event.pullRequest().map(PullRequestPayload::author).orElse(event.actor());
    }

    private RouterResult skip(RepositoryEvent event, String reason) {
        log.debug("Skipping delivery {} ({}): {}", event.deliveryId(), event.kind(), reason);
        return new RouterResult.Skipped(reason);
    }
}
