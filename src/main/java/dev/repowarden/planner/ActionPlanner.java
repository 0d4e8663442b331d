package dev.repowarden.planner;

import dev.repowarden.classifier.security.SecurityRule;
import dev.repowarden.command.CommandParseResult;
import dev.repowarden.domain.enums.CheckState;
import dev.repowarden.domain.enums.EventKind;
import dev.repowarden.domain.enums.FindingCategory;
import dev.repowarden.domain.enums.IssueState;
import dev.repowarden.domain.enums.SizeBucket;
import dev.repowarden.domain.valueobject.ActionPlan;
import dev.repowarden.domain.valueobject.Command;
import dev.repowarden.domain.valueobject.Finding;
import dev.repowarden.domain.valueobject.StatusCheck;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns findings or a parsed command into an {@link ActionPlan}.
 *
 * <p>Planning is a pure function of its arguments. Anything that needs the
 * platform (prior contribution, existing welcome, merged history) arrives already
 * resolved in the {@link PlanningContext}. Findings are re-sorted before use, so
 * the input order never changes the plan.
 */
@Component
public class ActionPlanner {

    public static final String SECURITY_STATUS_CONTEXT = "security-scan";

    /**
     * @param command nullable; when present the findings are ignored
     */
    public ActionPlan plan(List<Finding> findings, Command command, PlanningContext context) {
        if (command != null) {
            return planCommand(command, context);
        }
        return planFindings(findings == null ? List.of() : findings, context);
    }

    /** Reply to a slash line that named an unknown command or had bad arguments. */
    public ActionPlan planHint(CommandParseResult result, PlanningContext context) {
        String body = switch (result.status()) {
            case UNKNOWN -> ResponseTemplates.unknownCommand(result.rawName());
            case INVALID_ARGUMENTS -> ResponseTemplates.usage(result.attempted());
            case NONE, RECOGNIZED -> null;
        };
        if (body == null) return ActionPlan.empty();
        return ActionPlan.builder()
                .comment(ResponseTemplates.withReplyMarker(body, context.sourceCommentId()))
                .build();
    }

    private ActionPlan planFindings(List<Finding> findings, PlanningContext context) {
        if (context.kind() == EventKind.PULL_REQUEST_MERGED) {
            return ActionPlan.builder()
                    .comment(ResponseTemplates.mergedThanks(context.actor()))
                    .build();
        }
        List<Finding> ordered = new ArrayList<>(findings);
        ordered.sort(Finding.ORDER);

        ActionPlan.Builder builder = ActionPlan.builder();
        for (Finding finding : ordered) {
            finding.label().ifPresent(builder::addLabel);
            if (finding.category() == FindingCategory.OWNERSHIP) {
                builder.requestReviewer(finding.value());
            }
        }
        List<Finding> security = ofCategory(ordered, FindingCategory.SECURITY);

        if (context.kind() == EventKind.ISSUE_OPENED) {
            List<Finding> suggestions = ofCategory(ordered, FindingCategory.SUGGESTION);
            if (!suggestions.isEmpty()) {
                builder.comment(ResponseTemplates.issueSuggestions(suggestions));
            }
        }

        if (context.kind().isPullRequestChange()) {
            if (context.sizeClassified()) {
                for (SizeBucket bucket : SizeBucket.values()) {
                    builder.removeLabel("size:" + bucket.tag());
                }
            }
            if (context.securityScanned()) {
                for (SecurityRule rule : SecurityRule.values()) {
                    builder.removeLabel("security:" + rule.tag());
                }
                builder.status(securityStatus(security));
            }

            List<String> sections = new ArrayList<>();
            if (context.shouldWelcome()) {
                sections.add(ResponseTemplates.welcome(context.actor(), context.repository()));
            }
            List<Finding> summary = ofCategory(ordered, FindingCategory.SUMMARY);
            if (!summary.isEmpty()) {
                sections.add(ResponseTemplates.pullRequestSummary(summary,
                        ofCategory(ordered, FindingCategory.LANGUAGE)));
            }
            List<Finding> requirements = ofCategory(ordered, FindingCategory.REQUIREMENT);
            if (!requirements.isEmpty()) {
                sections.add(ResponseTemplates.requirementsReview(requirements));
            }
            if (!security.isEmpty()) {
                sections.add(ResponseTemplates.securityReport(security));
            }
            if (!sections.isEmpty()) {
                builder.comment(String.join(CommentMarkers.SECTION_SEPARATOR, sections));
            }
        }
        return builder.build();
    }

    private static List<Finding> ofCategory(List<Finding> findings, FindingCategory category) {
        return findings.stream().filter(f -> f.category() == category).toList();
    }

    private StatusCheck securityStatus(List<Finding> security) {
        boolean critical = security.stream().anyMatch(Finding::isCriticalSecurity);
        if (critical) {
            return new StatusCheck(SECURITY_STATUS_CONTEXT, CheckState.FAILURE,
                    security.size() + " issue(s) found");
        }
        return new StatusCheck(SECURITY_STATUS_CONTEXT, CheckState.SUCCESS, "No issues found");
    }

    private ActionPlan planCommand(Command command, PlanningContext context) {
        ActionPlan.Builder builder = ActionPlan.builder();
        long seed = context.sourceCommentId();
        String body = switch (command.name()) {
            case HELP -> ResponseTemplates.help();
            case ASSIGN -> {
                String login = command.firstArg().substring(1);
                builder.addAssignee(login);
                yield ResponseTemplates.assigned(login);
            }
            case LABEL -> {
                builder.addLabel(command.firstArg());
                yield null;
            }
            case CLOSE -> {
                builder.issueState(IssueState.CLOSED);
                yield ResponseTemplates.closed(command.invoker());
            }
            case REOPEN -> {
                builder.issueState(IssueState.OPEN);
                yield ResponseTemplates.reopened(command.invoker());
            }
            case CHANGELOG -> ResponseTemplates.changelog(context.recentMerged());
            case JOKE -> ResponseTemplates.joke(seed);
            case MOTIVATE -> ResponseTemplates.motivation(seed);
        };
        if (body != null) {
            builder.comment(ResponseTemplates.withReplyMarker(body, seed));
        }
        return builder.build();
    }
}
