package dev.repowarden.planner;

import dev.repowarden.classifier.review.PullRequestSummaryClassifier;
import dev.repowarden.classifier.review.Requirement;
import dev.repowarden.classifier.security.SecurityRule;
import dev.repowarden.classifier.triage.IssueTemplateClassifier;
import dev.repowarden.domain.enums.CommandName;
import dev.repowarden.domain.enums.Severity;
import dev.repowarden.domain.valueobject.Finding;
import dev.repowarden.domain.valueobject.MergedPullRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Comment bodies posted by the bot. All text is deterministic given its inputs.
 */
final class ResponseTemplates {

    static final List<String> JOKES = List.of(
            "Why do programmers prefer dark mode? Because light attracts bugs! 🐛",
            "How many programmers does it take to change a light bulb? None, that's a hardware problem! 💡",
            "Why do Java developers wear glasses? Because they don't C# 👓",
            "There are only 10 types of people: those who understand binary and those who don't 🤖",
            "A SQL query goes into a bar, walks up to two tables and asks: 'Can I join you?' 🍺",
            "Why did the programmer quit his job? He didn't get arrays! 📊");

    static final List<String> QUOTES = List.of(
            "Code is like humor. When you have to explain it, it's bad. 💭",
            "First, solve the problem. Then, write the code. 🎯",
            "The best error message is the one that never shows up. ✨",
            "Programming isn't about what you know; it's about what you can figure out. 🧠",
            "Clean code always looks like it was written by someone who cares. 💎",
            "Any fool can write code that a computer can understand. Good programmers write code that humans can understand. 👥");

    private ResponseTemplates() {}

    static String help() {
        StringBuilder sb = new StringBuilder("🤖 **Available Commands:**\n\n");
        for (CommandName name : CommandName.values()) {
            sb.append("- `").append(name.usage()).append("` - ").append(name.description()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    static String welcome(String author, String repository) {
        String project = repository.substring(repository.indexOf('/') + 1);
        return """
                🎉 Welcome @%s! Thanks for your first contribution to %s!

                📋 **Quick checklist:**
                - [ ] Tests added/updated
                - [ ] Documentation updated
                - [ ] Code follows project style

                💡 Use `/help` to see available commands.

                Thanks for making this project better! 🚀
                %s""".formatted(author, project, CommentMarkers.WELCOME);
    }

    static String mergedThanks(String author) {
        return "🎉 Thanks @" + author + "! Your contribution has been merged. Great work! 🚀\n"
                + CommentMarkers.MERGED_THANKS;
    }

    /** Findings must all be SECURITY findings, already in canonical order. */
    static String securityReport(List<Finding> findings) {
        StringBuilder sb = new StringBuilder("🔒 **Security Scan Results:**\n\n");
        for (Finding finding : findings) {
            String emoji = finding.severity() == Severity.CRITICAL ? "🚨" : "⚠️";
            sb.append(emoji).append(" **").append(SecurityRule.fromTag(finding.value()).title()).append("**");
            if (finding.evidence() != null) {
                sb.append(" in ").append(location(finding.evidence()));
            }
            sb.append('\n');
        }
        sb.append("\n💡 Please review these potential security issues before merging.");
        return sb.toString();
    }

    /**
     * @param summary   SUMMARY findings in canonical order
     * @param languages LANGUAGE findings in canonical order
     */
    static String pullRequestSummary(List<Finding> summary, List<Finding> languages) {
        StringBuilder sb = new StringBuilder("📊 **PR Analysis:**\n\n");
        List<String> breaking = new ArrayList<>();
        for (Finding finding : summary) {
            if (finding.value().startsWith(PullRequestSummaryClassifier.COMPLEXITY_PREFIX)) {
                String level = finding.value().substring(PullRequestSummaryClassifier.COMPLEXITY_PREFIX.length());
                sb.append("- **Complexity:** ").append(capitalize(level))
                        .append(" (").append(finding.evidence()).append(")\n");
            } else if (finding.value().startsWith(PullRequestSummaryClassifier.BREAKING_PREFIX)) {
                breaking.add("`" + finding.value().substring(PullRequestSummaryClassifier.BREAKING_PREFIX.length()) + "`");
            }
        }
        if (!breaking.isEmpty()) {
            sb.append("- ⚠️ **Potential breaking changes in:** ").append(firstThree(breaking)).append('\n');
        }
        if (!languages.isEmpty()) {
            sb.append("- **Languages:** ")
                    .append(languages.stream().map(Finding::value).collect(Collectors.joining(", ")))
                    .append('\n');
        }
        return sb.toString().stripTrailing();
    }

    /** Findings must all be REQUIREMENT findings; advice follows {@link Requirement} order. */
    static String requirementsReview(List<Finding> requirements) {
        List<String> items = new ArrayList<>();
        for (Requirement requirement : Requirement.values()) {
            List<String> evidence = requirements.stream()
                    .filter(f -> f.value().equals(requirement.tag()))
                    .map(Finding::evidence)
                    .toList();
            if (evidence.isEmpty()) continue;
            items.add(requirement == Requirement.LARGE_FILE
                    ? requirement.advice(firstThree(evidence))
                    : requirement.advice());
        }
        return "🤖 **Automated PR Review:**\n\n" + items.stream()
                .map(item -> "- " + item)
                .collect(Collectors.joining("\n"));
    }

    static String issueSuggestions(List<Finding> suggestions) {
        return "📝 **Suggestions to improve this issue:**\n\n" + suggestions.stream()
                .map(f -> "- " + IssueTemplateClassifier.Suggestion.fromTag(f.value()).text())
                .collect(Collectors.joining("\n"));
    }

    static String changelog(List<MergedPullRequest> merged) {
        if (merged.isEmpty()) {
            return "# Recent Changes\n\nNo merged pull requests yet.";
        }
        StringBuilder sb = new StringBuilder("# Recent Changes\n\n");
        for (MergedPullRequest pr : merged) {
            sb.append("- ").append(pr.title()).append(" (#").append(pr.number()).append(") by @")
                    .append(pr.author()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    static String closed(String invoker) {
        return "🔒 Closed by @" + invoker;
    }

    static String reopened(String invoker) {
        return "🔓 Reopened by @" + invoker;
    }

    static String assigned(String login) {
        return "✅ Assigned to @" + login;
    }

    static String joke(long seed) {
        return "😄 " + pick(JOKES, seed);
    }

    static String motivation(long seed) {
        return "💪 " + pick(QUOTES, seed);
    }

    static String unknownCommand(String rawName) {
        return "🤔 Unknown command `/" + rawName + "`. Use `/help` to see available commands.";
    }

    static String usage(CommandName name) {
        return "⚠️ Usage: `" + name.usage() + "`. Use `/help` to see available commands.";
    }

    static String withReplyMarker(String body, long sourceCommentId) {
        return body + "\n" + CommentMarkers.replyTo(sourceCommentId);
    }

    private static String firstThree(List<String> items) {
        String shown = String.join(", ", items.subList(0, Math.min(3, items.size())));
        return items.size() > 3 ? shown + " and " + (items.size() - 3) + " more" : shown;
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    private static String pick(List<String> pool, long seed) {
        return pool.get((int) Math.floorMod(seed, (long) pool.size()));
    }

    // "src/app.py:12" -> "`src/app.py` (line 12)"
    private static String location(String evidence) {
        int colon = evidence.lastIndexOf(':');
        if (colon < 0) return "`" + evidence + "`";
        return "`" + evidence.substring(0, colon) + "` (line " + evidence.substring(colon + 1) + ")";
    }
}
