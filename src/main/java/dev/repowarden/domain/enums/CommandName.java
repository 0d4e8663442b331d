package dev.repowarden.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The fixed slash-command registry. Names match case-insensitively.
 */
public enum CommandName {
    HELP("/help", "Show this command reference"),
    ASSIGN("/assign @user", "Assign the issue or pull request to a user"),
    LABEL("/label <name>", "Add a label"),
    CLOSE("/close", "Close the issue or pull request"),
    REOPEN("/reopen", "Reopen the issue or pull request"),
    CHANGELOG("/changelog", "List recently merged pull requests"),
    JOKE("/joke", "Random developer joke"),
    MOTIVATE("/motivate", "Motivational quote");

    private final String usage;
    private final String description;

    CommandName(String usage, String description) {
        this.usage = usage;
        this.description = description;
    }

    public String usage() { return usage; }

    public String description() { return description; }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CommandName> lookup(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        String normalized = token.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.token().equals(normalized))
                .findFirst();
    }
}
