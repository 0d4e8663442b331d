package dev.repowarden.command;

import dev.repowarden.domain.enums.CommandName;
import dev.repowarden.domain.valueobject.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts a slash command from a comment body.
 *
 * <p>Grammar: the first line (outside fenced code blocks) whose first non-whitespace
 * character is {@code /}. The token right after the slash is the command name,
 * matched case-insensitively against {@link CommandName}; the remaining
 * whitespace-separated tokens are arguments. {@code assign} takes exactly one
 * {@code @login}, {@code label} exactly one bare label name.
 */
@Component
public class CommandParser {

    private static final Logger log = LoggerFactory.getLogger(CommandParser.class);

    private static final Pattern COMMAND_TOKEN = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");
    private static final Pattern MENTION = Pattern.compile("@[A-Za-z0-9](?:[A-Za-z0-9-]{0,38})");
    private static final Pattern LABEL_NAME = Pattern.compile("[\\p{L}\\p{N}_][\\p{L}\\p{N}_:./+-]*");
    private static final String FENCE = "```";

    public Optional<Command> parse(String body) {
        return parse(body, null);
    }

    public Optional<Command> parse(String body, String invoker) {
        return parseDetailed(body, invoker).asCommand();
    }

    public CommandParseResult parseDetailed(String body, String invoker) {
        if (body == null || body.isBlank()) return CommandParseResult.none();

        boolean inFence = false;
        for (String line : body.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.startsWith(FENCE)) {
                inFence = !inFence;
                continue;
            }
            if (inFence || !trimmed.startsWith("/")) continue;
            return parseLine(trimmed, invoker);
        }
        return CommandParseResult.none();
    }

    private CommandParseResult parseLine(String line, String invoker) {
        String[] tokens = line.substring(1).split("\\s+");
        String name = tokens[0];
        if (!COMMAND_TOKEN.matcher(name).matches()) {
            return CommandParseResult.none();
        }
        List<String> args = Arrays.asList(tokens).subList(1, tokens.length);

        Optional<CommandName> known = CommandName.lookup(name);
        if (known.isEmpty()) {
            log.debug("Unknown command /{} from {}", name, invoker);
            return CommandParseResult.unknown(name);
        }
        CommandName command = known.get();
        if (!argumentsValid(command, args)) {
            log.debug("Rejected /{} with args {} from {}", command.token(), args, invoker);
            return CommandParseResult.invalid(command);
        }
        return CommandParseResult.recognized(new Command(command, args, invoker));
    }

    private boolean argumentsValid(CommandName command, List<String> args) {
        return switch (command) {
            case ASSIGN -> args.size() == 1 && MENTION.matcher(args.get(0)).matches();
            case LABEL -> args.size() == 1 && LABEL_NAME.matcher(args.get(0)).matches();
            case HELP, CLOSE, REOPEN, CHANGELOG, JOKE, MOTIVATE -> true;
        };
    }
}
