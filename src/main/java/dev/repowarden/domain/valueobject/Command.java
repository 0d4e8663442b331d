package dev.repowarden.domain.valueobject;

import dev.repowarden.domain.enums.CommandName;

import java.util.List;

/**
 * A recognized slash command with its whitespace-delimited arguments.
 */
public record Command(CommandName name, List<String> args, String invoker) {
    public Command {
        if (name == null) throw new IllegalArgumentException("name required");
        args = args == null ? List.of() : List.copyOf(args);
    }

    public String firstArg() {
        return args.isEmpty() ? null : args.get(0);
    }
}
