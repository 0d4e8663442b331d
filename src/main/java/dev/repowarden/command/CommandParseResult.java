package dev.repowarden.command;

import dev.repowarden.domain.enums.CommandName;
import dev.repowarden.domain.valueobject.Command;

import java.util.Optional;

/**
 * Detailed parser verdict. Only RECOGNIZED carries a {@link Command}; UNKNOWN and
 * INVALID_ARGUMENTS carry enough context to answer with a hint.
 */
public record CommandParseResult(Status status, Command command, String rawName, CommandName attempted) {

    public enum Status { NONE, UNKNOWN, INVALID_ARGUMENTS, RECOGNIZED }

    static CommandParseResult none() {
        return new CommandParseResult(Status.NONE, null, null, null);
    }

    static CommandParseResult unknown(String rawName) {
        return new CommandParseResult(Status.UNKNOWN, null, rawName, null);
    }

    static CommandParseResult invalid(CommandName attempted) {
        return new CommandParseResult(Status.INVALID_ARGUMENTS, null, attempted.token(), attempted);
    }

    static CommandParseResult recognized(Command command) {
        return new CommandParseResult(Status.RECOGNIZED, command, command.name().token(), command.name());
    }

    public Optional<Command> asCommand() {
        return Optional.ofNullable(command);
    }

    /** Whether the comment was addressed to the bot at all. */
    public boolean isAddressed() {
        return status != Status.NONE;
    }
}
