package com.channelcast.app.commands;

/**
 * Reply produced by a command handler.
 */
public record CommandResult(String text, boolean error) {

    public static CommandResult text(String text) {
        return new CommandResult(text, false);
    }

    public static CommandResult error(String text) {
        return new CommandResult(text, true);
    }
}
