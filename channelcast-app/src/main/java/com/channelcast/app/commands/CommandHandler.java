package com.channelcast.app.commands;

/**
 * Handles one slash command.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * @param args text after the command name, trimmed; empty when none
     */
    CommandResult handle(String args, CommandContext ctx);
}
