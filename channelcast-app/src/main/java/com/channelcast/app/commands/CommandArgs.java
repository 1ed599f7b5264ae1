package com.channelcast.app.commands;

import java.util.Arrays;
import java.util.List;

/**
 * Argument parsing shared by command handlers.
 */
final class CommandArgs {

    static final String SEPARATOR = "||";

    private CommandArgs() {
    }

    /**
     * Split {@code "a || b || c"} into trimmed parts. Empty parts are kept so
     * positional arguments stay in place.
     */
    static List<String> splitParts(String args) {
        if (args == null || args.isBlank()) {
            return List.of();
        }
        return Arrays.stream(args.split("\\|\\|", -1))
                .map(String::trim)
                .toList();
    }

    /**
     * Leading whitespace-delimited integer of {@code args}, or {@code fallback}
     * when absent, unparsable or not positive.
     */
    static int leadingInt(String args, int fallback) {
        String first = firstToken(args);
        if (first.isEmpty()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(first);
            return value > 0 ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    static String firstToken(String args) {
        if (args == null || args.isBlank()) {
            return "";
        }
        return args.trim().split("\\s+")[0];
    }

    /** Second whitespace-delimited token, or {@code null}. */
    static String secondToken(String args) {
        if (args == null || args.isBlank()) {
            return null;
        }
        String[] tokens = args.trim().split("\\s+");
        return tokens.length > 1 ? tokens[1] : null;
    }
}
