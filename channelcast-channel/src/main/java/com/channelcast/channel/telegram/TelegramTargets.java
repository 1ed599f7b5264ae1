package com.channelcast.channel.telegram;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Telegram chat id normalization.
 */
public final class TelegramTargets {

    private TelegramTargets() {
    }

    private static final Pattern TG_PREFIX = Pattern.compile("^(telegram|tg):", Pattern.CASE_INSENSITIVE);
    private static final Pattern TME_URL = Pattern.compile(
            "^https?://t\\.me/([a-zA-Z0-9_]+)(?:/.*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_ID = Pattern.compile("^-?\\d+$");
    private static final Pattern BARE_USERNAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]{4,}$");

    /**
     * Strip internal Telegram prefixes (telegram:, tg:).
     */
    public static String stripInternalPrefixes(String to) {
        String trimmed = to.trim();
        while (TG_PREFIX.matcher(trimmed).find()) {
            trimmed = TG_PREFIX.matcher(trimmed).replaceFirst("").trim();
        }
        return trimmed;
    }

    /**
     * Normalize a Telegram chat id from the formats operators type: @username,
     * t.me URLs, numeric ids (including -100 supergroup ids), bare usernames and
     * internal prefixes.
     */
    public static String normalizeChatId(String to) {
        if (to == null) {
            throw new IllegalArgumentException("Telegram chat id is required");
        }
        String stripped = stripInternalPrefixes(to);
        if (stripped.isEmpty()) {
            throw new IllegalArgumentException("Telegram chat id is required");
        }

        Matcher tmeMatch = TME_URL.matcher(stripped);
        if (tmeMatch.matches()) {
            return "@" + tmeMatch.group(1);
        }
        if (stripped.startsWith("@") || NUMERIC_ID.matcher(stripped).matches()) {
            return stripped;
        }
        if (BARE_USERNAME.matcher(stripped).matches()) {
            return "@" + stripped;
        }
        return stripped;
    }
}
