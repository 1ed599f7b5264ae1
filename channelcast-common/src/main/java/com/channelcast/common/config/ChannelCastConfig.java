package com.channelcast.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for ChannelCast.
 * Loaded from {@code ~/.channelcast/config.json} by {@link ConfigService}.
 */
@Data
public class ChannelCastConfig {

    /** Telegram Bot API settings. */
    private TelegramConfig telegram = new TelegramConfig();

    /** Default target channels. */
    private ChannelsConfig channels = new ChannelsConfig();

    /** Job scheduler settings. */
    private SchedulerConfig scheduler = new SchedulerConfig();

    /** Fan-out delivery settings. */
    private DeliveryConfig delivery = new DeliveryConfig();

    /** Delivery audit settings. */
    private AuditConfig audit = new AuditConfig();

    /** Operator command surface. */
    private AdminConfig admin = new AdminConfig();

    // --- Nested config types ---

    @Data
    public static class TelegramConfig {
        private String botToken;
        private String apiBaseUrl = "https://api.telegram.org";
        /** "Markdown", "MarkdownV2", "HTML" or empty for plain text. */
        private String parseMode = "Markdown";
        private int timeoutSeconds = 30;
    }

    @Data
    public static class ChannelsConfig {
        /** Channels used by jobs that do not name their own. */
        private List<String> defaultIds = new ArrayList<>();
    }

    @Data
    public static class SchedulerConfig {
        private boolean enabled = true;
        private int threads = 2;
        private String defaultTimezone = "Europe/London";
        /** Directory holding jobs.json and deliveries.jsonl; "~" is expanded. */
        private String dataDir = "~/.channelcast";
        /** Footer appended to job content when the job asks for it. */
        private String footer;
        /** Classpath resource with the bulk seed jobs. */
        private String seedResource = "job-seeds.json";
    }

    @Data
    public static class DeliveryConfig {
        private int maxConcurrency = 8;
        private int defaultRetries = 2;
        private int defaultBackoffSec = 30;
    }

    @Data
    public static class AuditConfig {
        /** "exact" (content hash) or "prefix" (leading characters). */
        private String identity = "exact";
        private int prefixLength = 100;
        /** Channels every broadcast is expected to reach; defaults to channels.defaultIds. */
        private List<String> expectedChannels = new ArrayList<>();
    }

    @Data
    public static class AdminConfig {
        /** Shared secret for the admin command endpoint; empty disables the check. */
        private String token;
        /** Sender ids allowed to run commands; empty or "*" allows everyone. */
        private List<String> allowFrom = new ArrayList<>();
    }
}
