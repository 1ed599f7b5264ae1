package com.channelcast.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches ChannelCast configuration.
 */
@Slf4j
public class ConfigService {

    public static final String CHANNEL_IDS_ENV = "CHANNELCAST_CHANNEL_IDS";
    public static final String BOT_TOKEN_ENV = "TELEGRAM_BOT_TOKEN";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(2);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, ChannelCastConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System.getenv());
    }

    public ConfigService(Path configPath, Duration cacheTtl, Map<String, String> env) {
        this.configPath = expandHome(configPath.toString());
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public ChannelCastConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ChannelCastConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private ChannelCastConfig doLoadConfig() {
        ChannelCastConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            config = new ChannelCastConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, ChannelCastConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}", configPath, e);
                config = new ChannelCastConfig();
            }
        }
        return applyDefaults(config);
    }

    /**
     * Fill sections missing from the file and pull channel ids and the bot
     * token from the environment when the file leaves them empty.
     */
    ChannelCastConfig applyDefaults(ChannelCastConfig config) {
        if (config.getTelegram() == null) {
            config.setTelegram(new ChannelCastConfig.TelegramConfig());
        }
        if (config.getChannels() == null) {
            config.setChannels(new ChannelCastConfig.ChannelsConfig());
        }
        if (config.getScheduler() == null) {
            config.setScheduler(new ChannelCastConfig.SchedulerConfig());
        }
        if (config.getDelivery() == null) {
            config.setDelivery(new ChannelCastConfig.DeliveryConfig());
        }
        if (config.getAudit() == null) {
            config.setAudit(new ChannelCastConfig.AuditConfig());
        }
        if (config.getAdmin() == null) {
            config.setAdmin(new ChannelCastConfig.AdminConfig());
        }

        List<String> ids = ChannelIdList.normalize(config.getChannels().getDefaultIds());
        if (ids.isEmpty()) {
            ids = ChannelIdList.parse(env.get(CHANNEL_IDS_ENV));
        }
        config.getChannels().setDefaultIds(ids);

        String token = config.getTelegram().getBotToken();
        if (token == null || token.isBlank()) {
            config.getTelegram().setBotToken(env.get(BOT_TOKEN_ENV));
        }
        return config;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Expand a leading "~" to the user home directory.
     */
    public static Path expandHome(String path) {
        if (path.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }
}
