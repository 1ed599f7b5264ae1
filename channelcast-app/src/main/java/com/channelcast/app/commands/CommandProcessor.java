package com.channelcast.app.commands;

import com.channelcast.common.config.ChannelCastConfig;
import com.channelcast.common.config.ConfigService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Routes operator slash commands to their handlers.
 * <p>
 * Every command except /help requires an authorized sender. Handler
 * exceptions become error replies.
 */
@Slf4j
@Component
public class CommandProcessor {

    private static final Set<String> PUBLIC_COMMANDS = Set.of("help");

    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();
    private final ConfigService configService;

    public CommandProcessor(ConfigService configService, InfoCommands infoCommands,
            JobCommands jobCommands, DeliveryCommands deliveryCommands) {
        this.configService = configService;

        handlers.put("help", infoCommands::handleHelp);

        handlers.put("job_create", jobCommands::handleCreate);
        handlers.put("job_list", jobCommands::handleList);
        handlers.put("job_pause", jobCommands::handlePause);
        handlers.put("job_resume", jobCommands::handleResume);
        handlers.put("job_reschedule", jobCommands::handleReschedule);
        handlers.put("job_run", jobCommands::handleRun);
        handlers.put("job_remove", jobCommands::handleRemove);
        handlers.put("seed_jobs", jobCommands::handleSeed);
        handlers.put("clear_jobs", jobCommands::handleClear);
        handlers.put("clear_jobs_confirm", jobCommands::handleClearConfirm);

        handlers.put("check_delivery", deliveryCommands::handleCheck);
        handlers.put("verify_delivery", deliveryCommands::handleVerify);
        handlers.put("verify_multichannel", deliveryCommands::handleVerifyMultichannel);
        handlers.put("delivery_report", deliveryCommands::handleReport);
    }

    /**
     * Handle a slash command with the current config.
     *
     * @return the reply, or {@code null} if the text is not a known command
     */
    public CommandResult handleCommand(String command, String senderId) {
        return handleCommand(command, senderId, configService.loadConfig());
    }

    /**
     * @param command  full command text, e.g. {@code "/job_run a1b2c3d4"}
     * @param senderId operator id, may be {@code null}
     * @return the reply, or {@code null} if the text is not a known command
     */
    public CommandResult handleCommand(String command, String senderId, ChannelCastConfig config) {
        if (command == null || command.isBlank()) {
            return null;
        }
        String trimmed = command.trim();
        if (!trimmed.startsWith("/")) {
            return null;
        }

        String withoutSlash = trimmed.substring(1);
        int spaceIdx = withoutSlash.indexOf(' ');
        String name;
        String args;
        if (spaceIdx < 0) {
            name = withoutSlash.toLowerCase(Locale.ROOT);
            args = "";
        } else {
            name = withoutSlash.substring(0, spaceIdx).toLowerCase(Locale.ROOT);
            args = withoutSlash.substring(spaceIdx + 1).trim();
        }

        CommandHandler handler = handlers.get(name);
        if (handler == null) {
            log.debug("Unknown command: /{}", name);
            return null;
        }

        boolean isAuthorized = CommandAuthorization.isAuthorizedSender(senderId, config);
        if (!isAuthorized && !PUBLIC_COMMANDS.contains(name)) {
            return CommandResult.error("Unauthorized.");
        }
        try {
            return handler.handle(args, new CommandContext(senderId, config, isAuthorized));
        } catch (IllegalArgumentException e) {
            log.info("Command /{} rejected: {}", name, e.getMessage());
            return CommandResult.error("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            log.error("Command /{} failed: {}", name, e.getMessage(), e);
            return CommandResult.error("Command failed: " + e.getMessage());
        }
    }

    public Set<String> commandNames() {
        return handlers.keySet();
    }
}
