package com.channelcast.app.commands;

import com.channelcast.common.config.ChannelCastConfig;

/**
 * Context passed to every command handler.
 *
 * @param senderId operator id as given by the caller, may be {@code null}
 * @param config   config as loaded for this command
 */
public record CommandContext(
        String senderId,
        ChannelCastConfig config,
        boolean isAuthorizedSender) {
}
