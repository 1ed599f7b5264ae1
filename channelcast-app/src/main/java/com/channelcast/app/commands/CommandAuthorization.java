package com.channelcast.app.commands;

import com.channelcast.common.config.ChannelCastConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves sender authorization for operator commands.
 * <p>
 * An empty {@code admin.allowFrom} list, or one containing {@code "*"},
 * authorizes everyone. Otherwise the sender id must be listed.
 */
@Slf4j
public final class CommandAuthorization {

    private CommandAuthorization() {
    }

    public static boolean isAuthorizedSender(String senderId, ChannelCastConfig config) {
        List<String> allowList = resolveAllowList(config);
        if (allowList.isEmpty() || allowList.contains("*")) {
            return true;
        }
        if (senderId == null || senderId.isBlank()) {
            log.warn("No senderId provided but allowFrom is configured; denying access");
            return false;
        }
        boolean authorized = allowList.contains(senderId.trim());
        if (!authorized) {
            log.info("Sender {} is not in allowFrom (size={})", senderId.trim(), allowList.size());
        }
        return authorized;
    }

    static List<String> resolveAllowList(ChannelCastConfig config) {
        Set<String> merged = new LinkedHashSet<>();
        if (config != null && config.getAdmin() != null && config.getAdmin().getAllowFrom() != null) {
            for (String entry : config.getAdmin().getAllowFrom()) {
                String s = entry != null ? entry.trim() : "";
                if (!s.isEmpty()) {
                    merged.add(s);
                }
            }
        }
        return new ArrayList<>(merged);
    }
}
