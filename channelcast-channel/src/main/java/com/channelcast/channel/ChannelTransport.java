package com.channelcast.channel;

/**
 * Message-send primitive for one external channel type.
 * <p>
 * Called once per delivery attempt. Implementations own their network
 * timeouts; a timeout must surface as a {@link ChannelDeliveryException} so it
 * counts against the caller's retry budget.
 */
@FunctionalInterface
public interface ChannelTransport {

    /**
     * Post {@code text} to {@code channelId}.
     *
     * @return the channel-assigned message reference
     * @throws ChannelDeliveryException if the channel rejected or never received the message
     */
    String send(String channelId, String text) throws ChannelDeliveryException;
}
