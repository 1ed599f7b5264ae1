package com.channelcast.channel;

/**
 * A single send attempt to a channel failed.
 */
public class ChannelDeliveryException extends Exception {

    private final String channelId;
    private final long retryAfterMs;

    public ChannelDeliveryException(String channelId, String message) {
        this(channelId, message, -1, null);
    }

    public ChannelDeliveryException(String channelId, String message, Throwable cause) {
        this(channelId, message, -1, cause);
    }

    public ChannelDeliveryException(String channelId, String message, long retryAfterMs, Throwable cause) {
        super(message, cause);
        this.channelId = channelId;
        this.retryAfterMs = retryAfterMs;
    }

    public String getChannelId() {
        return channelId;
    }

    /**
     * Server-suggested wait before retrying in ms, or {@code -1} if none was given.
     */
    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
