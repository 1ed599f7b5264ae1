package com.channelcast.gateway.outbound;

/**
 * States of one channel's delivery within a fan-out.
 *
 * <pre>
 *   PENDING → ATTEMPTING → SUCCEEDED
 *                 ↓   ↑
 *            BACKOFF_WAIT → … → EXHAUSTED
 * </pre>
 */
public enum DeliveryState {
    PENDING,
    ATTEMPTING,
    BACKOFF_WAIT,
    SUCCEEDED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
