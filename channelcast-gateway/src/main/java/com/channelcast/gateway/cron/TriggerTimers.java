package com.channelcast.gateway.cron;

import java.time.Instant;

/**
 * One-shot timer service plus the clock it runs on.
 */
public interface TriggerTimers {

    /**
     * Run {@code task} once at {@code at}, or as soon as possible if that is
     * already in the past.
     */
    TimerHandle schedule(Instant at, Runnable task);

    Instant now();

    /**
     * Drop pending timers and release threads.
     */
    void shutdown();
}
