package com.channelcast.gateway.cron;

/**
 * A pending one-shot timer.
 */
@FunctionalInterface
public interface TimerHandle {

    /**
     * Prevent the task from starting. A task already running is not interrupted.
     */
    void cancel();
}
