package com.channelcast.common.infra;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Exponential backoff computation and non-blocking delayed retries.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Runs a retry after a delay without holding a thread while it waits.
     * Swappable so tests can record delays instead of waiting them out.
     */
    @FunctionalInterface
    public interface Scheduler {

        Scheduler DELAYED = (delay, task, executor) ->
                CompletableFuture.delayedExecutor(millis(delay), TimeUnit.MILLISECONDS, executor).execute(task);

        /**
         * Hand {@code task} to {@code executor} once {@code delay} has passed.
         *
         * @throws java.util.concurrent.RejectedExecutionException if the task can no longer be accepted
         */
        void schedule(Duration delay, Runnable task, Executor executor);
    }

    /**
     * Delay inserted before retry {@code attempt}: {@code baseSec * 2^(attempt-1)}.
     *
     * @param baseSec base backoff in seconds
     * @param attempt 1-based retry number (the first attempt is 0 and never waits)
     * @return the delay; zero for {@code attempt <= 0} or {@code baseSec <= 0}
     */
    public static Duration exponential(long baseSec, int attempt) {
        if (attempt <= 0 || baseSec <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(attempt - 1, 30);
        return Duration.ofSeconds(baseSec * (1L << shift));
    }

    static long millis(Duration delay) {
        if (delay == null || delay.isNegative()) {
            return 0;
        }
        return delay.toMillis();
    }
}
