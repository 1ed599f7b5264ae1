package com.channelcast.gateway.cron;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TriggerTimers} on a small daemon {@link ScheduledThreadPoolExecutor}.
 */
public class ExecutorTriggerTimers implements TriggerTimers {

    private final ScheduledThreadPoolExecutor executor;
    private final Clock clock;

    public ExecutorTriggerTimers(int threads) {
        this(threads, Clock.systemUTC());
    }

    public ExecutorTriggerTimers(int threads, Clock clock) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "channelcast-cron-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.clock = clock;
    }

    @Override
    public TimerHandle schedule(Instant at, Runnable task) {
        long delayMs = Math.max(0, Duration.between(clock.instant(), at).toMillis());
        ScheduledFuture<?> future = executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }
}
