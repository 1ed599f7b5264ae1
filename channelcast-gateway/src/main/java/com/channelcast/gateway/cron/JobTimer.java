package com.channelcast.gateway.cron;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Self-rescheduling one-shot timer for one job.
 * <p>
 * The timer thread only hands the firing to the firing executor, so jobs due
 * at the same instant never queue behind each other's deliveries. The timer
 * re-arms once its firing completes, which keeps at most one firing per job in
 * flight. After each firing the next instant is computed strictly after
 * {@code max(trigger instant, now)}, so instants missed during a long firing
 * are dropped rather than replayed. Once cancelled the timer never re-arms.
 */
@Slf4j
final class JobTimer {

    private final String jobId;
    private final String cron;
    private final ZoneId zone;
    private final CronTrigger trigger;
    private final TriggerTimers timers;
    private final Executor firings;
    private final Consumer<Instant> onFire;
    private final Consumer<Instant> onArmed;

    private volatile boolean cancelled;
    private TimerHandle handle;
    private Instant nextRunAt;

    JobTimer(String jobId, String cron, ZoneId zone, CronTrigger trigger, TriggerTimers timers,
            Executor firings, Consumer<Instant> onFire, Consumer<Instant> onArmed) {
        this.jobId = jobId;
        this.cron = cron;
        this.zone = zone;
        this.trigger = trigger;
        this.timers = timers;
        this.firings = firings;
        this.onFire = onFire;
        this.onArmed = onArmed;
    }

    /**
     * Arm for the first trigger instant strictly after {@code from}.
     *
     * @return {@code false} if cancelled or the expression never fires again
     */
    synchronized boolean armAfter(Instant from) {
        if (cancelled) {
            return false;
        }
        Optional<Instant> next = trigger.nextTriggerAfter(cron, zone, from);
        if (next.isEmpty()) {
            log.warn("Job {} has no trigger instant after {} for '{}'", jobId, from, cron);
            handle = null;
            nextRunAt = null;
            return false;
        }
        Instant at = next.get();
        nextRunAt = at;
        handle = timers.schedule(at, () -> fire(at));
        onArmed.accept(at);
        log.debug("Job {} armed for {} ({} in {})", jobId, at, cron, zone);
        return true;
    }

    private void fire(Instant at) {
        if (cancelled) {
            return;
        }
        CompletableFuture<Void> firing;
        try {
            firing = CompletableFuture.runAsync(() -> onFire.accept(at), firings);
        } catch (RejectedExecutionException e) {
            log.warn("Job {} firing at {} dropped, firing executor is shut down", jobId, at);
            return;
        }
        firing.whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.error("Job {} firing at {} failed: {}", jobId, at, cause.getMessage(), cause);
            }
            if (!cancelled) {
                Instant now = timers.now();
                armAfter(now.isAfter(at) ? now : at);
            }
        });
    }

    synchronized void cancel() {
        cancelled = true;
        if (handle != null) {
            handle.cancel();
            handle = null;
        }
        nextRunAt = null;
    }

    synchronized Instant nextRunAt() {
        return nextRunAt;
    }

    String jobId() {
        return jobId;
    }
}
