package com.channelcast.gateway.cron;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Live timers by job id. At most one timer per id.
 * <p>
 * Owned by one {@link JobScheduler}; its lifecycle methods are the only way
 * timers are created or torn down.
 */
final class TimerRegistry {

    private final Map<String, JobTimer> timers = new LinkedHashMap<>();

    /**
     * Create and arm a timer for {@code jobId} unless one is already live.
     *
     * @return {@code true} if a new timer was armed
     */
    synchronized boolean armIfAbsent(String jobId, Supplier<JobTimer> factory, Instant from) {
        if (timers.containsKey(jobId)) {
            return false;
        }
        JobTimer timer = factory.get();
        if (!timer.armAfter(from)) {
            timer.cancel();
            return false;
        }
        timers.put(jobId, timer);
        return true;
    }

    /**
     * @return {@code true} if a live timer was cancelled
     */
    synchronized boolean disarm(String jobId) {
        JobTimer timer = timers.remove(jobId);
        if (timer == null) {
            return false;
        }
        timer.cancel();
        return true;
    }

    synchronized int disarmAll() {
        List<JobTimer> live = new ArrayList<>(timers.values());
        timers.clear();
        live.forEach(JobTimer::cancel);
        return live.size();
    }

    synchronized boolean isArmed(String jobId) {
        return timers.containsKey(jobId);
    }

    synchronized Instant nextRunAt(String jobId) {
        JobTimer timer = timers.get(jobId);
        return timer != null ? timer.nextRunAt() : null;
    }

    synchronized Set<String> ids() {
        return new TreeSet<>(timers.keySet());
    }

    synchronized int size() {
        return timers.size();
    }
}
