package com.channelcast.gateway.cron;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.PriorityQueue;

/**
 * Timer service on a hand-driven clock. Due tasks run on the calling thread
 * during {@link #advanceTo(Instant)}, each seeing the clock at its own instant.
 */
class ManualTriggerTimers implements TriggerTimers {

    private static final class Entry {
        final Instant at;
        final long seq;
        final Runnable task;
        volatile boolean cancelled;

        Entry(Instant at, long seq, Runnable task) {
            this.at = at;
            this.seq = seq;
            this.task = task;
        }
    }

    private final PriorityQueue<Entry> queue = new PriorityQueue<>((a, b) -> {
        int c = a.at.compareTo(b.at);
        return c != 0 ? c : Long.compare(a.seq, b.seq);
    });
    private volatile Instant now;
    private long seq;
    private boolean shutdown;

    ManualTriggerTimers(Instant start) {
        this.now = start;
    }

    @Override
    public synchronized TimerHandle schedule(Instant at, Runnable task) {
        Entry entry = new Entry(at, seq++, task);
        if (!shutdown) {
            queue.add(entry);
        }
        return () -> entry.cancelled = true;
    }

    @Override
    public Instant now() {
        return now;
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
        queue.clear();
    }

    void advanceTo(Instant target) {
        while (true) {
            Entry next;
            synchronized (this) {
                next = queue.peek();
                if (next == null || next.at.isAfter(target)) {
                    break;
                }
                queue.poll();
            }
            if (next.cancelled) {
                continue;
            }
            if (next.at.isAfter(now)) {
                now = next.at;
            }
            next.task.run();
        }
        if (target.isAfter(now)) {
            now = target;
        }
    }

    void advance(Duration duration) {
        advanceTo(now.plus(duration));
    }

    /** Move the clock without running anything, as if a firing took this long. */
    void elapse(Duration duration) {
        now = now.plus(duration);
    }

    synchronized long pending() {
        return queue.stream().filter(e -> !e.cancelled).count();
    }

    Clock clock() {
        return new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now;
            }
        };
    }
}
