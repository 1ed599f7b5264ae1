package com.channelcast.gateway.outbound;

import com.channelcast.channel.ChannelDeliveryException;
import com.channelcast.channel.ChannelTransport;
import com.channelcast.common.infra.Backoff;
import com.channelcast.common.infra.ErrorUtils;
import com.channelcast.gateway.job.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Retry ladder for a single channel.
 * <p>
 * Attempts are sequential. Attempt {@code k > 0} is preceded by a wait of
 * {@code backoffSec * 2^(k-1)} seconds, stretched to the channel's
 * {@code retry_after} hint when that is longer. Nothing waits after the last
 * failed attempt. Every attempt runs as its own task on the executor and the
 * wait in between is handed to the {@link Backoff.Scheduler}, so a channel in
 * backoff holds no thread. One instance per channel per fan-out.
 */
@Slf4j
class ChannelDeliveryAttempt {

    private final String channelId;
    private final ChannelTransport transport;
    private final RetryPolicy policy;
    private final Backoff.Scheduler retries;
    private final Executor executor;
    private final CompletableFuture<ChannelResult> done = new CompletableFuture<>();

    private boolean started;
    private DeliveryState state = DeliveryState.PENDING;
    private int attempts;
    private String messageRef;
    private String lastError;

    ChannelDeliveryAttempt(String channelId, ChannelTransport transport, RetryPolicy policy,
            Backoff.Scheduler retries, Executor executor) {
        this.channelId = channelId;
        this.transport = transport;
        this.policy = policy != null ? policy : RetryPolicy.DEFAULT;
        this.retries = retries;
        this.executor = executor;
    }

    /**
     * Submit the first attempt.
     *
     * @return completes with the terminal result of the ladder
     */
    CompletableFuture<ChannelResult> start(String text) {
        synchronized (this) {
            if (started) {
                throw new IllegalStateException("Delivery to " + channelId + " already ran");
            }
            started = true;
        }
        try {
            executor.execute(() -> attempt(text));
        } catch (RejectedExecutionException e) {
            abandon("delivery stopped");
        }
        return done;
    }

    private void attempt(String text) {
        int number;
        synchronized (this) {
            if (done.isDone()) {
                return;
            }
            state = DeliveryState.ATTEMPTING;
            number = ++attempts;
        }
        int maxAttempts = policy.maxAttempts();
        String error;
        long retryAfterMs;
        try {
            String ref = transport.send(channelId, text);
            log.debug("Delivered to {} on attempt {}/{} (ref {})", channelId, number, maxAttempts, ref);
            finish(DeliveryState.SUCCEEDED, ref, null);
            return;
        } catch (ChannelDeliveryException e) {
            error = e.getMessage();
            retryAfterMs = e.getRetryAfterMs();
        } catch (RuntimeException e) {
            error = ErrorUtils.formatErrorMessage(e);
            retryAfterMs = -1;
        }
        log.warn("Delivery to {} failed on attempt {}/{}: {}", channelId, number, maxAttempts, error);
        if (number >= maxAttempts) {
            log.error("Delivery to {} exhausted after {} attempts: {}", channelId, number, error);
            finish(DeliveryState.EXHAUSTED, null, error);
            return;
        }

        Duration delay = Backoff.exponential(policy.backoffSec(), number);
        if (retryAfterMs > delay.toMillis()) {
            delay = Duration.ofMillis(retryAfterMs);
        }
        synchronized (this) {
            if (done.isDone()) {
                return;
            }
            state = DeliveryState.BACKOFF_WAIT;
            lastError = error;
        }
        try {
            retries.schedule(delay, () -> attempt(text), executor);
        } catch (RejectedExecutionException e) {
            abandon("delivery stopped");
        }
    }

    /**
     * End the ladder early, typically because the fan-out is closing. A send
     * already on the wire may still land but is no longer reported.
     *
     * @return {@code false} if the ladder had already finished
     */
    synchronized boolean abandon(String reason) {
        if (done.isDone()) {
            return false;
        }
        state = DeliveryState.EXHAUSTED;
        lastError = lastError != null
                ? reason + " while waiting to retry (last error: " + lastError + ")"
                : reason + " before the first attempt";
        log.error("Delivery to {} abandoned after {} attempts: {}", channelId, attempts, reason);
        return done.complete(result());
    }

    private synchronized void finish(DeliveryState terminal, String ref, String error) {
        if (done.isDone()) {
            return;
        }
        state = terminal;
        messageRef = ref;
        lastError = error;
        done.complete(result());
    }

    private ChannelResult result() {
        return new ChannelResult(channelId, state, attempts, messageRef, lastError, null);
    }

    synchronized DeliveryState state() {
        return state;
    }
}
