package com.channelcast.gateway.outbound;

import com.channelcast.gateway.job.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ChannelDeliveryAttemptTest {

    private static final Executor INLINE = Runnable::run;

    @Test
    void start_success_endsSucceeded() {
        ChannelDeliveryAttempt attempt = new ChannelDeliveryAttempt("A", new ScriptedTransport(),
                RetryPolicy.DEFAULT, new RecordingRetries(), INLINE);
        assertEquals(DeliveryState.PENDING, attempt.state());

        ChannelResult result = attempt.start("text").join();

        assertEquals(DeliveryState.SUCCEEDED, attempt.state());
        assertTrue(attempt.state().isTerminal());
        assertEquals("A-1", result.messageRef());
    }

    @Test
    void start_exhausted_keepsLastError() {
        ChannelDeliveryAttempt attempt = new ChannelDeliveryAttempt("A", new ScriptedTransport().failAlways("A"),
                new RetryPolicy(1, 0), new RecordingRetries(), INLINE);

        ChannelResult result = attempt.start("text").join();

        assertEquals(DeliveryState.EXHAUSTED, result.state());
        assertEquals("scripted failure on A", result.error());
        assertNull(result.messageRef());
    }

    @Test
    void start_transportThrowsUnchecked_countsAsFailedAttempt() {
        ChannelDeliveryAttempt attempt = new ChannelDeliveryAttempt("A", (channel, text) -> {
            throw new IllegalStateException("boom");
        }, new RetryPolicy(1, 0), new RecordingRetries(), INLINE);

        ChannelResult result = attempt.start("text").join();

        assertEquals(DeliveryState.EXHAUSTED, result.state());
        assertEquals(2, result.attempts());
        assertEquals("boom", result.error());
    }

    @Test
    void start_secondCall_rejected() {
        ChannelDeliveryAttempt attempt = new ChannelDeliveryAttempt("A", new ScriptedTransport(),
                RetryPolicy.NONE, new RecordingRetries(), INLINE);
        attempt.start("text").join();

        assertThrows(IllegalStateException.class, () -> attempt.start("text"));
    }

    @Test
    void start_waitingForRetry_inBackoffWaitUntilRetryRuns() {
        RecordingRetries retries = new RecordingRetries().hold();
        ChannelDeliveryAttempt attempt = new ChannelDeliveryAttempt("A", new ScriptedTransport().failAlways("A"),
                new RetryPolicy(2, 5), retries, INLINE);

        CompletableFuture<ChannelResult> pending = attempt.start("text");

        assertFalse(pending.isDone());
        assertEquals(DeliveryState.BACKOFF_WAIT, attempt.state());
        assertEquals(List.of(Duration.ofSeconds(5)), retries.delays());
    }

    @Test
    void abandon_duringBackoff_exhaustedWithLastError() {
        ChannelDeliveryAttempt attempt = new ChannelDeliveryAttempt("A", new ScriptedTransport().failAlways("A"),
                new RetryPolicy(2, 5), new RecordingRetries().hold(), INLINE);
        CompletableFuture<ChannelResult> pending = attempt.start("text");

        assertTrue(attempt.abandon("delivery stopped"));
        assertFalse(attempt.abandon("delivery stopped"));

        ChannelResult result = pending.join();
        assertEquals(DeliveryState.EXHAUSTED, result.state());
        assertEquals(1, result.attempts());
        assertEquals("delivery stopped while waiting to retry (last error: scripted failure on A)", result.error());
    }

    @Test
    void start_executorRejects_exhaustedWithoutAttempt() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("shut down");
        };
        ScriptedTransport transport = new ScriptedTransport();
        ChannelDeliveryAttempt attempt = new ChannelDeliveryAttempt("A", transport, RetryPolicy.DEFAULT,
                new RecordingRetries(), rejecting);

        ChannelResult result = attempt.start("text").join();

        assertEquals(DeliveryState.EXHAUSTED, result.state());
        assertEquals(0, result.attempts());
        assertEquals("delivery stopped before the first attempt", result.error());
        assertTrue(transport.calls().isEmpty());
    }
}
