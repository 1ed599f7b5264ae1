package com.channelcast.gateway.cron;

import com.channelcast.gateway.outbound.DeliveryOutcome;

import java.time.Instant;

/**
 * What one firing of a job did.
 *
 * @param content published text, {@code null} when nothing was published
 * @param outcome fan-out result, {@code null} when no delivery was attempted
 */
public record FiringResult(String jobId, Status status, String content, DeliveryOutcome outcome, Instant firedAt) {

    public enum Status {
        /** At least one channel accepted the post. */
        DELIVERED,
        /** Every channel failed. */
        FAILED,
        /** Job missing or disabled when the timer fired. */
        SKIPPED_DISABLED,
        /** Resolver produced no text. */
        SKIPPED_NO_CONTENT,
        /** Resolver failed and the job does not fall back. */
        RESOLUTION_FAILED
    }

    static FiringResult skipped(String jobId, Status status, Instant firedAt) {
        return new FiringResult(jobId, status, null, null, firedAt);
    }

    public boolean delivered() {
        return status == Status.DELIVERED;
    }
}
