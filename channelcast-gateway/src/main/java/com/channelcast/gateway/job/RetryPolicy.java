package com.channelcast.gateway.job;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-channel retry budget of a job.
 *
 * @param retries    additional attempts after the first one
 * @param backoffSec base delay before the first retry; doubles per retry
 */
public record RetryPolicy(
        @JsonProperty("retries") int retries,
        @JsonProperty("backoffSec") int backoffSec) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(2, 30);

    /** Single attempt, no waiting. */
    public static final RetryPolicy NONE = new RetryPolicy(0, 0);

    public RetryPolicy {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, got " + retries);
        }
        if (backoffSec < 0) {
            throw new IllegalArgumentException("backoffSec must be >= 0, got " + backoffSec);
        }
    }

    public int maxAttempts() {
        return retries + 1;
    }
}
