package com.channelcast.gateway.job;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Scheduled publishing job: what to publish, when, and where.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobDefinition {
    private String id;
    private String name;
    private String cron; // e.g. "*/5 * * * *"
    private String timezone; // IANA zone, e.g. "Europe/London"
    @Builder.Default
    private List<String> channelIds = new ArrayList<>(); // empty = configured default channels
    @Builder.Default
    private boolean enabled = true;

    private String contentType; // ledger label, e.g. "marketing"
    private JobPayload payload;
    private boolean appendFooter;
    @Builder.Default
    private ResolutionFailurePolicy onResolutionFailure = ResolutionFailurePolicy.SKIP;
    private String fallbackText;
    @Builder.Default
    private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;

    private Instant lastRunAt;
    private Instant nextRunAt;
    private long runCount;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Deep enough copy that callers can never mutate a stored definition.
     */
    public JobDefinition copy() {
        return toBuilder()
                .channelIds(channelIds != null ? new ArrayList<>(channelIds) : new ArrayList<>())
                .build();
    }
}
