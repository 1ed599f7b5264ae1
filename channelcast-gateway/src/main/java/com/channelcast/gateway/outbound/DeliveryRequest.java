package com.channelcast.gateway.outbound;

import com.channelcast.gateway.job.RetryPolicy;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One piece of content to post to a set of channels.
 */
@Value
@Builder
public class DeliveryRequest {
    String content;
    String contentType;
    /** Recorded as the ledger title; usually the job name. */
    String title;
    String jobId;
    @Singular
    List<String> channelIds;
    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
}
