package com.channelcast.gateway.audit;

import java.time.Instant;
import java.util.List;
import java.util.SortedSet;

/**
 * Whether each distinct piece of content reached every expected channel.
 */
public record CoverageReport(
        Instant from,
        Instant to,
        String contentType,
        List<String> expectedChannels,
        List<Group> groups,
        int fullyDelivered,
        int partiallyDelivered) {

    /**
     * @param missing      expected channels without a post, in expected order
     * @param deliveryRate {@code "delivered/expected"}, counting only expected channels
     */
    public record Group(
            String key,
            String preview,
            String contentType,
            Instant firstPostedAt,
            Instant lastPostedAt,
            SortedSet<String> deliveredChannels,
            List<String> missing,
            String deliveryRate,
            boolean fullyDelivered) {
    }
}
