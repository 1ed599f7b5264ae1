package com.channelcast.gateway.outbound;

import com.channelcast.gateway.ledger.DeliveryRecord;

import java.util.List;

/**
 * Result of one fan-out call.
 * <p>
 * {@code ok} follows at-least-one semantics: it is {@code true} when any channel
 * succeeded, and also for a request with no channels at all. Callers needing a
 * stricter guarantee inspect {@link #results()}.
 *
 * @param record first ledger record in channel order, or {@code null}
 */
public record DeliveryOutcome(
        boolean ok,
        List<ChannelResult> results,
        int successful,
        int failed,
        DeliveryRecord record) {

    public static DeliveryOutcome empty() {
        return new DeliveryOutcome(true, List.of(), 0, 0, null);
    }

    static DeliveryOutcome of(List<ChannelResult> results) {
        int successful = 0;
        DeliveryRecord first = null;
        for (ChannelResult result : results) {
            if (result.succeeded()) {
                successful++;
                if (first == null) {
                    first = result.record();
                }
            }
        }
        return new DeliveryOutcome(results.isEmpty() || successful > 0, List.copyOf(results),
                successful, results.size() - successful, first);
    }
}
