package com.channelcast.gateway.ledger;

import java.time.Instant;
import java.util.List;

/**
 * Append-mostly record of successfully posted messages.
 * <p>
 * Records are immutable once appended except for their engagement counters,
 * which only grow through {@link #recordEngagement(String, Engagement)}.
 */
public interface DeliveryLedger {

    /**
     * Append one record.
     *
     * @throws LedgerException if the record could not be stored
     */
    DeliveryRecord append(DeliveryRecord record);

    /**
     * Records with {@code from <= postedAt < to}, ordered by postedAt then id.
     * A {@code null} bound is open.
     */
    List<DeliveryRecord> read(Instant from, Instant to);

    /**
     * Add {@code delta} to a record's engagement counters.
     *
     * @return {@code false} if no record has this id
     * @throws IllegalArgumentException if any counter of {@code delta} is negative
     */
    boolean recordEngagement(String recordId, Engagement delta);

    static boolean inWindow(DeliveryRecord record, Instant from, Instant to) {
        Instant at = record.postedAt();
        return (from == null || !at.isBefore(from)) && (to == null || at.isBefore(to));
    }
}
