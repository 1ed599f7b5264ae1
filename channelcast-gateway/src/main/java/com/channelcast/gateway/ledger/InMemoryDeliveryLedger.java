package com.channelcast.gateway.ledger;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Process-local ledger, used in tests and when no data directory is configured.
 */
public class InMemoryDeliveryLedger implements DeliveryLedger {

    static final Comparator<DeliveryRecord> ORDER = Comparator
            .comparing(DeliveryRecord::postedAt)
            .thenComparing(DeliveryRecord::id);

    private final List<DeliveryRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public DeliveryRecord append(DeliveryRecord record) {
        records.add(record);
        return record;
    }

    @Override
    public List<DeliveryRecord> read(Instant from, Instant to) {
        return records.stream()
                .filter(r -> DeliveryLedger.inWindow(r, from, to))
                .sorted(ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean recordEngagement(String recordId, Engagement delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Engagement counters only increase");
        }
        ListIterator<DeliveryRecord> it = records.listIterator();
        while (it.hasNext()) {
            int index = it.nextIndex();
            DeliveryRecord record = it.next();
            if (record.id().equals(recordId)) {
                records.set(index, record.withEngagement(record.engagement().plus(delta)));
                return true;
            }
        }
        return false;
    }

    public int size() {
        return records.size();
    }
}
