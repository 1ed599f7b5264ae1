package com.channelcast.gateway.audit;

import com.channelcast.common.config.ChannelIdList;
import com.channelcast.gateway.ledger.DeliveryLedger;
import com.channelcast.gateway.ledger.DeliveryRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only reports over the delivery ledger.
 * <p>
 * Records are grouped by {@link ContentIdentity}. All output collections are
 * sorted, and groups are listed most recent post first, then by key, so the
 * same ledger always yields the same report.
 */
public class DeliveryAuditor {

    /** Records scanned by {@link #partition} when the caller gives no limit. */
    public static final int DEFAULT_PARTITION_LIMIT = 50;

    static final int PREVIEW_LENGTH = 100;

    private final DeliveryLedger ledger;
    private final ContentIdentity identity;

    public DeliveryAuditor(DeliveryLedger ledger) {
        this(ledger, ContentIdentity.exact());
    }

    public DeliveryAuditor(DeliveryLedger ledger, ContentIdentity identity) {
        this.ledger = ledger;
        this.identity = identity;
    }

    public WindowStats windowStats(Instant from, Instant to) {
        List<DeliveryRecord> records = ledger.read(from, to);
        SortedMap<String, Integer> typeCounts = new TreeMap<>();
        SortedMap<String, SortedSet<String>> typeChannels = new TreeMap<>();
        SortedMap<String, Integer> channelTotals = new TreeMap<>();
        SortedMap<String, SortedMap<String, Integer>> channelByType = new TreeMap<>();

        for (DeliveryRecord record : records) {
            String type = ContentIdentity.typeOf(record);
            String channel = record.channelId();
            typeCounts.merge(type, 1, Integer::sum);
            typeChannels.computeIfAbsent(type, k -> new TreeSet<>()).add(channel);
            channelTotals.merge(channel, 1, Integer::sum);
            channelByType.computeIfAbsent(channel, k -> new TreeMap<>()).merge(type, 1, Integer::sum);
        }

        SortedMap<String, WindowStats.TypeStats> byType = new TreeMap<>();
        typeCounts.forEach((type, count) -> byType.put(type,
                new WindowStats.TypeStats(count, Collections.unmodifiableSortedSet(typeChannels.get(type)))));
        SortedMap<String, WindowStats.ChannelStats> byChannel = new TreeMap<>();
        channelTotals.forEach((channel, total) -> byChannel.put(channel,
                new WindowStats.ChannelStats(total, Collections.unmodifiableSortedMap(channelByType.get(channel)))));

        return new WindowStats(from, to, records.size(),
                Collections.unmodifiableSortedMap(byType),
                Collections.unmodifiableSortedMap(byChannel),
                Collections.unmodifiableSortedSet(new TreeSet<>(channelTotals.keySet())));
    }

    public CoverageReport coverage(List<String> expectedChannels, Instant from, Instant to) {
        return coverage(expectedChannels, from, to, null);
    }

    /**
     * For every distinct piece of content in the window, which of
     * {@code expectedChannels} it reached.
     *
     * @param contentType only records of this type; {@code null} for all
     */
    public CoverageReport coverage(List<String> expectedChannels, Instant from, Instant to, String contentType) {
        List<String> expected = ChannelIdList.normalize(expectedChannels);
        List<DeliveryRecord> records = ledger.read(from, to).stream()
                .filter(r -> contentType == null || contentType.equals(r.contentType()))
                .toList();

        List<CoverageReport.Group> groups = new ArrayList<>();
        int full = 0;
        for (GroupAccumulator acc : group(records)) {
            List<String> missing = new ArrayList<>();
            // Rate is |delivered ∩ expected| / |expected|; channels outside the expected set are not counted.
            int reached = 0;
            for (String channel : expected) {
                if (acc.channels.contains(channel)) {
                    reached++;
                } else {
                    missing.add(channel);
                }
            }
            boolean fully = missing.isEmpty();
            if (fully) {
                full++;
            }
            groups.add(new CoverageReport.Group(acc.key, acc.preview(), acc.contentType, acc.firstPostedAt,
                    acc.lastPostedAt, Collections.unmodifiableSortedSet(acc.channels), List.copyOf(missing),
                    reached + "/" + expected.size(), fully));
        }
        return new CoverageReport(from, to, contentType, expected, List.copyOf(groups), full, groups.size() - full);
    }

    /**
     * Split the content of the most recent {@code limit} records in the window
     * into multi-channel and single-channel posts.
     *
     * @param limit records to scan, most recent first; {@code 0} for all
     */
    public ChannelPartitionReport partition(Instant from, Instant to, int limit) {
        List<DeliveryRecord> records = ledger.read(from, to);
        if (limit > 0 && records.size() > limit) {
            records = records.subList(records.size() - limit, records.size());
        }
        List<ChannelPartitionReport.Group> multi = new ArrayList<>();
        List<ChannelPartitionReport.Group> single = new ArrayList<>();
        List<GroupAccumulator> accumulators = group(records);
        for (GroupAccumulator acc : accumulators) {
            ChannelPartitionReport.Group group = new ChannelPartitionReport.Group(acc.key, acc.preview(),
                    acc.contentType, acc.lastPostedAt, Collections.unmodifiableSortedSet(acc.channels),
                    List.copyOf(acc.messageRefs));
            if (acc.channels.size() > 1) {
                multi.add(group);
            } else {
                single.add(group);
            }
        }
        return new ChannelPartitionReport(records.size(), accumulators.size(), List.copyOf(multi),
                List.copyOf(single));
    }

    private List<GroupAccumulator> group(List<DeliveryRecord> records) {
        Map<String, GroupAccumulator> groups = new LinkedHashMap<>();
        for (DeliveryRecord record : records) {
            String key = identity.keyOf(record);
            groups.computeIfAbsent(key, k -> new GroupAccumulator(k, record)).add(record);
        }
        List<GroupAccumulator> ordered = new ArrayList<>(groups.values());
        ordered.sort(Comparator.comparing((GroupAccumulator g) -> g.lastPostedAt).reversed()
                .thenComparing(g -> g.key));
        return ordered;
    }

    static String preview(String content) {
        if (content == null) {
            return "";
        }
        return content.length() <= PREVIEW_LENGTH ? content : content.substring(0, PREVIEW_LENGTH) + "...";
    }

    private static final class GroupAccumulator {
        final String key;
        final String content;
        final String contentType;
        final SortedSet<String> channels = new TreeSet<>();
        final List<String> messageRefs = new ArrayList<>();
        Instant firstPostedAt;
        Instant lastPostedAt;

        GroupAccumulator(String key, DeliveryRecord first) {
            this.key = key;
            this.content = first.content();
            this.contentType = ContentIdentity.typeOf(first);
        }

        void add(DeliveryRecord record) {
            channels.add(record.channelId());
            if (record.messageRef() != null) {
                messageRefs.add(record.messageRef());
            }
            if (firstPostedAt == null || record.postedAt().isBefore(firstPostedAt)) {
                firstPostedAt = record.postedAt();
            }
            if (lastPostedAt == null || record.postedAt().isAfter(lastPostedAt)) {
                lastPostedAt = record.postedAt();
            }
        }

        String preview() {
            return DeliveryAuditor.preview(content);
        }
    }
}
