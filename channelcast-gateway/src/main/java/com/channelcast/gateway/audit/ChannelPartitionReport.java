package com.channelcast.gateway.audit;

import java.time.Instant;
import java.util.List;
import java.util.SortedSet;

/**
 * Content split into posts that reached several channels and posts that
 * reached only one.
 */
public record ChannelPartitionReport(
        int recordsScanned,
        int uniqueContent,
        List<Group> multiChannel,
        List<Group> singleChannel) {

    public record Group(
            String key,
            String preview,
            String contentType,
            Instant lastPostedAt,
            SortedSet<String> channels,
            List<String> messageRefs) {

        public int channelCount() {
            return channels.size();
        }
    }
}
