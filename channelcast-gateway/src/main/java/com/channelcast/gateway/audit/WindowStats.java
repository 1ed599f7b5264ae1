package com.channelcast.gateway.audit;

import java.time.Instant;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Delivery counts over a time window.
 *
 * @param byType         per content type: posts and the channels they reached
 * @param byChannel      per channel: posts in total and per content type
 * @param uniqueChannels every channel with at least one post
 */
public record WindowStats(
        Instant from,
        Instant to,
        int total,
        SortedMap<String, TypeStats> byType,
        SortedMap<String, ChannelStats> byChannel,
        SortedSet<String> uniqueChannels) {

    public record TypeStats(int count, SortedSet<String> channels) {

        public int channelCount() {
            return channels.size();
        }
    }

    public record ChannelStats(int total, SortedMap<String, Integer> byType) {
    }
}
