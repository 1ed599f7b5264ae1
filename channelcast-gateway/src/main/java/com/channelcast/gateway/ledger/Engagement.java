package com.channelcast.gateway.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Engagement counters of one posted message.
 */
public record Engagement(
        @JsonProperty("views") long views,
        @JsonProperty("clicks") long clicks,
        @JsonProperty("reactions") long reactions) {

    public static final Engagement NONE = new Engagement(0, 0, 0);

    public static Engagement views(long n) {
        return new Engagement(n, 0, 0);
    }

    public Engagement plus(Engagement delta) {
        if (delta == null) {
            return this;
        }
        return new Engagement(views + delta.views, clicks + delta.clicks, reactions + delta.reactions);
    }

    @JsonIgnore
    public boolean isNegative() {
        return views < 0 || clicks < 0 || reactions < 0;
    }
}
