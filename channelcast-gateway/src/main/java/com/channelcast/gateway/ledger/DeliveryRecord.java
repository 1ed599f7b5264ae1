package com.channelcast.gateway.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One successfully posted message on one channel.
 *
 * @param id          ledger-assigned record id
 * @param jobId       originating job, {@code null} for ad-hoc deliveries
 * @param title       job name, may be {@code null}
 * @param contentType label such as {@code marketing} or {@code digest}
 * @param content     full posted text
 * @param channelId   target channel identifier
 * @param messageRef  identifier assigned to the message by the channel
 * @param postedAt    when the channel accepted the message
 * @param engagement  counters, only ever incremented through the ledger
 */
public record DeliveryRecord(
        @JsonProperty("id") String id,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("title") String title,
        @JsonProperty("contentType") String contentType,
        @JsonProperty("content") String content,
        @JsonProperty("channelId") String channelId,
        @JsonProperty("messageRef") String messageRef,
        @JsonProperty("postedAt") Instant postedAt,
        @JsonProperty("engagement") Engagement engagement) {

    public DeliveryRecord {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(postedAt, "postedAt");
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        if (engagement == null) {
            engagement = Engagement.NONE;
        }
    }

    public DeliveryRecord withEngagement(Engagement updated) {
        return new DeliveryRecord(id, jobId, title, contentType, content, channelId, messageRef, postedAt, updated);
    }
}
