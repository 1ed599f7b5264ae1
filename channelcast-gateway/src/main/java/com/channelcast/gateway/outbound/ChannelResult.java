package com.channelcast.gateway.outbound;

import com.channelcast.gateway.ledger.DeliveryRecord;

/**
 * Final state of one channel within a fan-out.
 *
 * @param channelId  target channel
 * @param state      {@link DeliveryState#SUCCEEDED} or {@link DeliveryState#EXHAUSTED}
 * @param attempts   send attempts made
 * @param messageRef channel-assigned message id on success
 * @param error      last failure message, {@code null} on success
 * @param record     ledger record written for this success; {@code null} on
 *                   failure or when the ledger append failed
 */
public record ChannelResult(
        String channelId,
        DeliveryState state,
        int attempts,
        String messageRef,
        String error,
        DeliveryRecord record) {

    public boolean succeeded() {
        return state == DeliveryState.SUCCEEDED;
    }

    ChannelResult withRecord(DeliveryRecord appended) {
        return new ChannelResult(channelId, state, attempts, messageRef, error, appended);
    }
}
