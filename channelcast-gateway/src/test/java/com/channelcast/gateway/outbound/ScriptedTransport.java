package com.channelcast.gateway.outbound;

import com.channelcast.channel.ChannelDeliveryException;
import com.channelcast.channel.ChannelTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport fake: every channel succeeds unless told to fail.
 */
public class ScriptedTransport implements ChannelTransport {

    public record Call(String channelId, String text) {
    }

    private final Map<String, Integer> failuresLeft = new ConcurrentHashMap<>();
    private final Map<String, Long> retryAfterMs = new ConcurrentHashMap<>();
    private final List<Call> calls = new ArrayList<>();
    private final AtomicInteger refs = new AtomicInteger();
    private volatile Runnable onSend = () -> {
    };

    public ScriptedTransport failAlways(String channelId) {
        failuresLeft.put(channelId, Integer.MAX_VALUE);
        return this;
    }

    public ScriptedTransport failTimes(String channelId, int times) {
        failuresLeft.put(channelId, times);
        return this;
    }

    public ScriptedTransport retryAfter(String channelId, long ms) {
        retryAfterMs.put(channelId, ms);
        return this;
    }

    public ScriptedTransport onSend(Runnable hook) {
        this.onSend = hook;
        return this;
    }

    @Override
    public String send(String channelId, String text) throws ChannelDeliveryException {
        synchronized (calls) {
            calls.add(new Call(channelId, text));
        }
        onSend.run();
        int left = failuresLeft.getOrDefault(channelId, 0);
        if (left > 0) {
            if (left != Integer.MAX_VALUE) {
                failuresLeft.put(channelId, left - 1);
            }
            throw new ChannelDeliveryException(channelId, "scripted failure on " + channelId,
                    retryAfterMs.getOrDefault(channelId, -1L), null);
        }
        return channelId + "-" + refs.incrementAndGet();
    }

    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long callsTo(String channelId) {
        return calls().stream().filter(c -> c.channelId().equals(channelId)).count();
    }
}
