package com.channelcast.gateway.outbound;

import com.channelcast.channel.ChannelTransport;
import com.channelcast.common.config.ChannelIdList;
import com.channelcast.common.infra.Backoff;
import com.channelcast.common.infra.ErrorUtils;
import com.channelcast.gateway.job.RetryPolicy;
import com.channelcast.gateway.ledger.DeliveryLedger;
import com.channelcast.gateway.ledger.DeliveryRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Posts one piece of content to many channels at once.
 * <p>
 * Every channel runs its own {@link ChannelDeliveryAttempt} on the fan-out
 * executor. Attempts are short tasks and backoff waits hold no thread, so a
 * slow or failing channel never delays the others, however many channels
 * share the pool. Each
 * successful post appends exactly one {@link DeliveryRecord}; failures only
 * show up in the returned {@link DeliveryOutcome} and the log.
 */
@Slf4j
public class DeliveryFanout implements AutoCloseable {

    private final ChannelTransport transport;
    private final DeliveryLedger ledger;
    private final ExecutorService executor;
    private final Backoff.Scheduler retries;
    private final Clock clock;
    private final boolean ownsExecutor;
    private final Set<ChannelDeliveryAttempt> inFlight = ConcurrentHashMap.newKeySet();

    public DeliveryFanout(ChannelTransport transport, DeliveryLedger ledger, int maxConcurrency) {
        this(transport, ledger, newExecutor(maxConcurrency), Backoff.Scheduler.DELAYED, Clock.systemUTC(), true);
    }

    public DeliveryFanout(ChannelTransport transport, DeliveryLedger ledger, ExecutorService executor,
            Backoff.Scheduler retries, Clock clock) {
        this(transport, ledger, executor, retries, clock, false);
    }

    private DeliveryFanout(ChannelTransport transport, DeliveryLedger ledger, ExecutorService executor,
            Backoff.Scheduler retries, Clock clock, boolean ownsExecutor) {
        this.transport = transport;
        this.ledger = ledger;
        this.executor = executor;
        this.retries = retries;
        this.clock = clock;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Deliver untitled content with no job attribution.
     */
    public DeliveryOutcome deliver(String content, List<String> channelIds, RetryPolicy retryPolicy) {
        return deliver(DeliveryRequest.builder()
                .content(content)
                .channelIds(channelIds != null ? channelIds : List.of())
                .retryPolicy(retryPolicy != null ? retryPolicy : RetryPolicy.DEFAULT)
                .build());
    }

    /**
     * Deliver to every channel of the request and wait for all of them.
     * Duplicate channel ids are collapsed to their first occurrence.
     */
    public DeliveryOutcome deliver(DeliveryRequest request) {
        List<String> channels = ChannelIdList.normalize(request.getChannelIds());
        if (channels.isEmpty()) {
            log.debug("No channels to deliver to (job {})", request.getJobId());
            return DeliveryOutcome.empty();
        }

        List<CompletableFuture<ChannelResult>> futures = channels.stream()
                .map(channelId -> deliverOne(channelId, request))
                .toList();
        List<ChannelResult> results = futures.stream().map(CompletableFuture::join).toList();

        DeliveryOutcome outcome = DeliveryOutcome.of(results);
        if (outcome.failed() == 0) {
            log.info("Delivered job {} to {}/{} channels", request.getJobId(), outcome.successful(), channels.size());
        } else {
            log.warn("Delivered job {} to {}/{} channels ({} failed)", request.getJobId(),
                    outcome.successful(), channels.size(), outcome.failed());
        }
        return outcome;
    }

    private CompletableFuture<ChannelResult> deliverOne(String channelId, DeliveryRequest request) {
        ChannelDeliveryAttempt attempt = new ChannelDeliveryAttempt(channelId, transport,
                request.getRetryPolicy(), retries, executor);
        inFlight.add(attempt);
        return attempt.start(request.getContent())
                .whenComplete((result, error) -> inFlight.remove(attempt))
                .thenApply(result -> record(result, request));
    }

    private ChannelResult record(ChannelResult result, DeliveryRequest request) {
        String channelId = result.channelId();
        if (!result.succeeded()) {
            return result;
        }
        DeliveryRecord record = new DeliveryRecord(null, request.getJobId(), request.getTitle(),
                request.getContentType(), request.getContent(), channelId, result.messageRef(),
                clock.instant(), null);
        try {
            return result.withRecord(ledger.append(record));
        } catch (RuntimeException e) {
            // The message is live on the channel; only the ledger entry is missing.
            log.error("Posted to {} (ref {}) but failed to record delivery: {}", channelId,
                    result.messageRef(), ErrorUtils.formatErrorChain(e));
            return result;
        }
    }

    /**
     * Stop the fan-out. Ladders still in flight end as exhausted so that no
     * caller waits on a retry that will never run.
     */
    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        int abandoned = 0;
        for (ChannelDeliveryAttempt attempt : List.copyOf(inFlight)) {
            if (attempt.abandon("delivery stopped")) {
                abandoned++;
            }
        }
        if (abandoned > 0) {
            log.warn("Fan-out closed with {} channel deliveries still in flight", abandoned);
        }
    }

    private static ExecutorService newExecutor(int maxConcurrency) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, maxConcurrency), r -> {
            Thread t = new Thread(r, "channelcast-fanout-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
