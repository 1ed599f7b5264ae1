package com.channelcast.gateway.cron;

import com.channelcast.common.infra.ErrorUtils;
import com.channelcast.gateway.content.ContentResolutionException;
import com.channelcast.gateway.content.ContentResolver;
import com.channelcast.gateway.job.JobDefinition;
import com.channelcast.gateway.job.JobNotFoundException;
import com.channelcast.gateway.job.JobQuery;
import com.channelcast.gateway.job.JobStore;
import com.channelcast.gateway.job.JobStoreException;
import com.channelcast.gateway.job.ResolutionFailurePolicy;
import com.channelcast.gateway.job.RetryPolicy;
import com.channelcast.gateway.outbound.DeliveryFanout;
import com.channelcast.gateway.outbound.DeliveryOutcome;
import com.channelcast.gateway.outbound.DeliveryRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs jobs on their cron schedules.
 * <p>
 * Keeps at most one live timer per enabled job. Each firing re-reads the job
 * from the store, resolves its content, fans it out to the job's channels and
 * advances the job's run bookkeeping whatever the delivery outcome.
 * Administrative operations serialize on one lock. Firings run on the firing
 * executor, never on the timer threads, and never take the lock.
 */
@Slf4j
public class JobScheduler implements AutoCloseable {

    private final JobStore store;
    private final ContentResolver resolver;
    private final DeliveryFanout fanout;
    private final CronTrigger trigger;
    private final TriggerTimers timers;
    private final Executor firings;
    private final ExecutorService ownedFirings;
    private final SchedulerSettings settings;
    private final JobValidator validator;
    private final TimerRegistry registry = new TimerRegistry();
    private final Object adminLock = new Object();
    private boolean closed;

    /**
     * Scheduler whose firings run on its own pool of daemon threads, one per
     * concurrently firing job.
     */
    public JobScheduler(JobStore store, ContentResolver resolver, DeliveryFanout fanout,
            CronTrigger trigger, TriggerTimers timers, SchedulerSettings settings) {
        this(store, resolver, fanout, trigger, timers, newFiringExecutor(), true, settings);
    }

    public JobScheduler(JobStore store, ContentResolver resolver, DeliveryFanout fanout,
            CronTrigger trigger, TriggerTimers timers, Executor firings, SchedulerSettings settings) {
        this(store, resolver, fanout, trigger, timers, firings, false, settings);
    }

    private JobScheduler(JobStore store, ContentResolver resolver, DeliveryFanout fanout,
            CronTrigger trigger, TriggerTimers timers, Executor firings, boolean ownsFirings,
            SchedulerSettings settings) {
        this.store = store;
        this.resolver = resolver;
        this.fanout = fanout;
        this.trigger = trigger;
        this.timers = timers;
        this.firings = firings;
        this.ownedFirings = ownsFirings ? (ExecutorService) firings : null;
        this.settings = settings != null ? settings : SchedulerSettings.defaults();
        this.validator = new JobValidator(trigger);
    }

    // --- Lifecycle ---

    /**
     * Arm a timer for every enabled job in the store. Jobs that already have a
     * live timer are left alone.
     *
     * @return the number of timers newly armed
     */
    public int activateAll() {
        synchronized (adminLock) {
            ensureOpen();
            List<JobDefinition> enabled = store.find(JobQuery.builder().enabled(true).build());
            int armed = 0;
            for (JobDefinition job : enabled) {
                if (arm(job)) {
                    armed++;
                }
            }
            log.info("Job scheduler activated: {} of {} enabled jobs newly armed, {} timers live",
                    armed, enabled.size(), registry.size());
            return armed;
        }
    }

    /**
     * Arm a timer for a new or previously paused job.
     *
     * @return {@code false} if the job already has a live timer or is disabled
     * @throws IllegalArgumentException if the definition is invalid
     */
    public boolean register(JobDefinition definition) {
        validator.validate(definition);
        synchronized (adminLock) {
            ensureOpen();
            if (!definition.isEnabled()) {
                log.debug("Job {} is disabled, not arming", definition.getId());
                return false;
            }
            return arm(definition);
        }
    }

    /**
     * Validate, persist and register a new job.
     *
     * @return the stored definition, including its assigned id
     * @throws IllegalArgumentException if the definition is invalid
     */
    public JobDefinition create(JobDefinition definition) {
        validator.validate(definition);
        JobDefinition candidate = definition.copy();
        if (candidate.getTimezone() == null || candidate.getTimezone().isBlank()) {
            candidate.setTimezone(settings.getDefaultZone().getId());
        }
        if (candidate.getRetryPolicy() == null) {
            candidate.setRetryPolicy(settings.getDefaultRetryPolicy());
        }
        if (candidate.getOnResolutionFailure() == null) {
            candidate.setOnResolutionFailure(ResolutionFailurePolicy.SKIP);
        }
        candidate.setRunCount(0);
        candidate.setLastRunAt(null);
        candidate.setNextRunAt(null);
        synchronized (adminLock) {
            ensureOpen();
            JobDefinition stored = store.insert(candidate);
            arm(stored);
            log.info("Created job {} ({}) on '{}' {}", stored.getId(), stored.getName(), stored.getCron(),
                    stored.getTimezone());
            return store.findById(stored.getId()).orElse(stored);
        }
    }

    /**
     * Disarm the job's timer and mark it disabled. A firing already in
     * progress completes.
     *
     * @throws JobNotFoundException if no job has this id
     */
    public JobDefinition deactivate(String jobId) {
        synchronized (adminLock) {
            requireJob(jobId);
            registry.disarm(jobId);
            JobDefinition updated = store.update(jobId, j -> {
                j.setEnabled(false);
                j.setNextRunAt(null);
            });
            log.info("Deactivated job {} ({})", jobId, updated.getName());
            return updated;
        }
    }

    /**
     * Replace the job's cron expression, re-enable it and re-arm it from the
     * stored definition. An invalid expression changes nothing.
     *
     * @throws IllegalArgumentException if {@code newCron} cannot be parsed
     * @throws JobNotFoundException     if no job has this id
     */
    public JobDefinition reschedule(String jobId, String newCron) {
        validator.validateCron(newCron);
        synchronized (adminLock) {
            ensureOpen();
            requireJob(jobId);
            registry.disarm(jobId);
            JobDefinition updated = store.update(jobId, j -> {
                j.setCron(newCron.trim());
                j.setEnabled(true);
                j.setNextRunAt(null);
            });
            arm(updated);
            log.info("Rescheduled job {} ({}) to '{}'", jobId, updated.getName(), updated.getCron());
            return store.findById(jobId).orElse(updated);
        }
    }

    /**
     * Re-enable a paused job on its stored expression.
     *
     * @throws JobNotFoundException if no job has this id
     */
    public JobDefinition resume(String jobId) {
        synchronized (adminLock) {
            return reschedule(jobId, requireJob(jobId).getCron());
        }
    }

    /**
     * Disarm and delete one job.
     */
    public boolean remove(String jobId) {
        synchronized (adminLock) {
            registry.disarm(jobId);
            boolean removed = store.delete(jobId);
            if (removed) {
                log.info("Removed job {}", jobId);
            }
            return removed;
        }
    }

    /**
     * Disarm every timer and delete every job.
     *
     * @return the number of jobs deleted
     */
    public int removeAll() {
        synchronized (adminLock) {
            int disarmed = registry.disarmAll();
            int removed = store.deleteAll();
            log.info("Removed all {} jobs ({} timers disarmed)", removed, disarmed);
            return removed;
        }
    }

    /**
     * Fire a job immediately through the same path as a timer firing. The job
     * does not have to be enabled.
     *
     * @throws JobNotFoundException if no job has this id
     */
    public FiringResult runNow(String jobId) {
        JobDefinition job = requireJob(jobId);
        log.info("Manual run of job {} ({})", jobId, job.getName());
        return execute(job, timers.now());
    }

    public boolean isArmed(String jobId) {
        return registry.isArmed(jobId);
    }

    public Set<String> armedJobIds() {
        return registry.ids();
    }

    public Optional<Instant> nextRunAt(String jobId) {
        return Optional.ofNullable(registry.nextRunAt(jobId));
    }

    @Override
    public void close() {
        synchronized (adminLock) {
            if (closed) {
                return;
            }
            closed = true;
            int disarmed = registry.disarmAll();
            timers.shutdown();
            if (ownedFirings != null) {
                ownedFirings.shutdown();
            }
            log.info("Job scheduler stopped ({} timers disarmed)", disarmed);
        }
    }

    // --- Timers ---

    private boolean arm(JobDefinition job) {
        if (!job.isEnabled()) {
            return false;
        }
        String jobId = job.getId();
        try {
            ZoneId zone = zoneFor(job);
            return registry.armIfAbsent(jobId,
                    () -> new JobTimer(jobId, job.getCron(), zone, trigger, timers, firings,
                            at -> onTimer(jobId, at),
                            at -> recordNextRun(jobId, at)),
                    timers.now());
        } catch (IllegalArgumentException e) {
            log.error("Job {} ({}) has an invalid schedule, not arming: {}", jobId, job.getName(), e.getMessage());
            return false;
        }
    }

    private void onTimer(String jobId, Instant triggerAt) {
        Optional<JobDefinition> current;
        try {
            current = store.findById(jobId);
        } catch (JobStoreException e) {
            log.error("Skipping firing of job {} at {}: {}", jobId, triggerAt, ErrorUtils.formatErrorChain(e));
            return;
        }
        if (current.isEmpty() || !current.get().isEnabled()) {
            log.debug("Job {} no longer enabled, skipping firing at {}", jobId, triggerAt);
            return;
        }
        try {
            execute(current.get(), timers.now());
        } catch (JobStoreException e) {
            log.error("Job {} fired at {} but bookkeeping failed: {}", jobId, triggerAt,
                    ErrorUtils.formatErrorChain(e));
        }
    }

    private void recordNextRun(String jobId, Instant at) {
        try {
            store.update(jobId, j -> j.setNextRunAt(at));
        } catch (JobNotFoundException e) {
            log.debug("Job {} armed but not stored; nextRunAt not recorded", jobId);
        } catch (JobStoreException e) {
            log.warn("Could not record next run of job {}: {}", jobId, e.getMessage());
        }
    }

    // --- Firing ---

    private FiringResult execute(JobDefinition job, Instant firedAt) {
        try {
            return resolveAndDeliver(job, firedAt);
        } finally {
            recordRun(job.getId(), firedAt);
        }
    }

    private FiringResult resolveAndDeliver(JobDefinition job, Instant firedAt) {
        String jobId = job.getId();
        String content;
        try {
            content = resolver.resolve(job.getPayload());
        } catch (ContentResolutionException | RuntimeException e) {
            if (job.getOnResolutionFailure() == ResolutionFailurePolicy.FALLBACK && hasText(job.getFallbackText())) {
                log.warn("Job {} ({}) content resolution failed, publishing fallback text: {}", jobId,
                        job.getName(), ErrorUtils.formatErrorMessage(e));
                content = job.getFallbackText();
            } else {
                log.warn("Job {} ({}) content resolution failed, skipping this firing: {}", jobId,
                        job.getName(), ErrorUtils.formatErrorMessage(e));
                return FiringResult.skipped(jobId, FiringResult.Status.RESOLUTION_FAILED, firedAt);
            }
        }
        if (!hasText(content)) {
            log.info("Job {} ({}) produced no content, nothing to publish", jobId, job.getName());
            return FiringResult.skipped(jobId, FiringResult.Status.SKIPPED_NO_CONTENT, firedAt);
        }

        String text = applyFooter(content, job.isAppendFooter());
        List<String> channels = job.getChannelIds() != null && !job.getChannelIds().isEmpty()
                ? job.getChannelIds()
                : settings.getDefaultChannelIds();
        if (channels.isEmpty()) {
            log.warn("Job {} ({}) has no channels and no default channels are configured", jobId, job.getName());
        }
        RetryPolicy policy = job.getRetryPolicy() != null ? job.getRetryPolicy() : settings.getDefaultRetryPolicy();

        DeliveryOutcome outcome = fanout.deliver(DeliveryRequest.builder()
                .content(text)
                .contentType(job.getContentType())
                .title(job.getName())
                .jobId(jobId)
                .channelIds(channels)
                .retryPolicy(policy)
                .build());
        FiringResult.Status status = outcome.ok() ? FiringResult.Status.DELIVERED : FiringResult.Status.FAILED;
        return new FiringResult(jobId, status, text, outcome, firedAt);
    }

    private void recordRun(String jobId, Instant firedAt) {
        try {
            store.update(jobId, j -> {
                j.setRunCount(j.getRunCount() + 1);
                j.setLastRunAt(firedAt);
            });
        } catch (JobNotFoundException e) {
            log.debug("Job {} removed during its firing, run not recorded", jobId);
        }
    }

    String applyFooter(String content, boolean appendFooter) {
        String footer = settings.getFooter();
        if (!appendFooter || !hasText(footer) || content.contains(footer.trim())) {
            return content;
        }
        return content + "\n\n" + footer.trim();
    }

    // --- Helpers ---

    private JobDefinition requireJob(String jobId) {
        return store.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private ZoneId zoneFor(JobDefinition job) {
        String tz = job.getTimezone();
        return hasText(tz) ? JobValidator.zoneOf(tz) : settings.getDefaultZone();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Job scheduler is closed");
        }
    }

    private static ExecutorService newFiringExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "channelcast-firing-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
