package com.channelcast.gateway.cron;

import com.channelcast.gateway.job.JobDefinition;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Checks job definitions before they are stored or re-armed.
 */
final class JobValidator {

    private final CronTrigger trigger;

    JobValidator(CronTrigger trigger) {
        this.trigger = trigger;
    }

    /**
     * @throws IllegalArgumentException describing the first problem found
     */
    void validate(JobDefinition job) {
        if (job == null) {
            throw new IllegalArgumentException("Job definition is required");
        }
        if (job.getName() == null || job.getName().isBlank()) {
            throw new IllegalArgumentException("Job name is required");
        }
        validateCron(job.getCron());
        if (job.getTimezone() != null && !job.getTimezone().isBlank()) {
            zoneOf(job.getTimezone());
        }
        if (job.getPayload() == null) {
            throw new IllegalArgumentException("Job payload is required");
        }
    }

    void validateCron(String cron) {
        try {
            trigger.validate(cron);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + cron + "': " + e.getMessage(), e);
        }
    }

    static ZoneId zoneOf(String timezone) {
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
        }
    }
}
