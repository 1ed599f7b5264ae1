package com.channelcast.gateway.cron;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Evaluates cron expressions within a timezone.
 */
public interface CronTrigger {

    /**
     * The first trigger instant strictly after {@code from}, with the
     * expression's fields read as wall-clock time in {@code zone}.
     *
     * @return empty if the expression never fires again
     * @throws IllegalArgumentException if the expression cannot be parsed
     */
    Optional<Instant> nextTriggerAfter(String expression, ZoneId zone, Instant from);

    /**
     * @throws IllegalArgumentException if the expression cannot be parsed
     */
    void validate(String expression);
}
