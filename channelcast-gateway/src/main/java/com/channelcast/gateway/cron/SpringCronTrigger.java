package com.channelcast.gateway.cron;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * {@link CronTrigger} on Spring's {@link CronExpression}.
 * <p>
 * Accepts classic 5-field expressions ({@code minute hour day month weekday}),
 * 6-field expressions with a leading seconds field, and the {@code @hourly} /
 * {@code @daily} style macros. Parsed expressions are cached.
 */
public class SpringCronTrigger implements CronTrigger {

    private final Cache<String, CronExpression> cache = Caffeine.newBuilder()
            .maximumSize(512)
            .build();

    @Override
    public Optional<Instant> nextTriggerAfter(String expression, ZoneId zone, Instant from) {
        CronExpression cron = parse(expression);
        ZonedDateTime next = cron.next(from.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    @Override
    public void validate(String expression) {
        parse(expression);
    }

    CronExpression parse(String expression) {
        String normalized = normalize(expression);
        return cache.get(normalized, CronExpression::parse);
    }

    /**
     * Collapse whitespace and prefix 5-field expressions with a zero seconds field.
     */
    static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length == 1 && fields[0].startsWith("@")) {
            return fields[0]; // @hourly, @daily, ...
        }
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        if (fields.length == 6) {
            return String.join(" ", fields);
        }
        throw new IllegalArgumentException(
                "Cron expression must have 5 or 6 fields, got " + fields.length + ": " + expression);
    }
}
