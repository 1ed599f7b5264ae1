package com.channelcast.gateway.cron;

import com.channelcast.gateway.job.RetryPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.util.List;

/**
 * Process-wide defaults applied by {@link JobScheduler}.
 */
@Value
@Builder
public class SchedulerSettings {

    /** Zone used when a job declares none. */
    @Builder.Default
    ZoneId defaultZone = ZoneId.of("Europe/London");

    /** Channels used when a job names none. */
    @Builder.Default
    List<String> defaultChannelIds = List.of();

    /** Appended to content of jobs with {@code appendFooter}; blank disables. */
    String footer;

    /** Retry policy for jobs that carry none. */
    @Builder.Default
    RetryPolicy defaultRetryPolicy = RetryPolicy.DEFAULT;

    public static SchedulerSettings defaults() {
        return builder().build();
    }
}
