package com.channelcast.app.config;

import com.channelcast.common.config.ChannelCastConfig;
import com.channelcast.gateway.cron.JobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Arms the timers of all enabled jobs once the application is ready.
 */
@Slf4j
@Component
public class SchedulerBootstrap {

    private final JobScheduler scheduler;
    private final ChannelCastConfig config;

    public SchedulerBootstrap(JobScheduler scheduler, ChannelCastConfig config) {
        this.scheduler = scheduler;
        this.config = config;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!config.getScheduler().isEnabled()) {
            log.info("Scheduler disabled by config; no jobs armed");
            return;
        }
        int armed = scheduler.activateAll();
        log.info("Scheduler bootstrap complete ({} jobs armed)", armed);
    }
}
