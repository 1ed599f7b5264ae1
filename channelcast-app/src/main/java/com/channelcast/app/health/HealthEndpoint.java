package com.channelcast.app.health;

import com.channelcast.gateway.cron.JobScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness probe with a scheduler summary.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JobScheduler scheduler;

    public HealthEndpoint(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        var jobs = node.putObject("scheduler");
        jobs.put("armed", scheduler.armedJobIds().size());

        var memory = node.putObject("memory");
        Runtime rt = Runtime.getRuntime();
        memory.put("used_mb", (rt.totalMemory() - rt.freeMemory()) / (1024 * 1024));
        memory.put("max_mb", rt.maxMemory() / (1024 * 1024));
        return node;
    }
}
