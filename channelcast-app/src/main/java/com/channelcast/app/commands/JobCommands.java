package com.channelcast.app.commands;

import com.channelcast.gateway.cron.FiringResult;
import com.channelcast.gateway.cron.JobScheduler;
import com.channelcast.gateway.cron.JobSeedImporter;
import com.channelcast.gateway.job.JobDefinition;
import com.channelcast.gateway.job.JobNotFoundException;
import com.channelcast.gateway.job.JobPayload;
import com.channelcast.gateway.job.JobQuery;
import com.channelcast.gateway.job.JobStore;
import com.channelcast.gateway.outbound.ChannelResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Job administration: /job_create, /job_list, /job_pause, /job_resume,
 * /job_reschedule, /job_run, /job_remove, /seed_jobs, /clear_jobs.
 */
@Slf4j
@Component
public class JobCommands {

    static final String GENERATED_PREFIX = "gemini:";
    static final int LIST_LIMIT = 50;

    private final JobScheduler scheduler;
    private final JobStore store;
    private final JobSeedImporter seedImporter;

    public JobCommands(JobScheduler scheduler, JobStore store, JobSeedImporter seedImporter) {
        this.scheduler = scheduler;
        this.store = store;
        this.seedImporter = seedImporter;
    }

    public CommandResult handleCreate(String args, CommandContext ctx) {
        List<String> parts = CommandArgs.splitParts(args);
        if (parts.isEmpty()) {
            return CommandResult.text("Usage: /job_create <name> || <cron> || <type> || <content|gemini:prompt>");
        }
        if (parts.size() < 4 || parts.subList(0, 4).stream().anyMatch(String::isEmpty)) {
            return CommandResult.error(
                    "Invalid args. Example: /job_create Morning || 0 9 * * * || greeting || gemini:Write a short greeting");
        }
        JobDefinition job = JobDefinition.builder()
                .name(parts.get(0))
                .cron(parts.get(1))
                .contentType(parts.get(2))
                .payload(parsePayload(parts.get(3)))
                .retryPolicy(null) // scheduler applies delivery.defaultRetries
                .createdBy(ctx.senderId())
                .build();
        JobDefinition saved = scheduler.create(job);
        return CommandResult.text("Scheduled job created: " + saved.getId()
                + "\nName: " + saved.getName()
                + "\nCron: " + saved.getCron() + " (" + saved.getTimezone() + ")");
    }

    /**
     * {@code gemini:<prompt>} selects generated content, anything else is
     * published verbatim.
     */
    static JobPayload parsePayload(String contentOrPrompt) {
        if (contentOrPrompt.startsWith(GENERATED_PREFIX)) {
            String prompt = contentOrPrompt.substring(GENERATED_PREFIX.length()).trim();
            if (prompt.isEmpty()) {
                throw new IllegalArgumentException("Generated content needs a prompt after '" + GENERATED_PREFIX + "'");
            }
            return new JobPayload.GeneratedContent(prompt, null, null);
        }
        return new JobPayload.StaticContent(contentOrPrompt);
    }

    public CommandResult handleList(String args, CommandContext ctx) {
        List<JobDefinition> jobs = store.find(JobQuery.builder()
                .sort(JobQuery.Sort.CREATED_DESC)
                .limit(LIST_LIMIT)
                .build());
        if (jobs.isEmpty()) {
            return CommandResult.text("No scheduled jobs.");
        }
        String body = jobs.stream()
                .map(this::describe)
                .collect(Collectors.joining("\n---\n"));
        return CommandResult.text("Scheduled jobs\n\n" + body);
    }

    private String describe(JobDefinition job) {
        StringBuilder sb = new StringBuilder();
        sb.append("ID: ").append(job.getId()).append('\n');
        sb.append("Name: ").append(job.getName()).append('\n');
        sb.append("Cron: ").append(job.getCron()).append(" tz:").append(job.getTimezone()).append('\n');
        sb.append("Enabled: ").append(job.isEnabled())
                .append(scheduler.isArmed(job.getId()) ? " (armed)" : "").append('\n');
        sb.append("LastRun: ").append(job.getLastRunAt() != null ? job.getLastRunAt() : "never").append('\n');
        sb.append("Runs: ").append(job.getRunCount()).append('\n');
        scheduler.nextRunAt(job.getId()).ifPresent(next -> sb.append("NextRun: ").append(next).append('\n'));
        return sb.toString();
    }

    public CommandResult handlePause(String args, CommandContext ctx) {
        String id = CommandArgs.firstToken(args);
        if (id.isEmpty()) {
            return CommandResult.text("Usage: /job_pause <jobId>");
        }
        try {
            scheduler.deactivate(id);
        } catch (JobNotFoundException e) {
            return notFound(id);
        }
        return CommandResult.text("Job " + id + " paused.");
    }

    public CommandResult handleResume(String args, CommandContext ctx) {
        String id = CommandArgs.firstToken(args);
        if (id.isEmpty()) {
            return CommandResult.text("Usage: /job_resume <jobId>");
        }
        try {
            scheduler.resume(id);
        } catch (JobNotFoundException e) {
            return notFound(id);
        }
        return CommandResult.text("Job " + id + " resumed.");
    }

    public CommandResult handleReschedule(String args, CommandContext ctx) {
        List<String> parts = CommandArgs.splitParts(args);
        if (parts.size() < 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
            return CommandResult.text("Usage: /job_reschedule <id> || <newCron>");
        }
        String id = parts.get(0);
        JobDefinition updated;
        try {
            updated = scheduler.reschedule(id, parts.get(1));
        } catch (JobNotFoundException e) {
            return notFound(id);
        }
        return CommandResult.text("Job " + id + " rescheduled to " + updated.getCron()
                + " (" + updated.getTimezone() + ")");
    }

    public CommandResult handleRun(String args, CommandContext ctx) {
        String id = CommandArgs.firstToken(args);
        if (id.isEmpty()) {
            return CommandResult.text("Usage: /job_run <jobId>");
        }
        FiringResult result;
        try {
            result = scheduler.runNow(id);
        } catch (JobNotFoundException e) {
            return notFound(id);
        }
        return CommandResult.text(describe(result));
    }

    static String describe(FiringResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Job ").append(result.jobId()).append(" ran: ").append(result.status());
        if (result.outcome() != null) {
            sb.append(" (").append(result.outcome().successful()).append(" ok, ")
                    .append(result.outcome().failed()).append(" failed)");
            for (ChannelResult channel : result.outcome().results()) {
                sb.append("\n  ").append(channel.channelId()).append(": ").append(channel.state());
                if (channel.error() != null) {
                    sb.append(" - ").append(channel.error());
                }
            }
        }
        return sb.toString();
    }

    public CommandResult handleRemove(String args, CommandContext ctx) {
        String id = CommandArgs.firstToken(args);
        if (id.isEmpty()) {
            return CommandResult.text("Usage: /job_remove <jobId>");
        }
        return scheduler.remove(id)
                ? CommandResult.text("Job " + id + " removed.")
                : notFound(id);
    }

    public CommandResult handleSeed(String args, CommandContext ctx) {
        String resource = ctx.config().getScheduler().getSeedResource();
        JobSeedImporter.ImportResult result;
        try {
            result = seedImporter.importResource(resource, ctx.senderId());
        } catch (IOException e) {
            log.error("Failed to read seed jobs from {}: {}", resource, e.getMessage());
            return CommandResult.error("Error seeding jobs: " + e.getMessage());
        }
        StringBuilder sb = new StringBuilder("Seed complete\n\n");
        sb.append("Created: ").append(result.created().size()).append(" jobs\n");
        sb.append("Skipped: ").append(result.skipped().size()).append(" jobs (already exist)\n");
        if (!result.errors().isEmpty()) {
            sb.append("Rejected: ").append(result.errors().size()).append('\n');
            result.errors().forEach(err -> sb.append("  ").append(err).append('\n'));
        }
        sb.append("\nUse /job_list to see all scheduled jobs.");
        return CommandResult.text(sb.toString());
    }

    public CommandResult handleClear(String args, CommandContext ctx) {
        return CommandResult.text("WARNING: this deletes ALL scheduled jobs.\n\n"
                + "Send /clear_jobs_confirm to proceed.");
    }

    public CommandResult handleClearConfirm(String args, CommandContext ctx) {
        int removed = scheduler.removeAll();
        return CommandResult.text("Deleted " + removed + " jobs and stopped all timers.");
    }

    private static CommandResult notFound(String id) {
        return CommandResult.error("Job " + id + " not found.");
    }
}
