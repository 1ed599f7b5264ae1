package com.channelcast.app.commands;

import org.springframework.stereotype.Component;

/**
 * /help.
 */
@Component
public class InfoCommands {

    public CommandResult handleHelp(String args, CommandContext ctx) {
        return CommandResult.text("""
                ChannelCast commands

                Jobs
                /job_create <name> || <cron> || <type> || <content|gemini:prompt>
                /job_list - list scheduled jobs
                /job_pause <id> - stop a job's timer
                /job_resume <id> - re-arm a paused job
                /job_reschedule <id> || <cron> - change a job's schedule
                /job_run <id> - fire a job now
                /job_remove <id> - delete a job
                /seed_jobs - import the bundled seed jobs
                /clear_jobs - delete every job (asks for confirmation)

                Delivery audit
                /check_delivery [hours] - message counts by type and channel
                /verify_delivery [hours] [type] - coverage against expected channels
                /verify_multichannel [hours] - multi vs single channel posts
                /delivery_report [hours] - full report, also logged
                """);
    }
}
