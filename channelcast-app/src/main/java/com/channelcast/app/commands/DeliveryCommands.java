package com.channelcast.app.commands;

import com.channelcast.common.config.ChannelCastConfig;
import com.channelcast.gateway.audit.ChannelPartitionReport;
import com.channelcast.gateway.audit.CoverageReport;
import com.channelcast.gateway.audit.DeliveryAuditor;
import com.channelcast.gateway.audit.DeliveryReportFormatter;
import com.channelcast.gateway.audit.WindowStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Delivery audit commands: /check_delivery, /verify_delivery,
 * /verify_multichannel, /delivery_report.
 */
@Slf4j
@Component
public class DeliveryCommands {

    static final int DEFAULT_STATS_HOURS = 24;
    static final int DEFAULT_VERIFY_HOURS = 6;

    private final DeliveryAuditor auditor;
    private final Clock clock;

    public DeliveryCommands(DeliveryAuditor auditor, Clock clock) {
        this.auditor = auditor;
        this.clock = clock;
    }

    /** {@code /check_delivery [hours]} */
    public CommandResult handleCheck(String args, CommandContext ctx) {
        int hours = CommandArgs.leadingInt(args, DEFAULT_STATS_HOURS);
        Instant to = clock.instant();
        WindowStats stats = auditor.windowStats(windowStart(to, hours), to);
        return CommandResult.text(DeliveryReportFormatter.formatStats(period(hours), stats));
    }

    /** {@code /verify_delivery [hours] [contentType]} */
    public CommandResult handleVerify(String args, CommandContext ctx) {
        List<String> expected = expectedChannels(ctx.config());
        if (expected.isEmpty()) {
            return CommandResult.error("No expected channels configured (audit.expectedChannels or channels.defaultIds).");
        }
        int hours = CommandArgs.leadingInt(args, DEFAULT_VERIFY_HOURS);
        String contentType = CommandArgs.secondToken(args);
        Instant to = clock.instant();
        CoverageReport report = auditor.coverage(expected, windowStart(to, hours), to, contentType);
        return CommandResult.text("Coverage (" + period(hours) + ")\n"
                + DeliveryReportFormatter.formatCoverage(report));
    }

    /** {@code /verify_multichannel [hours]} */
    public CommandResult handleVerifyMultichannel(String args, CommandContext ctx) {
        int hours = CommandArgs.leadingInt(args, DEFAULT_VERIFY_HOURS);
        Instant to = clock.instant();
        ChannelPartitionReport partition = auditor.partition(windowStart(to, hours), to,
                DeliveryAuditor.DEFAULT_PARTITION_LIMIT);
        List<String> expected = expectedChannels(ctx.config());
        StringBuilder sb = new StringBuilder("Multi-channel verification (").append(period(hours)).append(")\n");
        sb.append(DeliveryReportFormatter.formatPartition(partition));
        if (!expected.isEmpty()) {
            sb.append("\nExpected channels: ").append(String.join(", ", expected));
        }
        return CommandResult.text(sb.toString());
    }

    /** {@code /delivery_report [hours]}; the report is also written to the log. */
    public CommandResult handleReport(String args, CommandContext ctx) {
        int hours = CommandArgs.leadingInt(args, DEFAULT_STATS_HOURS);
        Instant to = clock.instant();
        Instant from = windowStart(to, hours);
        String report = DeliveryReportFormatter.formatReport(period(hours), auditor.windowStats(from, to),
                auditor.partition(from, to, DeliveryAuditor.DEFAULT_PARTITION_LIMIT));
        log.info("Delivery report requested by {}:\n{}", ctx.senderId(), report);
        return CommandResult.text(report);
    }

    static List<String> expectedChannels(ChannelCastConfig config) {
        List<String> expected = config.getAudit().getExpectedChannels();
        if (expected != null && !expected.isEmpty()) {
            return expected;
        }
        List<String> defaults = config.getChannels().getDefaultIds();
        return defaults != null ? defaults : List.of();
    }

    private static Instant windowStart(Instant to, int hours) {
        return to.minus(Duration.ofHours(hours));
    }

    private static String period(int hours) {
        return "last " + hours + "h";
    }
}
