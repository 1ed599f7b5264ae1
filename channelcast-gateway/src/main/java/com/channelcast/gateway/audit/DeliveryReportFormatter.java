package com.channelcast.gateway.audit;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Renders audit reports as plain operator text.
 */
public final class DeliveryReportFormatter {

    private static final String RULE = "─".repeat(48);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);
    static final int RECENT_MULTI_CHANNEL = 5;

    private DeliveryReportFormatter() {
    }

    /**
     * Combined stats and multi-channel report.
     *
     * @param period human label for the window, e.g. {@code "Last 24 hours"}
     */
    public static String formatReport(String period, WindowStats stats, ChannelPartitionReport partition) {
        StringBuilder sb = new StringBuilder();
        sb.append("MULTI-CHANNEL DELIVERY REPORT\n");
        sb.append(RULE).append('\n');
        sb.append("Period: ").append(period).append('\n');
        sb.append("Total messages: ").append(stats.total()).append('\n');
        sb.append("Active channels: ").append(stats.uniqueChannels().size()).append("\n\n");

        sb.append("Messages by type:\n");
        if (stats.byType().isEmpty()) {
            sb.append("  (none)\n");
        }
        for (Map.Entry<String, WindowStats.TypeStats> e : stats.byType().entrySet()) {
            sb.append(String.format("  %-20s %d msgs → %d channels%n", e.getKey(), e.getValue().count(),
                    e.getValue().channelCount()));
        }

        sb.append("\nMessages by channel:\n");
        if (stats.byChannel().isEmpty()) {
            sb.append("  (none)\n");
        }
        for (Map.Entry<String, WindowStats.ChannelStats> e : stats.byChannel().entrySet()) {
            sb.append("  ").append(e.getKey()).append(": ").append(e.getValue().total()).append(" total\n");
            e.getValue().byType().forEach((type, count) ->
                    sb.append("    └─ ").append(type).append(": ").append(count).append('\n'));
        }

        sb.append('\n').append(formatPartition(partition));
        return sb.toString();
    }

    public static String formatStats(String period, WindowStats stats) {
        StringBuilder sb = new StringBuilder();
        sb.append("Delivery stats (").append(period).append(")\n");
        sb.append("Total: ").append(stats.total())
                .append(", channels: ").append(String.join(", ", stats.uniqueChannels()))
                .append('\n');
        stats.byType().forEach((type, ts) -> sb.append("  ").append(type).append(": ")
                .append(ts.count()).append(" → ").append(String.join(", ", ts.channels())).append('\n'));
        return sb.toString();
    }

    public static String formatPartition(ChannelPartitionReport partition) {
        StringBuilder sb = new StringBuilder();
        sb.append("Scanned ").append(partition.recordsScanned()).append(" records, ")
                .append(partition.uniqueContent()).append(" unique content\n");
        sb.append("Multi-channel deliveries: ").append(partition.multiChannel().size()).append('\n');
        sb.append("Single-channel only: ").append(partition.singleChannel().size()).append('\n');
        List<ChannelPartitionReport.Group> recent = partition.multiChannel().stream()
                .limit(RECENT_MULTI_CHANNEL)
                .toList();
        if (!recent.isEmpty()) {
            sb.append("\nRecent multi-channel posts:\n");
            int i = 1;
            for (ChannelPartitionReport.Group g : recent) {
                sb.append("  ").append(i++).append(". [").append(g.contentType()).append("] ")
                        .append(TIME.format(g.lastPostedAt())).append('\n');
                sb.append("     Channels: ").append(String.join(", ", g.channels())).append('\n');
                sb.append("     \"").append(g.preview()).append("\"\n");
            }
        }
        return sb.toString();
    }

    public static String formatCoverage(CoverageReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Delivery verification");
        if (report.contentType() != null) {
            sb.append(" [").append(report.contentType()).append(']');
        }
        sb.append('\n');
        sb.append("Expected channels: ").append(String.join(", ", report.expectedChannels())).append('\n');
        sb.append("Content: ").append(report.groups().size())
                .append(", fully delivered: ").append(report.fullyDelivered())
                .append(", partial: ").append(report.partiallyDelivered()).append('\n');
        for (CoverageReport.Group g : report.groups()) {
            sb.append(g.fullyDelivered() ? "  OK   " : "  MISS ")
                    .append(g.deliveryRate()).append(" [").append(g.contentType()).append("] ")
                    .append(TIME.format(g.lastPostedAt()));
            if (!g.missing().isEmpty()) {
                sb.append(" missing ").append(String.join(", ", g.missing()));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
