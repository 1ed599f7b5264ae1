package com.channelcast.gateway.audit;

import com.channelcast.gateway.ledger.DeliveryRecord;
import com.channelcast.gateway.ledger.InMemoryDeliveryLedger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryAuditorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private static int seq;

    static DeliveryRecord post(String type, String content, String channel, Instant at) {
        seq++;
        return new DeliveryRecord("r" + seq, "job", "title", type, content, channel, "m" + seq, at, null);
    }

    static InMemoryDeliveryLedger ledgerOf(DeliveryRecord... records) {
        InMemoryDeliveryLedger ledger = new InMemoryDeliveryLedger();
        for (DeliveryRecord r : records) {
            ledger.append(r);
        }
        return ledger;
    }

    // =========================================================================
    // coverage
    // =========================================================================

    @Nested
    class Coverage {

        @Test
        void coverage_contentMissingOneChannel_reportsMissingAndRate() {
            DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(
                    post("marketing", "Buy", "A", T0),
                    post("marketing", "Buy", "B", T0.plusSeconds(1))));

            CoverageReport report = auditor.coverage(List.of("A", "B", "C"), T0, T0.plusSeconds(3600));

            assertEquals(1, report.groups().size());
            CoverageReport.Group group = report.groups().get(0);
            assertEquals(List.of("C"), group.missing());
            assertEquals("2/3", group.deliveryRate());
            assertFalse(group.fullyDelivered());
            assertEquals(Set.of("A", "B"), group.deliveredChannels());
            assertEquals(0, report.fullyDelivered());
            assertEquals(1, report.partiallyDelivered());
        }

        @Test
        void coverage_missingListFollowsExpectedOrder() {
            DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(post("t", "x", "B", T0)));

            CoverageReport report = auditor.coverage(List.of("D", "B", "A", "C"), null, null);

            assertEquals(List.of("D", "A", "C"), report.groups().get(0).missing());
            assertEquals("1/4", report.groups().get(0).deliveryRate());
        }

        @Test
        void coverage_unexpectedChannelsNotCountedInRate() {
            DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(
                    post("t", "x", "A", T0),
                    post("t", "x", "Z", T0)));

            CoverageReport.Group group = auditor.coverage(List.of("A", "B"), null, null).groups().get(0);

            assertEquals("1/2", group.deliveryRate());
            assertEquals(Set.of("A", "Z"), group.deliveredChannels());
        }

        @Test
        void coverage_extraChannelsBeyondExpected_rateNeverExceedsExpectedCount() {
            DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(
                    post("t", "x", "A", T0),
                    post("t", "x", "B", T0),
                    post("t", "x", "Y", T0),
                    post("t", "x", "Z", T0)));

            CoverageReport.Group group = auditor.coverage(List.of("A", "B"), null, null).groups().get(0);

            assertEquals("2/2", group.deliveryRate());
            assertTrue(group.missing().isEmpty());
            assertTrue(group.fullyDelivered());
        }

        @Test
        void coverage_fullyDelivered() {
            DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(
                    post("t", "x", "A", T0),
                    post("t", "x", "B", T0),
                    post("t", "y", "A", T0.plusSeconds(60))));

            CoverageReport report = auditor.coverage(List.of("A", "B"), null, null);

            assertEquals(1, report.fullyDelivered());
            assertEquals(1, report.partiallyDelivered());
            // most recent group first
            assertEquals(List.of("B"), report.groups().get(0).missing());
            assertTrue(report.groups().get(1).fullyDelivered());
        }

        @Test
        void coverage_filtersByContentType() {
            DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(
                    post("marketing", "x", "A", T0),
                    post("digest", "x", "A", T0)));

            CoverageReport report = auditor.coverage(List.of("A"), null, null, "digest");

            assertEquals(1, report.groups().size());
            assertEquals("digest", report.groups().get(0).contentType());
        }

        @Test
        void coverage_sameTextDifferentTypes_areDifferentContent() {
            DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(
                    post("marketing", "x", "A", T0),
                    post("digest", "x", "B", T0)));

            assertEquals(2, auditor.coverage(List.of("A", "B"), null, null).groups().size());
        }
    }

    // =========================================================================
    // identity modes
    // =========================================================================

    @Test
    void identity_exactSeparatesTextsSharingLongPrefix_prefixMergesThem() {
        String prefix = "p".repeat(120);
        InMemoryDeliveryLedger ledger = ledgerOf(
                post("t", prefix + " ending one", "A", T0),
                post("t", prefix + " ending two", "B", T0));

        assertEquals(2, new DeliveryAuditor(ledger, ContentIdentity.exact())
                .coverage(List.of("A", "B"), null, null).groups().size());
        assertEquals(1, new DeliveryAuditor(ledger, ContentIdentity.prefix(100))
                .coverage(List.of("A", "B"), null, null).groups().size());
    }

    @Test
    void identity_fromConfig() {
        assertEquals(ContentIdentity.Mode.PREFIX, ContentIdentity.fromConfig("Prefix", 50).mode());
        assertEquals(ContentIdentity.Mode.EXACT, ContentIdentity.fromConfig("exact", 50).mode());
        assertEquals(ContentIdentity.Mode.EXACT, ContentIdentity.fromConfig(null, 0).mode());
    }

    // =========================================================================
    // windowStats
    // =========================================================================

    @Test
    void windowStats_countsByTypeAndChannel() {
        DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(
                post("marketing", "a", "@one", T0),
                post("marketing", "a", "@two", T0),
                post("digest", "b", "@one", T0.plusSeconds(10)),
                post("digest", "c", "@one", T0.plusSeconds(7200))));

        WindowStats stats = auditor.windowStats(T0, T0.plusSeconds(3600));

        assertEquals(3, stats.total());
        assertEquals(2, stats.byType().get("marketing").count());
        assertEquals(Set.of("@one", "@two"), stats.byType().get("marketing").channels());
        assertEquals(1, stats.byType().get("digest").count());
        assertEquals(2, stats.byChannel().get("@one").total());
        assertEquals(Map.of("marketing", 1, "digest", 1), stats.byChannel().get("@one").byType());
        assertEquals(List.of("@one", "@two"), List.copyOf(stats.uniqueChannels()));
    }

    @Test
    void windowStats_sameLedgerContentsInAnyOrder_sameResult() {
        DeliveryRecord a = post("marketing", "a", "@two", T0);
        DeliveryRecord b = post("digest", "b", "@one", T0.plusSeconds(1));
        DeliveryRecord c = post(null, "c", "@three", T0.plusSeconds(2));

        WindowStats first = new DeliveryAuditor(ledgerOf(a, b, c)).windowStats(null, null);
        WindowStats second = new DeliveryAuditor(ledgerOf(c, a, b)).windowStats(null, null);

        assertEquals(first, second);
        assertEquals(List.of("digest", "marketing", "unknown"), List.copyOf(first.byType().keySet()));
        assertEquals(List.of("@one", "@three", "@two"), List.copyOf(first.byChannel().keySet()));
    }

    @Test
    void windowStats_emptyLedger() {
        WindowStats stats = new DeliveryAuditor(new InMemoryDeliveryLedger()).windowStats(null, null);

        assertEquals(0, stats.total());
        assertTrue(stats.byType().isEmpty());
        assertTrue(stats.uniqueChannels().isEmpty());
    }

    // =========================================================================
    // partition
    // =========================================================================

    @Test
    void partition_splitsMultiAndSingleChannelContent() {
        DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(
                post("t", "everywhere", "A", T0),
                post("t", "everywhere", "B", T0),
                post("t", "only A", "A", T0.plusSeconds(5)),
                post("t", "only A", "A", T0.plusSeconds(6))));

        ChannelPartitionReport report = auditor.partition(null, null, 0);

        assertEquals(4, report.recordsScanned());
        assertEquals(2, report.uniqueContent());
        assertEquals(1, report.multiChannel().size());
        assertEquals(2, report.multiChannel().get(0).channelCount());
        assertEquals(List.of("A", "B"), List.copyOf(report.multiChannel().get(0).channels()));
        assertEquals(1, report.singleChannel().size());
        assertEquals("only A", report.singleChannel().get(0).preview());
    }

    @Test
    void partition_limitKeepsMostRecentRecords() {
        DeliveryAuditor auditor = new DeliveryAuditor(ledgerOf(
                post("t", "old", "A", T0),
                post("t", "old", "B", T0),
                post("t", "new", "A", T0.plusSeconds(60))));

        ChannelPartitionReport report = auditor.partition(null, null, 1);

        assertEquals(1, report.recordsScanned());
        assertTrue(report.multiChannel().isEmpty());
        assertEquals("new", report.singleChannel().get(0).preview());
    }

    @Test
    void preview_truncatesLongContent() {
        String longText = "x".repeat(150);

        assertEquals("x".repeat(100) + "...", DeliveryAuditor.preview(longText));
        assertEquals("short", DeliveryAuditor.preview("short"));
    }
}
