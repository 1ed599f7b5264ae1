package com.channelcast.gateway.ledger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

import static com.channelcast.gateway.ledger.InMemoryDeliveryLedgerTest.record;
import static org.junit.jupiter.api.Assertions.*;

class JsonlDeliveryLedgerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void append_survivesReopen() {
        Path file = tempDir.resolve("data/deliveries.jsonl");
        JsonlDeliveryLedger ledger = new JsonlDeliveryLedger(file);
        ledger.append(record("a", "@chan1", T0));
        ledger.append(record("b", "@chan2", T0.plusSeconds(1)));

        List<DeliveryRecord> reopened = new JsonlDeliveryLedger(file).read(null, null);

        assertEquals(2, reopened.size());
        DeliveryRecord first = reopened.get(0);
        assertEquals("a", first.id());
        assertEquals("@chan1", first.channelId());
        assertEquals("ref-a", first.messageRef());
        assertEquals(T0, first.postedAt());
        assertEquals("marketing", first.contentType());
    }

    @Test
    void recordEngagement_deltasFoldedOnRead() throws Exception {
        Path file = tempDir.resolve("deliveries.jsonl");
        JsonlDeliveryLedger ledger = new JsonlDeliveryLedger(file);
        ledger.append(record("a", "@chan1", T0));

        assertTrue(ledger.recordEngagement("a", Engagement.views(10)));
        assertTrue(ledger.recordEngagement("a", new Engagement(5, 1, 2)));

        assertEquals(new Engagement(15, 1, 2), ledger.read(null, null).get(0).engagement());
        assertEquals(3, Files.readAllLines(file).size());
        assertEquals(new Engagement(15, 1, 2), new JsonlDeliveryLedger(file).read(null, null).get(0).engagement());
    }

    @Test
    void recordEngagement_unknownId_writesNothing() throws Exception {
        Path file = tempDir.resolve("deliveries.jsonl");
        JsonlDeliveryLedger ledger = new JsonlDeliveryLedger(file);
        ledger.append(record("a", "@chan1", T0));

        assertFalse(ledger.recordEngagement("nope", Engagement.views(1)));
        assertEquals(1, Files.readAllLines(file).size());
    }

    @Test
    void read_malformedLineSkipped() throws Exception {
        Path file = tempDir.resolve("deliveries.jsonl");
        JsonlDeliveryLedger ledger = new JsonlDeliveryLedger(file);
        ledger.append(record("a", "@chan1", T0));
        Files.writeString(file, "{not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        ledger.append(record("b", "@chan1", T0.plusSeconds(1)));

        assertEquals(List.of("a", "b"), ledger.read(null, null).stream().map(DeliveryRecord::id).toList());
    }

    @Test
    void read_window() {
        JsonlDeliveryLedger ledger = new JsonlDeliveryLedger(tempDir.resolve("deliveries.jsonl"));
        ledger.append(record("a", "@chan1", T0));
        ledger.append(record("b", "@chan1", T0.plusSeconds(3600)));

        assertEquals(List.of("b"), ledger.read(T0.plusSeconds(1), null).stream().map(DeliveryRecord::id).toList());
    }

    @Test
    void read_missingFile_empty() {
        assertTrue(new JsonlDeliveryLedger(tempDir.resolve("none.jsonl")).read(null, null).isEmpty());
    }
}
