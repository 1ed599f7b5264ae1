package com.channelcast.gateway.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSONL-based delivery ledger (one JSON object per line).
 *
 * <p>
 * File layout:
 * </p>
 *
 * <pre>
 *   ~/.channelcast/deliveries.jsonl
 * </pre>
 *
 * <p>
 * Records and engagement increments are separate entries; increments are folded
 * into their record on read:
 * </p>
 *
 * <pre>
 *   {"type":"delivery","record":{"id":"...","channelId":"@chan1",...}}
 *   {"type":"engagement","recordId":"...","delta":{"views":3,"clicks":0,"reactions":1}}
 * </pre>
 */
@Slf4j
public class JsonlDeliveryLedger implements DeliveryLedger {

    static final String TYPE_DELIVERY = "delivery";
    static final String TYPE_ENGAGEMENT = "engagement";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path ledgerPath;
    private final Set<String> knownIds = new HashSet<>();

    /**
     * @throws LedgerException if an existing ledger file cannot be read
     */
    public JsonlDeliveryLedger(Path ledgerPath) {
        this.ledgerPath = ledgerPath;
        for (DeliveryRecord record : readAll()) {
            knownIds.add(record.id());
        }
        log.debug("Opened delivery ledger {} with {} records", ledgerPath, knownIds.size());
    }

    // =========================================================================
    // Write operations
    // =========================================================================

    @Override
    public synchronized DeliveryRecord append(DeliveryRecord record) {
        ObjectNode entry = MAPPER.createObjectNode();
        entry.put("type", TYPE_DELIVERY);
        entry.set("record", MAPPER.valueToTree(record));
        appendLine(entry);
        knownIds.add(record.id());
        log.debug("Appended delivery {} on {} to ledger", record.id(), record.channelId());
        return record;
    }

    @Override
    public synchronized boolean recordEngagement(String recordId, Engagement delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Engagement counters only increase");
        }
        if (!knownIds.contains(recordId)) {
            return false;
        }
        ObjectNode entry = MAPPER.createObjectNode();
        entry.put("type", TYPE_ENGAGEMENT);
        entry.put("recordId", recordId);
        entry.set("delta", MAPPER.valueToTree(delta));
        appendLine(entry);
        return true;
    }

    private void appendLine(ObjectNode entry) {
        try {
            Path parent = ledgerPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(ledgerPath, MAPPER.writeValueAsString(entry) + "\n",
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to append to delivery ledger {}: {}", ledgerPath, e.getMessage());
            throw new LedgerException("Failed to append to delivery ledger " + ledgerPath, e);
        }
    }

    // =========================================================================
    // Read operations
    // =========================================================================

    @Override
    public synchronized List<DeliveryRecord> read(Instant from, Instant to) {
        return readAll().stream()
                .filter(r -> DeliveryLedger.inWindow(r, from, to))
                .sorted(InMemoryDeliveryLedger.ORDER)
                .collect(Collectors.toList());
    }

    private List<DeliveryRecord> readAll() {
        if (!Files.exists(ledgerPath)) {
            return List.of();
        }
        Map<String, DeliveryRecord> records = new LinkedHashMap<>();
        Map<String, Engagement> pending = new LinkedHashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(ledgerPath, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty())
                    continue;
                try {
                    JsonNode entry = MAPPER.readTree(line);
                    String type = entry.path("type").asText();
                    if (TYPE_DELIVERY.equals(type) && entry.hasNonNull("record")) {
                        DeliveryRecord record = MAPPER.treeToValue(entry.get("record"), DeliveryRecord.class);
                        records.put(record.id(), record);
                    } else if (TYPE_ENGAGEMENT.equals(type) && entry.hasNonNull("delta")) {
                        Engagement delta = MAPPER.treeToValue(entry.get("delta"), Engagement.class);
                        pending.merge(entry.path("recordId").asText(), delta, Engagement::plus);
                    }
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    log.warn("Skipping malformed ledger line {} in {}", lineNo, ledgerPath.getFileName());
                }
            }
        } catch (IOException e) {
            log.error("Failed to read delivery ledger {}: {}", ledgerPath, e.getMessage());
            throw new LedgerException("Failed to read delivery ledger " + ledgerPath, e);
        }
        List<DeliveryRecord> folded = new ArrayList<>(records.size());
        for (DeliveryRecord record : records.values()) {
            Engagement delta = pending.get(record.id());
            folded.add(delta != null ? record.withEngagement(record.engagement().plus(delta)) : record);
        }
        return folded;
    }

    public Path getLedgerPath() {
        return ledgerPath;
    }
}
