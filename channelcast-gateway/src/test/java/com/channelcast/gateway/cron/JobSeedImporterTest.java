package com.channelcast.gateway.cron;

import com.channelcast.gateway.content.PayloadContentResolver;
import com.channelcast.gateway.job.JobDefinition;
import com.channelcast.gateway.job.JobPayload;
import com.channelcast.gateway.job.JsonFileJobStore;
import com.channelcast.gateway.job.RetryPolicy;
import com.channelcast.gateway.ledger.InMemoryDeliveryLedger;
import com.channelcast.gateway.outbound.DeliveryFanout;
import com.channelcast.gateway.outbound.ScriptedTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobSeedImporterTest {

    @TempDir
    Path tempDir;

    private JsonFileJobStore store;
    private JobScheduler scheduler;
    private JobSeedImporter importer;

    @BeforeEach
    void setUp() {
        ManualTriggerTimers timers = new ManualTriggerTimers(Instant.parse("2024-01-15T10:00:00Z"));
        store = new JsonFileJobStore(tempDir.resolve("jobs.json"), timers.clock());
        DeliveryFanout fanout = new DeliveryFanout(new ScriptedTransport(), new InMemoryDeliveryLedger(), 1);
        scheduler = new JobScheduler(store, new PayloadContentResolver(null, null, null), fanout,
                new SpringCronTrigger(), timers, SchedulerSettings.defaults());
        importer = new JobSeedImporter(scheduler, store);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void readSeeds_parsesPayloadVariants() throws Exception {
        List<JobDefinition> seeds = JobSeedImporter.readSeeds("seeds/test-seeds.json");

        assertEquals(3, seeds.size());
        assertEquals(new JobPayload.StaticContent("Good morning!"), seeds.get(0).getPayload());
        assertEquals(new RetryPolicy(3, 5), seeds.get(0).getRetryPolicy());
        assertEquals(new JobPayload.MarketDerived(JobPayload.MarketKind.DIGEST), seeds.get(1).getPayload());
        assertTrue(seeds.get(1).isAppendFooter());
        assertEquals(RetryPolicy.DEFAULT, seeds.get(1).getRetryPolicy());
    }

    @Test
    void importResource_createsValidSeedsAndReportsInvalidOnes() throws Exception {
        JobSeedImporter.ImportResult result = importer.importResource("seeds/test-seeds.json", "operator");

        assertEquals(List.of("Morning greeting", "Hourly digest"), result.created());
        assertTrue(result.skipped().isEmpty());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Broken"));
        assertEquals(2, scheduler.armedJobIds().size());
        assertEquals("operator", store.findByName("Hourly digest").orElseThrow().getCreatedBy());
        assertEquals("Europe/London", store.findByName("Hourly digest").orElseThrow().getTimezone());
    }

    @Test
    void importResource_twice_skipsExistingNames() throws Exception {
        importer.importResource("seeds/test-seeds.json", "operator");

        JobSeedImporter.ImportResult second = importer.importResource("seeds/test-seeds.json", "operator");

        assertTrue(second.created().isEmpty());
        assertEquals(List.of("Morning greeting", "Hourly digest"), second.skipped());
        assertEquals(2, store.findAll().size());
    }

    @Test
    void importResource_missing_throws() {
        assertThrows(FileNotFoundException.class, () -> importer.importResource("seeds/none.json", "operator"));
    }
}
