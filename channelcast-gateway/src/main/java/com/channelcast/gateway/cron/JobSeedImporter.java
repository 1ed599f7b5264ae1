package com.channelcast.gateway.cron;

import com.channelcast.gateway.job.JobDefinition;
import com.channelcast.gateway.job.JobStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Bulk-creates jobs from a seed list, skipping seeds whose name already exists.
 */
@Slf4j
public class JobSeedImporter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * @param created names of jobs created
     * @param skipped names of seeds that already existed
     * @param errors  one message per seed that was rejected
     */
    public record ImportResult(List<String> created, List<String> skipped, List<String> errors) {
    }

    private final JobScheduler scheduler;
    private final JobStore store;

    public JobSeedImporter(JobScheduler scheduler, JobStore store) {
        this.scheduler = scheduler;
        this.store = store;
    }

    public ImportResult importSeeds(List<JobDefinition> seeds, String createdBy) {
        List<String> created = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (JobDefinition seed : seeds) {
            String name = seed.getName();
            if (name != null && store.findByName(name).isPresent()) {
                skipped.add(name);
                continue;
            }
            JobDefinition job = seed.copy();
            job.setId(null);
            job.setCreatedBy(createdBy);
            try {
                created.add(scheduler.create(job).getName());
            } catch (IllegalArgumentException e) {
                log.warn("Rejected seed job '{}': {}", name, e.getMessage());
                errors.add(name + ": " + e.getMessage());
            }
        }
        log.info("Seed import: {} created, {} skipped, {} rejected", created.size(), skipped.size(), errors.size());
        return new ImportResult(created, skipped, errors);
    }

    /**
     * Import the JSON array of job definitions in a classpath resource.
     *
     * @throws FileNotFoundException if the resource does not exist
     */
    public ImportResult importResource(String resource, String createdBy) throws IOException {
        return importSeeds(readSeeds(resource), createdBy);
    }

    public static List<JobDefinition> readSeeds(String resource) throws IOException {
        try (InputStream in = JobSeedImporter.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileNotFoundException("Seed resource not found: " + resource);
            }
            return readSeeds(in);
        }
    }

    public static List<JobDefinition> readSeeds(InputStream in) throws IOException {
        return MAPPER.readValue(in, new TypeReference<List<JobDefinition>>() {
        });
    }
}
