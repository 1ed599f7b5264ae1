package com.channelcast.gateway.job;

import com.channelcast.common.infra.JsonFile;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Job store backed by a single JSON file.
 * <p>
 * File layout:
 *
 * <pre>
 *   {"version":1,"savedAt":"...","jobs":{"a1b2c3d4":{...},...}}
 * </pre>
 *
 * The whole file is rewritten atomically on every mutation. Reads are served
 * from memory.
 */
@Slf4j
public class JsonFileJobStore implements JobStore {

    static final int STORE_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path storePath;
    private final Clock clock;
    private final Map<String, JobDefinition> jobs = new LinkedHashMap<>();

    public JsonFileJobStore(Path storePath) {
        this(storePath, Clock.systemUTC());
    }

    /**
     * @throws JobStoreException if an existing store file cannot be read
     */
    public JsonFileJobStore(Path storePath, Clock clock) {
        this.storePath = storePath;
        this.clock = clock;
        load();
    }

    @Override
    public synchronized JobDefinition insert(JobDefinition job) {
        JobDefinition stored = job.copy();
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(newId());
        } else if (jobs.containsKey(stored.getId())) {
            throw new IllegalArgumentException("Job id already exists: " + stored.getId());
        }
        Instant now = clock.instant();
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(now);
        }
        stored.setUpdatedAt(now);
        jobs.put(stored.getId(), stored);
        try {
            persist();
        } catch (JobStoreException e) {
            jobs.remove(stored.getId());
            throw e;
        }
        log.debug("Inserted job {} ({})", stored.getId(), stored.getName());
        return stored.copy();
    }

    @Override
    public synchronized Optional<JobDefinition> findById(String id) {
        JobDefinition job = id != null ? jobs.get(id) : null;
        return Optional.ofNullable(job).map(JobDefinition::copy);
    }

    @Override
    public synchronized Optional<JobDefinition> findByName(String name) {
        return jobs.values().stream()
                .filter(j -> name != null && name.equals(j.getName()))
                .findFirst()
                .map(JobDefinition::copy);
    }

    @Override
    public synchronized List<JobDefinition> find(JobQuery query) {
        JobQuery q = query != null ? query : JobQuery.all();
        var stream = jobs.values().stream()
                .filter(q::matches)
                .sorted(q.comparator());
        if (q.limit() > 0) {
            stream = stream.limit(q.limit());
        }
        return stream.map(JobDefinition::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized JobDefinition update(String id, Consumer<JobDefinition> mutation) {
        JobDefinition current = id != null ? jobs.get(id) : null;
        if (current == null) {
            throw new JobNotFoundException(id);
        }
        JobDefinition updated = current.copy();
        mutation.accept(updated);
        updated.setId(current.getId());
        updated.setUpdatedAt(clock.instant());
        jobs.put(id, updated);
        try {
            persist();
        } catch (JobStoreException e) {
            jobs.put(id, current);
            throw e;
        }
        return updated.copy();
    }

    @Override
    public synchronized boolean delete(String id) {
        JobDefinition removed = id != null ? jobs.remove(id) : null;
        if (removed == null) {
            return false;
        }
        try {
            persist();
        } catch (JobStoreException e) {
            jobs.put(id, removed);
            throw e;
        }
        return true;
    }

    @Override
    public synchronized int deleteAll() {
        Map<String, JobDefinition> snapshot = new LinkedHashMap<>(jobs);
        jobs.clear();
        try {
            persist();
        } catch (JobStoreException e) {
            jobs.putAll(snapshot);
            throw e;
        }
        return snapshot.size();
    }

    public Path getStorePath() {
        return storePath;
    }

    // --- Persistence ---

    private void load() {
        if (!Files.exists(storePath)) {
            log.debug("Job store file not found: {}", storePath);
            return;
        }
        try {
            String content = Files.readString(storePath);
            if (content.isBlank()) {
                return;
            }
            JsonNode root = MAPPER.readTree(content);
            JsonNode jobsNode = root.path("jobs");
            Iterator<Map.Entry<String, JsonNode>> fields = jobsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                JobDefinition job = MAPPER.treeToValue(entry.getValue(), JobDefinition.class);
                if (job.getId() == null) {
                    job.setId(entry.getKey());
                }
                if (job.getChannelIds() == null) {
                    job.setChannelIds(new ArrayList<>());
                }
                jobs.put(job.getId(), job);
            }
            log.info("Loaded {} jobs from {}", jobs.size(), storePath);
        } catch (IOException | IllegalArgumentException e) {
            throw new JobStoreException("Failed to load job store from " + storePath, e);
        }
    }

    private void persist() {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("version", STORE_VERSION);
        output.put("savedAt", clock.instant().toString());
        output.put("jobs", jobs);
        try {
            JsonFile.saveAtomic(MAPPER, storePath, output);
        } catch (IOException e) {
            log.error("Failed to save job store to {}: {}", storePath, e.getMessage());
            throw new JobStoreException("Failed to save job store to " + storePath, e);
        }
    }

    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, 8);
        } while (jobs.containsKey(id));
        return id;
    }
}
