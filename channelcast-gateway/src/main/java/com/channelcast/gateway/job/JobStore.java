package com.channelcast.gateway.job;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable CRUD over job definitions.
 * <p>
 * Every returned definition is a copy; mutations only reach the store through
 * {@link #update(String, Consumer)}. Failures of the underlying storage surface
 * as {@link JobStoreException}.
 */
public interface JobStore {

    /**
     * Persist a new job. Assigns an id when absent and stamps
     * {@code createdAt}/{@code updatedAt}.
     *
     * @throws IllegalArgumentException if the id is already taken
     */
    JobDefinition insert(JobDefinition job);

    Optional<JobDefinition> findById(String id);

    Optional<JobDefinition> findByName(String name);

    List<JobDefinition> find(JobQuery query);

    default List<JobDefinition> findAll() {
        return find(JobQuery.all());
    }

    /**
     * Apply {@code mutation} to the stored job and persist it, stamping
     * {@code updatedAt}.
     *
     * @return the updated definition
     * @throws JobNotFoundException if no job has this id
     */
    JobDefinition update(String id, Consumer<JobDefinition> mutation);

    boolean delete(String id);

    /**
     * @return the number of jobs deleted
     */
    int deleteAll();
}
