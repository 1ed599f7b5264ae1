package com.channelcast.gateway.content;

import com.channelcast.gateway.job.JobPayload;

/**
 * Turns a job payload into the text to publish. Invoked once per firing.
 */
@FunctionalInterface
public interface ContentResolver {

    /**
     * @return the text to publish; empty or {@code null} means there is nothing
     *         to publish this time
     */
    String resolve(JobPayload payload) throws ContentResolutionException;
}
