package com.channelcast.gateway.job;

/**
 * What a firing does when its content cannot be resolved.
 */
public enum ResolutionFailurePolicy {
    /** Post nothing for this firing. */
    SKIP,
    /** Post the job's fallback text instead. */
    FALLBACK
}
