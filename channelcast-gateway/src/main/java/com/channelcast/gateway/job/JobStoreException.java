package com.channelcast.gateway.job;

/**
 * The durable job store could not be read or written.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
