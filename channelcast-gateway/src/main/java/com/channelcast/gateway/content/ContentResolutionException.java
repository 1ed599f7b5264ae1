package com.channelcast.gateway.content;

/**
 * Content for a firing could not be produced. Aborts that firing only.
 */
public class ContentResolutionException extends Exception {

    public ContentResolutionException(String message) {
        super(message);
    }

    public ContentResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
