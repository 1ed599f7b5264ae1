package com.channelcast.gateway.content;

import com.channelcast.gateway.job.JobPayload.MarketKind;

/**
 * Renders posts from live market data (digest, trending coins, whale moves, ...).
 */
@FunctionalInterface
public interface MarketContentSource {

    /**
     * @return the rendered post, or an empty string when there is nothing worth
     *         posting (e.g. no whale transfers in the window)
     */
    String render(MarketKind kind) throws ContentResolutionException;
}
