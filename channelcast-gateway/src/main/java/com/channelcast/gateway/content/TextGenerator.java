package com.channelcast.gateway.content;

/**
 * AI text generation backend.
 */
@FunctionalInterface
public interface TextGenerator {

    String generate(String prompt, int maxTokens, double temperature) throws ContentResolutionException;
}
