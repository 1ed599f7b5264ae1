package com.channelcast.gateway.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Locale;

/**
 * What a job publishes. Closed set of variants; the scheduler resolves each
 * variant to text through a {@code ContentResolver}.
 * <p>
 * Stored as JSON with a {@code kind} discriminator, e.g.
 * {@code {"kind":"generated","prompt":"...","maxTokens":200}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JobPayload.StaticContent.class, name = "static"),
        @JsonSubTypes.Type(value = JobPayload.GeneratedContent.class, name = "generated"),
        @JsonSubTypes.Type(value = JobPayload.MarketDerived.class, name = "market"),
        @JsonSubTypes.Type(value = JobPayload.TemplateRotation.class, name = "rotation")
})
public sealed interface JobPayload permits JobPayload.StaticContent, JobPayload.GeneratedContent,
        JobPayload.MarketDerived, JobPayload.TemplateRotation {

    /** Fixed text published as-is. */
    record StaticContent(@JsonProperty("text") String text) implements JobPayload {
    }

    /** Text produced by an AI text generator from a prompt. */
    record GeneratedContent(
            @JsonProperty("prompt") String prompt,
            @JsonProperty("maxTokens") Integer maxTokens,
            @JsonProperty("temperature") Double temperature) implements JobPayload {

        public static final int DEFAULT_MAX_TOKENS = 220;
        public static final double DEFAULT_TEMPERATURE = 0.8;

        public GeneratedContent {
            if (maxTokens == null || maxTokens <= 0) {
                maxTokens = DEFAULT_MAX_TOKENS;
            }
            if (temperature == null) {
                temperature = DEFAULT_TEMPERATURE;
            }
        }
    }

    /** Text rendered from live market data. */
    record MarketDerived(@JsonProperty("market") MarketKind market) implements JobPayload {
    }

    /** Next entry of a named template set, advancing one position per firing. */
    record TemplateRotation(@JsonProperty("templateSet") String templateSet) implements JobPayload {
    }

    enum MarketKind {
        DIGEST, TRENDING, WHALE, MOVERS, QUICK_UPDATE;

        @JsonCreator
        public static MarketKind fromKey(String key) {
            if (key == null) {
                return null;
            }
            return valueOf(key.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        }
    }
}
