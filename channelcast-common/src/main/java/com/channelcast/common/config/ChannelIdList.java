package com.channelcast.common.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Parses channel id lists given either as a JSON array or a comma-separated
 * string, e.g. {@code ["@a","@b"]} or {@code @a, @b}.
 */
@Slf4j
public final class ChannelIdList {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ChannelIdList() {
    }

    public static List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("[")) {
            try {
                List<Object> values = MAPPER.readValue(trimmed, new TypeReference<List<Object>>() {
                });
                List<String> ids = new ArrayList<>();
                for (Object value : values) {
                    if (value != null) {
                        ids.add(String.valueOf(value));
                    }
                }
                return normalize(ids);
            } catch (Exception e) {
                log.error("Failed to parse channel id list {}: {}", trimmed, e.getMessage());
                return List.of();
            }
        }
        return normalize(List.of(trimmed.split(",")));
    }

    /**
     * Trim, drop blanks and duplicates, keep first-seen order.
     */
    public static List<String> normalize(Collection<String> ids) {
        if (ids == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                out.add(id.trim());
            }
        }
        return List.copyOf(out);
    }
}
