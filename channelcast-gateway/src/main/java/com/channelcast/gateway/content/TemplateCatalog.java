package com.channelcast.gateway.content;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named sets of ready-made posts, handed out round-robin.
 * <p>
 * Each set keeps its own cursor, so consecutive firings of a rotation job
 * publish consecutive templates and wrap around at the end.
 */
public class TemplateCatalog {

    private final Map<String, List<String>> sets;
    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    public TemplateCatalog(Map<String, List<String>> sets) {
        this.sets = Map.copyOf(sets);
    }

    public static TemplateCatalog empty() {
        return new TemplateCatalog(Map.of());
    }

    /**
     * Load sets from a classpath JSON object of the form
     * {@code {"setName": ["first post", "second post"]}}. A missing resource
     * yields an empty catalog.
     */
    public static TemplateCatalog fromResource(String resource) throws IOException {
        ClassLoader loader = TemplateCatalog.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                return empty();
            }
            Map<String, List<String>> sets = new ObjectMapper().readValue(in,
                    new TypeReference<Map<String, List<String>>>() {
                    });
            return new TemplateCatalog(sets);
        }
    }

    /**
     * @throws ContentResolutionException if the set is unknown or empty
     */
    public String next(String setName) throws ContentResolutionException {
        List<String> templates = setName != null ? sets.get(setName) : null;
        if (templates == null || templates.isEmpty()) {
            throw new ContentResolutionException("Unknown or empty template set: " + setName);
        }
        int position = cursors.computeIfAbsent(setName, k -> new AtomicInteger()).getAndIncrement();
        return templates.get(Math.floorMod(position, templates.size()));
    }

    public Set<String> setNames() {
        return sets.keySet();
    }

    public int size(String setName) {
        List<String> templates = sets.get(setName);
        return templates != null ? templates.size() : 0;
    }
}
