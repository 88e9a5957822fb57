package com.app.cinematch.embedding;

import com.app.cinematch.exception.DataUnavailableException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads the index from a JSON object of the form {@code {"<movieId>": <row>, ...}}.
 */
@Slf4j
public class JsonIndexSource implements IndexSource {

    private static final TypeReference<Map<String, Integer>> INDEX_TYPE = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonIndexSource(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<Long, Integer> load() {
        if (!Files.isRegularFile(path)) {
            throw new DataUnavailableException("Embedding index not found: " + path);
        }

        Map<String, Integer> raw;
        try {
            raw = objectMapper.readValue(path.toFile(), INDEX_TYPE);
        } catch (IOException e) {
            throw new DataUnavailableException("Failed to read embedding index " + path, e);
        }
        if (raw == null || raw.isEmpty()) {
            throw new DataUnavailableException("Embedding index " + path + " is empty");
        }

        Map<Long, Integer> index = new HashMap<>(raw.size());
        for (Map.Entry<String, Integer> entry : raw.entrySet()) {
            try {
                index.put(Long.parseLong(entry.getKey().trim()), entry.getValue());
            } catch (NumberFormatException e) {
                throw new DataUnavailableException("Invalid movie id '" + entry.getKey() + "' in " + path, e);
            }
        }
        log.info("Read {} index entries from {}", index.size(), path);
        return index;
    }
}
