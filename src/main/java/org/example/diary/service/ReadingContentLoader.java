package org.example.diary.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.diary.model.ReadingContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads reading records produced upstream (a scraper, a manual export) from a JSON file
 * holding either one object or an array of objects.
 */
@Service
public class ReadingContentLoader {

    private static final Logger log = LoggerFactory.getLogger(ReadingContentLoader.class);

    private final ObjectMapper objectMapper;

    public ReadingContentLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ReadingContent> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Reading file not found: " + path);
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            List<ReadingContent> readings = new ArrayList<>();
            if (root.isArray()) {
                for (JsonNode node : root) {
                    readings.add(objectMapper.treeToValue(node, ReadingContent.class));
                }
            } else if (root.isObject()) {
                readings.add(objectMapper.treeToValue(root, ReadingContent.class));
            } else {
                throw new IllegalArgumentException("Reading file must hold a JSON object or array: " + path);
            }
            log.info("Loaded {} reading(s) from {}", readings.size(), path);
            return readings;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read reading file " + path, e);
        }
    }
}
