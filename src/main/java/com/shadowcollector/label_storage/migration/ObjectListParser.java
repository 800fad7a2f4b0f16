/**
 * Parses exported bucket listings
 *
 * Features:
 * - Accepts a single JSON array of entries
 * - Falls back to one JSON object per line when the array does not parse
 * - Skips blank and malformed lines without aborting
 * - Drops entries that carry no key
 */

package com.shadowcollector.label_storage.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowcollector.label_storage.types.ObjectEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class ObjectListParser {

    private static final Logger logger = LoggerFactory.getLogger(ObjectListParser.class);

    private static final TypeReference<List<ObjectEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ObjectListParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ObjectEntry> parseListing(Path listingFile) throws IOException {
        String content = Files.readString(listingFile, StandardCharsets.UTF_8);
        List<ObjectEntry> entries = parseListing(content);
        logger.info("Read {} object entries from {}", entries.size(), listingFile);
        return entries;
    }

    public List<ObjectEntry> parseListing(String content) {
        if (content == null) {
            return List.of();
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }

        if (trimmed.startsWith("[")) {
            try {
                List<ObjectEntry> entries = objectMapper.readValue(trimmed, ENTRY_LIST);
                return withKeys(entries);
            } catch (JsonProcessingException e) {
                logger.warn("Listing is not a valid JSON array, reading it line by line: {}", e.getOriginalMessage());
            }
        }

        List<ObjectEntry> entries = new ArrayList<>();
        int skipped = 0;
        for (String line : trimmed.split("\n")) {
            String candidate = line.trim();
            if (candidate.isEmpty()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(candidate, ObjectEntry.class));
            } catch (JsonProcessingException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            logger.warn("Skipped {} malformed listing line(s)", skipped);
        }
        return withKeys(entries);
    }

    private static List<ObjectEntry> withKeys(List<ObjectEntry> entries) {
        if (entries == null) {
            return List.of();
        }
        return entries.stream()
            .filter(entry -> entry != null && entry.key() != null && !entry.key().isEmpty())
            .collect(Collectors.toList());
    }
}
