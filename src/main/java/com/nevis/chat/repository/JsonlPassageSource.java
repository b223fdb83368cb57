package com.nevis.chat.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.chat.config.CorpusProperties;
import com.nevis.chat.model.Passage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads passages from a line-delimited JSON file. Lines that are not valid JSON objects are skipped;
 * incomplete records are returned as-is and dropped by the index build.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JsonlPassageSource implements PassageSource {

    private final ObjectMapper objectMapper;
    private final CorpusProperties corpusProperties;

    @Override
    public String location() {
        return Path.of(corpusProperties.path()).toAbsolutePath().normalize().toString();
    }

    @Override
    public List<Passage> loadAll() {
        Path path = Path.of(corpusProperties.path());
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read corpus file " + path.toAbsolutePath(), e);
        }

        List<Passage> passages = new ArrayList<>(lines.size());
        int malformed = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                JsonNode node = objectMapper.readTree(line);
                if (node != null && node.isObject()) {
                    passages.add(toPassage(node));
                } else {
                    malformed++;
                }
            } catch (JsonProcessingException e) {
                malformed++;
            }
        }

        if (malformed > 0) {
            log.warn("Skipped {} malformed lines in {}", malformed, path);
        }
        log.debug("Read {} passage records from {}", passages.size(), path);
        return passages;
    }

    private Passage toPassage(JsonNode node) {
        List<String> headingPath = new ArrayList<>();
        JsonNode headings = node.path("heading_path");
        if (headings.isArray()) {
            headings.forEach(h -> {
                if (h.isTextual() && !h.asText().isBlank()) {
                    headingPath.add(h.asText().trim());
                }
            });
        }

        return new Passage(
            text(node, "chunk_id"),
            text(node, "doc_id"),
            text(node, "url"),
            text(node, "title"),
            text(node, "section"),
            List.copyOf(headingPath),
            text(node, "text"),
            text(node, "source"),
            text(node, "source_host")
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }
}
