package com.yearlylikes.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads artist names from a file: a JSON array of strings, or plain text with one name per line
 * ({@code #} starts a comment line).
 */
public class BlocklistLoader {

    private static final TypeReference<List<String>> NAMES = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public BlocklistLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<String> load(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        String trimmed = content.strip();
        if (trimmed.startsWith("[")) {
            try {
                List<String> names = mapper.readValue(trimmed, NAMES);
                return names != null ? names : List.of();
            } catch (JsonProcessingException e) {
                throw new IOException("Blocklist " + file + " is not a JSON array of strings: " + e.getOriginalMessage(), e);
            }
        }
        List<String> names = new ArrayList<>();
        for (String line : content.split("\\R")) {
            String name = line.strip();
            if (!name.isEmpty() && !name.startsWith("#")) {
                names.add(name);
            }
        }
        return names;
    }
}
