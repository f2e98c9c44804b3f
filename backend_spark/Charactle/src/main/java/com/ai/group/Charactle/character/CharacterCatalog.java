package com.ai.group.Charactle.character;

import com.ai.group.Charactle.character.model.CharacterRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Reads the exported character list (a JSON array) from the classpath or the file system. */
@Slf4j
@Component
@RequiredArgsConstructor
public class CharacterCatalog {

    private static final String CLASSPATH_PREFIX = "classpath:";

    private final ObjectMapper om;

    public List<CharacterRecord> load(String location) throws IOException {
        if (location == null || location.isBlank()) {
            throw new IOException("Character catalog location is not configured");
        }
        List<CharacterRecord> characters;
        try (InputStream in = open(location)) {
            characters = om.readValue(in, new TypeReference<List<CharacterRecord>>() {});
        }
        if (characters == null) {
            characters = List.of();
        }
        log.info("Loaded {} characters from {}", characters.size(), location);
        return characters;
    }

    private static InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(location.substring(CLASSPATH_PREFIX.length())).getInputStream();
        }
        return Files.newInputStream(Path.of(location));
    }
}
