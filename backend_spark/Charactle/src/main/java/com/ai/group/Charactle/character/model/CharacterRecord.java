// com/ai/group/Charactle/character/model/CharacterRecord.java
package com.ai.group.Charactle.character.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One guessable character as delivered by the character store.
 * Absent text fields become empty strings, absent categories become {@code "Unknown"},
 * absent powers an empty list (null entries are dropped) and absent difficulty {@code 5}.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CharacterRecord(
        String id,            // required for training only
        String name,
        String quote,
        String description,
        String universe,
        String genre,
        List<String> powers,
        Double difficulty
) {
    public static final String UNKNOWN_CATEGORY = "Unknown";
    public static final double DEFAULT_DIFFICULTY = 5.0;

    public CharacterRecord {
        name = name == null ? "" : name;
        quote = quote == null ? "" : quote;
        description = description == null ? "" : description;
        universe = universe == null ? UNKNOWN_CATEGORY : universe;
        genre = genre == null ? UNKNOWN_CATEGORY : genre;
        powers = powers == null ? List.of()
                : powers.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
        difficulty = difficulty == null ? DEFAULT_DIFFICULTY : difficulty;
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    /** Text the vectorizer sees: quote, name and description separated by spaces. */
    public String text() {
        return quote + " " + name + " " + description;
    }
}
