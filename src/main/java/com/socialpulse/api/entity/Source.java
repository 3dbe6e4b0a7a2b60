package com.socialpulse.api.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum Source {

    REDDIT("reddit"),
    NEWS("news"),
    TWITTER("twitter");

    @JsonValue
    private final String key;

    public static Optional<Source> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim();
        return Arrays.stream(values())
                .filter(s -> s.key.equalsIgnoreCase(normalized) || s.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
