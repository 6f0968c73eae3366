package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum StemCondition {
    DRY_BROWN("dry-brown"),
    MISSING("missing"),
    GREEN("green");

    @JsonValue
    private final String value;

    public static Optional<StemCondition> fromValue(String value) {
        return Arrays.stream(values())
                .filter(stem -> stem.value.equals(value))
                .findFirst();
    }
}
