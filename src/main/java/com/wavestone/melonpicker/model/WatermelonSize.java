package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum WatermelonSize {
    SMALL("small"),
    MEDIUM("medium"),
    LARGE("large"),
    EXTRA_LARGE("extra-large");

    @JsonValue
    private final String value;

    public static Optional<WatermelonSize> fromValue(String value) {
        return Arrays.stream(values())
                .filter(size -> size.value.equals(value))
                .findFirst();
    }
}
