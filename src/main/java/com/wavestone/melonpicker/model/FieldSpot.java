package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Colour of the patch where the melon rested on the ground.
 * UNKNOWN is only produced by image estimation.
 */
@Getter
@RequiredArgsConstructor
public enum FieldSpot {
    CREAMY_YELLOW("creamy-yellow"),
    PALE_YELLOW("pale-yellow"),
    WHITE("white"),
    GREEN("green"),
    UNKNOWN("unknown");

    @JsonValue
    private final String value;

    public static Optional<FieldSpot> fromValue(String value) {
        return Arrays.stream(values())
                .filter(spot -> spot.value.equals(value))
                .findFirst();
    }

    /**
     * Human readable form, e.g. "creamy yellow".
     */
    public String displayName() {
        return value.replace('-', ' ');
    }
}
