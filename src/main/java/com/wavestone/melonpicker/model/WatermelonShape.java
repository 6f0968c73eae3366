package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum WatermelonShape {
    ROUND("round"),
    OBLONG("oblong");

    @JsonValue
    private final String value;

    public static Optional<WatermelonShape> fromValue(String value) {
        return Arrays.stream(values())
                .filter(shape -> shape.value.equals(value))
                .findFirst();
    }
}
