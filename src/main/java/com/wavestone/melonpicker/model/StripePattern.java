package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum StripePattern {
    DARK_LIGHT("dark-light"),
    SOLID_DARK("solid-dark"),
    LIGHT_DARK("light-dark"),
    MOTTLED("mottled");

    @JsonValue
    private final String value;

    public static Optional<StripePattern> fromValue(String value) {
        return Arrays.stream(values())
                .filter(pattern -> pattern.value.equals(value))
                .findFirst();
    }
}
