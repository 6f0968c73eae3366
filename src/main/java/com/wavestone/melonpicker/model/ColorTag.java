package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Coarse colour label attached to an image when its pixel ratio passes a threshold.
 * Declaration order is the output order.
 */
@Getter
@RequiredArgsConstructor
public enum ColorTag {
    GREEN("green"),
    YELLOW("yellow"),
    WHITE("white"),
    DARK("dark");

    @JsonValue
    private final String value;
}
