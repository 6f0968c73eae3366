package com.wavestone.melonpicker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attributes reported by the user. Values are the raw form strings; anything
 * that does not match a known value is scored as unrecognized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserInputs {
    private String size; // small, medium, large, extra-large
    private String shape; // round, oblong
    private String stripes; // dark-light, solid-dark, light-dark, mottled
    private String fieldSpot; // creamy-yellow, pale-yellow, white, green
    private String stem; // dry-brown, missing, green
    private boolean hasImage;
}
