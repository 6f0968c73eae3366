package com.wavestone.melonpicker.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Quality buckets keyed on score percentage, highest first.
 */
@Getter
@RequiredArgsConstructor
public enum QualityTier {
    EXCELLENT(80, "Excellent Choice!", "excellent",
            "This watermelon shows all the signs of being perfectly ripe and delicious. Go for it!"),
    GOOD(65, "Good Choice", "good",
            "This watermelon looks promising. It should be sweet and juicy."),
    FAIR(45, "Fair Choice", "fair",
            "This watermelon might be okay, but there are some concerns about ripeness."),
    POOR(0, "Poor Choice", "poor",
            "I'd recommend looking for a different watermelon with better ripeness indicators.");

    private final int minPercentage;
    private final String label;
    private final String cssClass;
    private final String recommendation;

    public static QualityTier forPercentage(int percentage) {
        for (QualityTier tier : values()) {
            if (percentage >= tier.minPercentage) {
                return tier;
            }
        }
        return POOR;
    }
}
