package com.wavestone.melonpicker.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QualityTierTest {

    @Test
    void lowerBoundsAreInclusive() {
        assertThat(QualityTier.forPercentage(100)).isEqualTo(QualityTier.EXCELLENT);
        assertThat(QualityTier.forPercentage(80)).isEqualTo(QualityTier.EXCELLENT);
        assertThat(QualityTier.forPercentage(79)).isEqualTo(QualityTier.GOOD);
        assertThat(QualityTier.forPercentage(65)).isEqualTo(QualityTier.GOOD);
        assertThat(QualityTier.forPercentage(64)).isEqualTo(QualityTier.FAIR);
        assertThat(QualityTier.forPercentage(45)).isEqualTo(QualityTier.FAIR);
        assertThat(QualityTier.forPercentage(44)).isEqualTo(QualityTier.POOR);
        assertThat(QualityTier.forPercentage(0)).isEqualTo(QualityTier.POOR);
    }

    @Test
    void tiersCarryClientLabels() {
        assertThat(QualityTier.GOOD.getLabel()).isEqualTo("Good Choice");
        assertThat(QualityTier.GOOD.getCssClass()).isEqualTo("good");
        assertThat(QualityTier.FAIR.getRecommendation())
                .isEqualTo("This watermelon might be okay, but there are some concerns about ripeness.");
    }
}
