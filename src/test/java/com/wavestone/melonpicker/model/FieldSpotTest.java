package com.wavestone.melonpicker.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FieldSpotTest {

    @Test
    void fromValue_matchesWireValues() {
        assertThat(FieldSpot.fromValue("creamy-yellow")).contains(FieldSpot.CREAMY_YELLOW);
        assertThat(FieldSpot.fromValue("Creamy-Yellow")).isEmpty();
        assertThat(FieldSpot.fromValue(null)).isEmpty();
    }

    @Test
    void displayName_replacesHyphens() {
        assertThat(FieldSpot.PALE_YELLOW.displayName()).isEqualTo("pale yellow");
        assertThat(FieldSpot.WHITE.displayName()).isEqualTo("white");
    }
}
