package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void wholeScore_isWrittenAsInteger() throws Exception {
        String json = objectMapper.writeValueAsString(Recommendation.builder().score(90).maxScore(90).build());

        assertThat(json).contains("\"score\":90,").doesNotContain("90.0");
    }

    @Test
    void fractionalScore_keepsItsFraction() throws Exception {
        String json = objectMapper.writeValueAsString(Recommendation.builder().score(17.5).maxScore(20).build());

        assertThat(json).contains("\"score\":17.5");
    }
}
