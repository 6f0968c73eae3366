package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Static reference data about ripeness indicators and common varieties.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeBase {

    @JsonProperty("ripeness_indicators")
    private RipenessIndicators ripenessIndicators;

    private Map<String, Variety> varieties;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RipenessIndicators {
        @JsonProperty("field_spot")
        private Map<String, Indicator> fieldSpot;
        private Map<String, Indicator> stem;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Indicator {
        private int score; // out of 10
        private String description;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Variety {
        private String size;
        private String shape;
        private int sweetness; // out of 10
    }
}
