package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {
    private String quality;
    private String qualityClass; // excellent, good, fair, poor
    private String recommendation;
    private int percentage;
    private List<String> feedback;
    private List<String> tips;
    @JsonSerialize(using = ScoreSerializer.class)
    private double score; // fractional when the image estimate bonus applies
    private int maxScore;
}
