package com.wavestone.melonpicker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReport {
    private SubmittedAnalysis analysis;
    private Recommendation recommendation;
    private Instant timestamp;
}
