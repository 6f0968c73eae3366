package com.wavestone.melonpicker.service;

import com.wavestone.melonpicker.model.AnalysisReport;
import com.wavestone.melonpicker.model.ImageMetadata;
import com.wavestone.melonpicker.model.ImageSummary;
import com.wavestone.melonpicker.model.KnowledgeBase;
import com.wavestone.melonpicker.model.Recommendation;
import com.wavestone.melonpicker.model.SubmittedAnalysis;
import com.wavestone.melonpicker.model.UserInputs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class WatermelonAnalysisService {

    private final ImageDecoder imageDecoder;
    private final ColorAnalyzer colorAnalyzer;
    private final ScoringEngine scoringEngine;

    /**
     * Run one analysis: decode and analyze the photo if there is one, then score.
     * An undecodable photo still counts as provided but contributes no image summary.
     *
     * @param reported   user reported attributes; hasImage is derived from imageBytes
     * @param imageBytes encoded photo, or null
     */
    public AnalysisReport analyze(UserInputs reported, byte[] imageBytes) {
        UserInputs inputs = reported.toBuilder()
                .hasImage(imageBytes != null)
                .build();

        ImageSummary imageSummary = null;
        if (imageBytes != null) {
            imageSummary = analyzeImage(imageBytes);
        }

        Recommendation recommendation = scoringEngine.score(inputs, imageSummary);

        log.info("Analysis completed: score {}/{} ({}%), quality {}",
                recommendation.getScore(), recommendation.getMaxScore(),
                recommendation.getPercentage(), recommendation.getQualityClass());

        return new AnalysisReport(new SubmittedAnalysis(inputs, imageSummary), recommendation, Instant.now());
    }

    private ImageSummary analyzeImage(byte[] imageBytes) {
        try {
            ImageMetadata metadata = imageDecoder.readMetadata(imageBytes);
            if (metadata != null) {
                log.debug("Received {} image {}x{} ({} bytes)",
                        metadata.getFormat(), metadata.getWidth(), metadata.getHeight(), metadata.getSize());
            }
            return colorAnalyzer.analyze(imageDecoder.decode(imageBytes));
        } catch (IOException e) {
            log.warn("Could not decode uploaded image: {}", e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Unexpected failure decoding uploaded image", e);
            return null;
        }
    }

    public List<String> getGeneralTips() {
        return scoringEngine.getGeneralTips();
    }

    public KnowledgeBase getKnowledgeBase() {
        return scoringEngine.getKnowledgeBase();
    }
}
