package com.wavestone.melonpicker.service;

import com.wavestone.melonpicker.model.ColorTag;
import com.wavestone.melonpicker.model.FieldSpot;
import com.wavestone.melonpicker.model.ImageSummary;
import com.wavestone.melonpicker.model.KnowledgeBase;
import com.wavestone.melonpicker.model.QualityTier;
import com.wavestone.melonpicker.model.Recommendation;
import com.wavestone.melonpicker.model.ScoreBreakdown;
import com.wavestone.melonpicker.model.StemCondition;
import com.wavestone.melonpicker.model.StripePattern;
import com.wavestone.melonpicker.model.UserInputs;
import com.wavestone.melonpicker.model.WatermelonShape;
import com.wavestone.melonpicker.model.WatermelonSize;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule-based ripeness scoring.
 * <p>
 * Each category the user supplied adds its weight to maxScore and its table score
 * to the total: field spot 30, stem 25, size and shape 20, stripes 15, photo 20.
 * The percentage of the two picks the quality tier.
 */
@Service
@Slf4j
public class ScoringEngine {

    static final int FIELD_SPOT_WEIGHT = 30;
    static final int STEM_WEIGHT = 25;
    static final int SIZE_SHAPE_WEIGHT = 20;
    static final int STRIPES_WEIGHT = 15;
    static final int IMAGE_WEIGHT = 20;

    private static final int IMAGE_BASE_SCORE = 10;
    private static final double ESTIMATED_FIELD_SPOT_FACTOR = 0.3;
    private static final double ESTIMATED_FIELD_SPOT_CAP = 10;
    private static final int DETECTED_STRIPES_BONUS = 5;

    private static final Map<WatermelonSize, Set<WatermelonShape>> OPTIMAL_SHAPES = new EnumMap<>(Map.of(
            WatermelonSize.MEDIUM, EnumSet.of(WatermelonShape.ROUND),
            WatermelonSize.LARGE, EnumSet.of(WatermelonShape.ROUND, WatermelonShape.OBLONG),
            WatermelonSize.EXTRA_LARGE, EnumSet.of(WatermelonShape.OBLONG)
    ));

    private static final List<String> GENERAL_TIPS = List.of(
            "Look for a creamy yellow field spot where the watermelon sat on the ground",
            "The stem should be dry and brown, not green",
            "A ripe watermelon should sound hollow when tapped",
            "The watermelon should feel heavy for its size",
            "Look for a dull, matte skin rather than shiny",
            "Avoid watermelons with soft spots, bruises, or cuts",
            "The best watermelons have prominent stripes and uniform shape",
            "A good watermelon should have a sweet aroma at the blossom end"
    );

    private static final KnowledgeBase KNOWLEDGE_BASE = new KnowledgeBase(
            new KnowledgeBase.RipenessIndicators(
                    Map.of(
                            "creamy_yellow", new KnowledgeBase.Indicator(10, "Perfect ripeness"),
                            "pale_yellow", new KnowledgeBase.Indicator(8, "Good ripeness"),
                            "white", new KnowledgeBase.Indicator(5, "Possibly underripe"),
                            "green", new KnowledgeBase.Indicator(2, "Likely underripe")),
                    Map.of(
                            "dry_brown", new KnowledgeBase.Indicator(10, "Naturally ripened"),
                            "missing", new KnowledgeBase.Indicator(6, "Cannot determine"),
                            "green", new KnowledgeBase.Indicator(2, "Picked too early"))),
            Map.of(
                    "sugar_baby", new KnowledgeBase.Variety("small", "round", 9),
                    "crimson_sweet", new KnowledgeBase.Variety("large", "oblong", 8),
                    "charleston_gray", new KnowledgeBase.Variety("large", "oblong", 7))
    );

    /**
     * Score the user's observations plus the optional image summary.
     *
     * @param inputs       attributes reported by the user
     * @param imageSummary colour analysis of the photo, or null when there is none or it failed
     * @return the recommendation; never null
     */
    public Recommendation score(UserInputs inputs, ImageSummary imageSummary) {
        double score = 0;
        int maxScore = 0;
        List<String> feedback = new ArrayList<>();

        // Field spot is the strongest indicator
        if (isPresent(inputs.getFieldSpot())) {
            maxScore += FIELD_SPOT_WEIGHT;
            ScoreBreakdown fieldSpot = scoreFieldSpot(inputs.getFieldSpot());
            score += fieldSpot.score();
            feedback.add(fieldSpot.feedback());
        }

        if (isPresent(inputs.getStem())) {
            maxScore += STEM_WEIGHT;
            ScoreBreakdown stem = scoreStem(inputs.getStem());
            score += stem.score();
            feedback.add(stem.feedback());
        }

        if (isPresent(inputs.getSize()) && isPresent(inputs.getShape())) {
            maxScore += SIZE_SHAPE_WEIGHT;
            ScoreBreakdown sizeShape = scoreSizeShape(inputs.getSize(), inputs.getShape());
            score += sizeShape.score();
            feedback.add(sizeShape.feedback());
        }

        if (isPresent(inputs.getStripes())) {
            maxScore += STRIPES_WEIGHT;
            ScoreBreakdown stripes = scoreStripes(inputs.getStripes());
            score += stripes.score();
            feedback.add(stripes.feedback());
        }

        if (inputs.isHasImage()) {
            maxScore += IMAGE_WEIGHT;
            ImageAssessment image = assessImage(imageSummary, inputs);
            score += image.score();
            feedback.addAll(image.feedback());
        }

        int percentage = maxScore > 0 ? (int) Math.round(score / maxScore * 100) : 0;
        QualityTier tier = QualityTier.forPercentage(percentage);

        log.debug("Scored {}/{} ({}%) -> {}", score, maxScore, percentage, tier);

        return Recommendation.builder()
                .quality(tier.getLabel())
                .qualityClass(tier.getCssClass())
                .recommendation(tier.getRecommendation())
                .percentage(percentage)
                .feedback(feedback.stream().filter(StringUtils::hasLength).collect(Collectors.toList()))
                .tips(GENERAL_TIPS)
                .score(score)
                .maxScore(maxScore)
                .build();
    }

    ScoreBreakdown scoreFieldSpot(String value) {
        return FieldSpot.fromValue(value)
                .map(ScoringEngine::fieldSpotBreakdown)
                .orElse(ScoreBreakdown.NONE);
    }

    private static ScoreBreakdown fieldSpotBreakdown(FieldSpot fieldSpot) {
        return switch (fieldSpot) {
            case CREAMY_YELLOW -> new ScoreBreakdown(30, "✅ Excellent field spot! The creamy yellow indicates perfect ripeness.");
            case PALE_YELLOW -> new ScoreBreakdown(25, "✅ Good field spot color, should be ripe.");
            case WHITE -> new ScoreBreakdown(15, "⚠️ White field spot suggests it might be underripe.");
            case GREEN -> new ScoreBreakdown(5, "❌ Green or missing field spot is a red flag - likely underripe.");
            default -> ScoreBreakdown.NONE;
        };
    }

    ScoreBreakdown scoreStem(String value) {
        return StemCondition.fromValue(value)
                .map(stem -> switch (stem) {
                    case DRY_BROWN -> new ScoreBreakdown(25, "✅ Perfect! Dry brown stem means it ripened naturally on the vine.");
                    case MISSING -> new ScoreBreakdown(15, "⚠️ Missing stem is okay, but harder to judge ripeness.");
                    case GREEN -> new ScoreBreakdown(5, "❌ Green stem suggests it was picked too early.");
                })
                .orElse(ScoreBreakdown.NONE);
    }

    ScoreBreakdown scoreSizeShape(String size, String shape) {
        Optional<WatermelonSize> parsedSize = WatermelonSize.fromValue(size);
        Optional<WatermelonShape> parsedShape = WatermelonShape.fromValue(shape);

        boolean optimal = parsedSize.isPresent() && parsedShape.isPresent()
                && OPTIMAL_SHAPES.getOrDefault(parsedSize.get(), Set.of()).contains(parsedShape.get());
        if (optimal) {
            return new ScoreBreakdown(20, "✅ Great size and shape combination for optimal sweetness.");
        } else if (parsedSize.filter(WatermelonSize.SMALL::equals).isPresent()) {
            return new ScoreBreakdown(10, "⚠️ Small watermelons can be sweet but have less flesh.");
        }
        return new ScoreBreakdown(15, "✅ Decent size and shape.");
    }

    /**
     * Unrecognized patterns still earn the mottled score, unlike the other tables which fall back to 0.
     */
    ScoreBreakdown scoreStripes(String value) {
        return StripePattern.fromValue(value)
                .map(pattern -> switch (pattern) {
                    case DARK_LIGHT -> new ScoreBreakdown(15, "✅ Classic stripe pattern looks good!");
                    case SOLID_DARK -> new ScoreBreakdown(12, "✅ Solid dark pattern is acceptable.");
                    case LIGHT_DARK -> new ScoreBreakdown(13, "✅ Light with dark stripes looks good.");
                    case MOTTLED -> new ScoreBreakdown(10, "⚠️ Mottled pattern is less ideal but okay.");
                })
                .orElse(new ScoreBreakdown(10, "✅ Stripe pattern is acceptable."));
    }

    ImageAssessment assessImage(ImageSummary imageSummary, UserInputs inputs) {
        double imageScore = IMAGE_BASE_SCORE;
        List<String> feedback = new ArrayList<>();

        if (imageSummary == null) {
            return new ImageAssessment(imageScore, List.of("✅ Great job providing a photo for visual analysis!"));
        }

        FieldSpot estimate = imageSummary.getFieldSpotEstimate();
        if (!isPresent(inputs.getFieldSpot()) && estimate != null && estimate != FieldSpot.UNKNOWN) {
            ScoreBreakdown estimated = fieldSpotBreakdown(estimate);
            imageScore += Math.min(estimated.score() * ESTIMATED_FIELD_SPOT_FACTOR, ESTIMATED_FIELD_SPOT_CAP);
            feedback.add("🤖 AI detected " + estimate.displayName() + " field spot in image");
        }

        if (!isPresent(inputs.getStripes()) && imageSummary.isHasStripes()) {
            imageScore += DETECTED_STRIPES_BONUS;
            feedback.add("🤖 AI detected stripe patterns in the image - good visual indicator!");
        }

        List<ColorTag> dominantColors = imageSummary.getDominantColors();
        if (dominantColors != null && !dominantColors.isEmpty()) {
            String tones = dominantColors.stream()
                    .map(ColorTag::getValue)
                    .collect(Collectors.joining(", "));
            feedback.add("🤖 AI analysis: Detected " + tones + " tones");
        }

        feedback.add("✅ Image analysis provided additional insights!");

        return new ImageAssessment(Math.min(imageScore, IMAGE_WEIGHT), feedback);
    }

    public List<String> getGeneralTips() {
        return GENERAL_TIPS;
    }

    public KnowledgeBase getKnowledgeBase() {
        return KNOWLEDGE_BASE;
    }

    private static boolean isPresent(String value) {
        return StringUtils.hasLength(value);
    }

    record ImageAssessment(double score, List<String> feedback) {
    }
}
