package com.wavestone.melonpicker.service;

import com.wavestone.melonpicker.model.ColorTag;
import com.wavestone.melonpicker.model.FieldSpot;
import com.wavestone.melonpicker.model.ImageSummary;
import com.wavestone.melonpicker.model.RawImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Pixel-level colour and pattern analysis of a watermelon photo.
 * <p>
 * The raster is downscaled to fit within {@code maxDimension}, then every 4th pixel
 * is classified as green, yellow, white and/or dark. Ratios over the sampled population
 * drive the dominant colour tags and the field spot estimate. Stripes are detected
 * from brightness changes along up to 10 evenly spaced rows.
 */
@Service
@Slf4j
public class ColorAnalyzer {

    static final int DEFAULT_MAX_DIMENSION = 400;

    private static final int PIXEL_STRIDE = 4;

    private static final int DARK_BRIGHTNESS = 100;
    private static final int LIGHT_BRIGHTNESS = 200;

    private static final double GREEN_DOMINANT_RATIO = 0.30;
    private static final double YELLOW_DOMINANT_RATIO = 0.10;
    private static final double WHITE_DOMINANT_RATIO = 0.10;
    private static final double DARK_DOMINANT_RATIO = 0.20;

    private static final double CREAMY_YELLOW_RATIO = 0.15;
    private static final double PALE_YELLOW_RATIO = 0.08;
    private static final double WHITE_SPOT_RATIO = 0.15;
    private static final double GREEN_SPOT_RATIO = 0.60;

    private static final int STRIPE_SAMPLE_ROWS = 10;
    private static final int STRIPE_COLUMN_STEP = 10;
    private static final int STRIPE_BRIGHTNESS_DELTA = 30;
    private static final int STRIPE_CHANGES_PER_ROW = 3;

    private final int maxDimension;

    public ColorAnalyzer(@Value("${app.analysis.max-dimension:400}") int maxDimension) {
        this.maxDimension = maxDimension;
    }

    /**
     * Analyze a decoded RGB or RGBA raster.
     *
     * @param image raster to analyze
     * @return the summary, or null if the raster could not be resized or sampled
     */
    public ImageSummary analyze(RawImage image) {
        try {
            RawImage scaled = resizeIfNeeded(image);
            return performColorAnalysis(scaled);
        } catch (Exception e) {
            log.error("Image color analysis failed", e);
            return null;
        }
    }

    ImageSummary performColorAnalysis(RawImage image) {
        int channels = image.getChannels();
        int length = image.getPixels().length;

        long totalR = 0, totalG = 0, totalB = 0;
        int sampledPixels = 0;
        int darkPixels = 0, lightPixels = 0, greenPixels = 0;
        int yellowPixels = 0, whitePixels = 0;

        for (int i = 0; i < length; i += channels * PIXEL_STRIDE) {
            int r = image.sample(i);
            int g = image.sample(i + 1);
            int b = image.sample(i + 2);
            sampledPixels++;

            totalR += r;
            totalG += g;
            totalB += b;

            double brightness = (r + g + b) / 3.0;
            if (brightness < DARK_BRIGHTNESS) {
                darkPixels++;
            } else if (brightness > LIGHT_BRIGHTNESS) {
                lightPixels++;
            }

            if (isGreen(r, g, b)) greenPixels++;
            if (isYellow(r, g, b)) yellowPixels++;
            if (isWhite(r, g, b)) whitePixels++;
        }

        double greenRatio = ratio(greenPixels, sampledPixels);
        double yellowRatio = ratio(yellowPixels, sampledPixels);
        double whiteRatio = ratio(whitePixels, sampledPixels);
        double darkRatio = ratio(darkPixels, sampledPixels);

        List<ColorTag> dominantColors = new ArrayList<>();
        if (greenRatio > GREEN_DOMINANT_RATIO) dominantColors.add(ColorTag.GREEN);
        if (yellowRatio > YELLOW_DOMINANT_RATIO) dominantColors.add(ColorTag.YELLOW);
        if (whiteRatio > WHITE_DOMINANT_RATIO) dominantColors.add(ColorTag.WHITE);
        if (darkRatio > DARK_DOMINANT_RATIO) dominantColors.add(ColorTag.DARK);

        FieldSpot fieldSpotEstimate = estimateFieldSpot(greenRatio, yellowRatio, whiteRatio);
        boolean hasStripes = detectStripePattern(image);

        log.debug("Sampled {} of {} pixels: green={} yellow={} white={} dark={} light={}",
                sampledPixels, image.pixelCount(), greenPixels, yellowPixels, whitePixels, darkPixels, lightPixels);

        return ImageSummary.builder()
                .dominantColors(List.copyOf(dominantColors))
                .fieldSpotEstimate(fieldSpotEstimate)
                .hasStripes(hasStripes)
                .avgColor(new ImageSummary.AvgColor(
                        average(totalR, sampledPixels),
                        average(totalG, sampledPixels),
                        average(totalB, sampledPixels)))
                .colorRatios(new ImageSummary.ColorRatios(
                        roundTwoDecimals(greenRatio),
                        roundTwoDecimals(yellowRatio),
                        roundTwoDecimals(whiteRatio),
                        roundTwoDecimals(darkRatio)))
                .imageInfo(new ImageSummary.ImageInfo(image.getWidth(), image.getHeight(), channels))
                .build();
    }

    /**
     * Counts brightness jumps along sampled rows; the first column of every row
     * is compared against 0.
     */
    boolean detectStripePattern(RawImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int channels = image.getChannels();
        int sampleRows = Math.min(STRIPE_SAMPLE_ROWS, height);
        int variations = 0;

        for (int row = 0; row < sampleRows; row++) {
            int y = (int) Math.floor((double) row / sampleRows * height);
            double lastBrightness = 0;

            for (int x = 0; x < width; x += STRIPE_COLUMN_STEP) {
                int i = (y * width + x) * channels;
                double brightness = (image.sample(i) + image.sample(i + 1) + image.sample(i + 2)) / 3.0;

                if (Math.abs(brightness - lastBrightness) > STRIPE_BRIGHTNESS_DELTA) {
                    variations++;
                }
                lastBrightness = brightness;
            }
        }

        return variations > sampleRows * STRIPE_CHANGES_PER_ROW;
    }

    private FieldSpot estimateFieldSpot(double greenRatio, double yellowRatio, double whiteRatio) {
        if (yellowRatio > CREAMY_YELLOW_RATIO) {
            return FieldSpot.CREAMY_YELLOW;
        } else if (yellowRatio > PALE_YELLOW_RATIO) {
            return FieldSpot.PALE_YELLOW;
        } else if (whiteRatio > WHITE_SPOT_RATIO) {
            return FieldSpot.WHITE;
        } else if (greenRatio > GREEN_SPOT_RATIO) {
            return FieldSpot.GREEN;
        }
        return FieldSpot.UNKNOWN;
    }

    /**
     * Resize the raster to fit inside maxDimension x maxDimension, never enlarging it.
     */
    RawImage resizeIfNeeded(RawImage image) {
        if (image.getWidth() <= maxDimension && image.getHeight() <= maxDimension) {
            return image;
        }

        BufferedImage resized = RasterConverter.resizeToFit(RasterConverter.toBufferedImage(image), maxDimension);

        log.debug("Image resized from {}x{} to {}x{} for analysis",
                image.getWidth(), image.getHeight(), resized.getWidth(), resized.getHeight());

        return RasterConverter.toRawImage(resized, image.getChannels() == 4);
    }

    private static boolean isGreen(int r, int g, int b) {
        return g > r && g > b && g > 100;
    }

    private static boolean isYellow(int r, int g, int b) {
        return r > 200 && g > 200 && b < 150;
    }

    private static boolean isWhite(int r, int g, int b) {
        return r > 220 && g > 220 && b > 220;
    }

    private static double ratio(int count, int sampledPixels) {
        return sampledPixels > 0 ? (double) count / sampledPixels : 0.0;
    }

    private static int average(long total, int sampledPixels) {
        return sampledPixels > 0 ? (int) Math.round((double) total / sampledPixels) : 0;
    }

    private static double roundTwoDecimals(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
