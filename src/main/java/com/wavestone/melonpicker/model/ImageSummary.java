package com.wavestone.melonpicker.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageSummary {
    private List<ColorTag> dominantColors;
    private FieldSpot fieldSpotEstimate;
    private boolean hasStripes;
    private AvgColor avgColor;
    private ColorRatios colorRatios;
    private ImageInfo imageInfo;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AvgColor {
        private int r;
        private int g;
        private int b;
    }

    /**
     * Fractions of sampled pixels, rounded to two decimals.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ColorRatios {
        private double green;
        private double yellow;
        private double white;
        private double dark;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageInfo {
        private int width;
        private int height;
        private int channels;
    }
}
