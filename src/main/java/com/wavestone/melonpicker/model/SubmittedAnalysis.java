package com.wavestone.melonpicker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Echo of what was submitted for analysis, returned alongside the recommendation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmittedAnalysis {

    private String size;
    private String shape;
    private String stripes;
    private String fieldSpot;
    private String stem;
    private boolean hasImage;
    private ImageSummary imageAnalysis; // null when no image or it could not be decoded

    // Constructor from UserInputs
    public SubmittedAnalysis(UserInputs inputs, ImageSummary imageAnalysis) {
        this.size = inputs.getSize();
        this.shape = inputs.getShape();
        this.stripes = inputs.getStripes();
        this.fieldSpot = inputs.getFieldSpot();
        this.stem = inputs.getStem();
        this.hasImage = inputs.isHasImage();
        this.imageAnalysis = imageAnalysis;
    }
}
