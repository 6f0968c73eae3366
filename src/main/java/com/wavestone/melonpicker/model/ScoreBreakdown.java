package com.wavestone.melonpicker.model;

/**
 * Score and feedback for a single category. Empty feedback is dropped from the final list.
 */
public record ScoreBreakdown(int score, String feedback) {

    public static final ScoreBreakdown NONE = new ScoreBreakdown(0, "");
}
