package com.wavestone.melonpicker.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes whole-number scores as JSON integers ({@code 90}, not {@code 90.0}).
 * Fractional scores such as {@code 17.5} are written unchanged.
 */
public class ScoreSerializer extends JsonSerializer<Double> {

    @Override
    public void serialize(Double value, JsonGenerator generator, SerializerProvider provider) throws IOException {
        double score = value;
        if (score == Math.rint(score) && !Double.isInfinite(score)) {
            generator.writeNumber((long) score);
        } else {
            generator.writeNumber(score);
        }
    }
}
