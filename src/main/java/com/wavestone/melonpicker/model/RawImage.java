package com.wavestone.melonpicker.model;

import lombok.Getter;

/**
 * Decoded raster: row-major, interleaved R,G,B[,A] samples.
 */
@Getter
public class RawImage {

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] pixels;

    public RawImage(int width, int height, int channels, byte[] pixels) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Image dimensions must not be negative: " + width + "x" + height);
        }
        if (channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Only RGB or RGBA rasters are supported, got " + channels + " channels");
        }
        if (pixels == null || pixels.length != width * height * channels) {
            throw new IllegalArgumentException("Pixel buffer length does not match " + width + "x" + height + "x" + channels);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.pixels = pixels;
    }

    public int pixelCount() {
        return width * height;
    }

    /**
     * Unsigned sample value at a flat buffer offset.
     */
    public int sample(int offset) {
        return pixels[offset] & 0xFF;
    }
}
