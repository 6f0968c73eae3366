package com.wavestone.melonpicker.service;

import com.wavestone.melonpicker.model.RawImage;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Conversions between {@link BufferedImage} and interleaved {@link RawImage} buffers.
 */
final class RasterConverter {

    private RasterConverter() {
    }

    /**
     * Resize to fit inside maxDimension x maxDimension with bilinear interpolation,
     * preserving aspect ratio and never enlarging.
     */
    static BufferedImage resizeToFit(BufferedImage image, int maxDimension) {
        int originalWidth = image.getWidth();
        int originalHeight = image.getHeight();

        if (originalWidth <= maxDimension && originalHeight <= maxDimension) {
            return image;
        }

        double ratio = Math.min((double) maxDimension / originalWidth, (double) maxDimension / originalHeight);
        int newWidth = Math.max(1, (int) Math.round(originalWidth * ratio));
        int newHeight = Math.max(1, (int) Math.round(originalHeight * ratio));

        boolean alpha = image.getColorModel().hasAlpha();
        BufferedImage resized = new BufferedImage(newWidth, newHeight,
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = resized.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.drawImage(image, 0, 0, newWidth, newHeight, null);
        } finally {
            g2d.dispose();
        }
        return resized;
    }

    static RawImage toRawImage(BufferedImage image, boolean keepAlpha) {
        int width = image.getWidth();
        int height = image.getHeight();
        int channels = keepAlpha ? 4 : 3;
        long length = (long) width * height * channels;
        if (length > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Raster too large to buffer: " + width + "x" + height + "x" + channels);
        }
        byte[] pixels = new byte[(int) length];

        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                pixels[i++] = (byte) ((argb >> 16) & 0xFF);
                pixels[i++] = (byte) ((argb >> 8) & 0xFF);
                pixels[i++] = (byte) (argb & 0xFF);
                if (keepAlpha) {
                    pixels[i++] = (byte) ((argb >> 24) & 0xFF);
                }
            }
        }
        return new RawImage(width, height, channels, pixels);
    }

    static BufferedImage toBufferedImage(RawImage raw) {
        boolean alpha = raw.getChannels() == 4;
        BufferedImage image = new BufferedImage(raw.getWidth(), raw.getHeight(),
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);

        int channels = raw.getChannels();
        for (int y = 0; y < raw.getHeight(); y++) {
            for (int x = 0; x < raw.getWidth(); x++) {
                int offset = (y * raw.getWidth() + x) * channels;
                int a = alpha ? raw.sample(offset + 3) : 0xFF;
                int argb = (a << 24)
                        | (raw.sample(offset) << 16)
                        | (raw.sample(offset + 1) << 8)
                        | raw.sample(offset + 2);
                image.setRGB(x, y, argb);
            }
        }
        return image;
    }
}
