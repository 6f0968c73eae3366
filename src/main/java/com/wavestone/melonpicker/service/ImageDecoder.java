package com.wavestone.melonpicker.service;

import com.wavestone.melonpicker.model.ImageMetadata;
import com.wavestone.melonpicker.model.RawImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Locale;

/**
 * Decodes uploaded JPEG/PNG/GIF/BMP payloads into interleaved rasters sized for analysis.
 * <p>
 * Declared dimensions are checked against {@code maxPixels} before any pixel data is read.
 * Large images are subsampled while decoding and then scaled to fit {@code maxDimension},
 * so the full-resolution raster is never held in memory.
 */
@Service
@Slf4j
public class ImageDecoder {

    // 0x3FFF * 0x3FFF
    static final long DEFAULT_MAX_PIXELS = 268_402_689L;

    // Keep at least twice the target resolution for the bilinear pass
    private static final int SUBSAMPLING_HEADROOM = 2;

    private final int maxDimension;
    private final long maxPixels;

    public ImageDecoder(@Value("${app.analysis.max-dimension:400}") int maxDimension,
                        @Value("${app.upload.max-pixels:268402689}") long maxPixels) {
        this.maxDimension = maxDimension;
        this.maxPixels = maxPixels;
    }

    /**
     * Decode an encoded image, scaled to fit maxDimension x maxDimension.
     * Images with an alpha channel become RGBA, others RGB.
     *
     * @throws IOException if the payload is not a readable image or declares more than maxPixels pixels
     */
    public RawImage decode(byte[] imageBytes) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(imageBytes))) {
            ImageReader reader = firstReader(input, imageBytes.length);
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if ((long) width * height > maxPixels) {
                    throw new IOException("Image of " + width + "x" + height
                            + " exceeds the pixel limit of " + maxPixels);
                }

                ImageReadParam param = reader.getDefaultReadParam();
                int subsampling = Math.max(1, Math.max(width, height) / (maxDimension * SUBSAMPLING_HEADROOM));
                if (subsampling > 1) {
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }

                BufferedImage image = reader.read(0, param);
                BufferedImage scaled = RasterConverter.resizeToFit(image, maxDimension);
                boolean hasAlpha = scaled.getColorModel().hasAlpha();

                log.debug("Decoded {}x{} image to {}x{} (subsampling: {}, alpha: {})",
                        width, height, scaled.getWidth(), scaled.getHeight(), subsampling, hasAlpha);

                return RasterConverter.toRawImage(scaled, hasAlpha);
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * Read dimensions and format without decoding the full raster.
     *
     * @return the metadata, or null if the payload cannot be read
     */
    public ImageMetadata readMetadata(byte[] imageBytes) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(imageBytes))) {
            ImageReader reader = firstReader(input, imageBytes.length);
            try {
                reader.setInput(input);
                boolean hasAlpha = reader.getRawImageType(0) != null
                        && reader.getRawImageType(0).getColorModel().hasAlpha();
                return new ImageMetadata(
                        reader.getWidth(0),
                        reader.getHeight(0),
                        reader.getFormatName().toLowerCase(Locale.ROOT),
                        imageBytes.length,
                        hasAlpha);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.warn("Metadata extraction failed: {}", e.getMessage());
            return null;
        }
    }

    private static ImageReader firstReader(ImageInputStream input, int payloadSize) throws IOException {
        Iterator<ImageReader> readers = input == null
                ? Collections.emptyIterator()
                : ImageIO.getImageReaders(input);
        if (!readers.hasNext()) {
            throw new IOException("Unsupported or corrupt image payload (" + payloadSize + " bytes)");
        }
        return readers.next();
    }
}
