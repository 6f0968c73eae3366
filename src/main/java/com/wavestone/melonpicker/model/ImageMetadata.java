package com.wavestone.melonpicker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageMetadata {
    private int width;
    private int height;
    private String format; // e.g. "jpeg", "png"
    private long size; // encoded payload size in bytes
    private boolean hasAlpha;
}
