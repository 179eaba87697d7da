package com.project.image.mosaic.DTOs;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Color statistics of one candidate tile image. {@code thumbnail} is the only pixel
 * data kept after loading; the full decoded image is released once analyzed.
 */
public record SeedImageRecord(
        Path filePath,
        int width,
        int height,
        ColorMetrics averageColor,
        ColorMetrics dominantColor,
        double brightness,
        double saturation,
        BufferedImage thumbnail
) {
    public String key() {
        return filePath.toString();
    }

    @Override
    public String toString() {
        return "SeedImageRecord[" + filePath.getFileName() + " " + width + "x" + height
                + " avg=" + averageColor.toHex() + "]";
    }
}
