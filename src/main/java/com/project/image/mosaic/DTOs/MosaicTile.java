package com.project.image.mosaic.DTOs;

/**
 * One placed tile. {@code selectedSeed} is null for flat color fills.
 */
public record MosaicTile(
        TileCoordinate coordinate,
        TileRectangle rectangle,
        ColorMetrics targetColor,
        SeedImageRecord selectedSeed,
        ColorMetrics overlayColor,
        double colorDistance
) {
    public boolean isFlatFill() {
        return selectedSeed == null;
    }
}
