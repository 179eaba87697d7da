package com.project.image.mosaic.DTOs;

/**
 * @param maxWorkers    decoders allowed to run at once
 * @param thumbnailSize longest side of the retained thumbnail, in pixels
 */
public record SeedLoadOptions(int maxWorkers, int thumbnailSize) {

    public SeedLoadOptions {
        if (maxWorkers < 1) throw new IllegalArgumentException("maxWorkers must be >= 1");
        if (thumbnailSize < 1) throw new IllegalArgumentException("thumbnailSize must be >= 1");
    }

    public static SeedLoadOptions defaults() {
        return new SeedLoadOptions(Runtime.getRuntime().availableProcessors(), 200);
    }
}
