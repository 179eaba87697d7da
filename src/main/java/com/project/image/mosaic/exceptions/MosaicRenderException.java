package com.project.image.mosaic.exceptions;

import com.project.image.mosaic.DTOs.TileCoordinate;

/**
 * Unexpected fault that aborts a run. Carries whatever context was known when it
 * happened: the image involved and the tile being processed.
 */
public class MosaicRenderException extends MosaicException {
    private final String imagePath;
    private final TileCoordinate tile;

    public MosaicRenderException(String message, String imagePath, TileCoordinate tile, Throwable cause) {
        super(describe(message, imagePath, tile), cause);
        this.imagePath = imagePath;
        this.tile = tile;
    }

    public MosaicRenderException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public String getImagePath() { return imagePath; }
    public TileCoordinate getTile() { return tile; }

    private static String describe(String message, String imagePath, TileCoordinate tile) {
        StringBuilder sb = new StringBuilder(message);
        if (imagePath != null) sb.append(" [image=").append(imagePath).append(']');
        if (tile != null) sb.append(" [tile=").append(tile).append(']');
        return sb.toString();
    }
}
