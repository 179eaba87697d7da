package com.project.image.mosaic.DTOs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partition of a master image into columns x rows rectangles. Interior tiles have
 * the configured size; the last column and row take whatever is left over, so the
 * rectangles cover every pixel exactly once.
 */
public final class TileGrid {
    private final int imageWidth;
    private final int imageHeight;
    private final int tileWidth;
    private final int tileHeight;
    private final int columns;
    private final int rows;

    private TileGrid(int imageWidth, int imageHeight, int tileWidth, int tileHeight) {
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.columns = ceilDiv(imageWidth, tileWidth);
        this.rows = ceilDiv(imageHeight, tileHeight);
    }

    public static TileGrid of(int imageWidth, int imageHeight, int tileWidth, int tileHeight) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + imageWidth + "x" + imageHeight);
        }
        if (tileWidth <= 0 || tileHeight <= 0) {
            throw new IllegalArgumentException("Tile dimensions must be positive: " + tileWidth + "x" + tileHeight);
        }
        return new TileGrid(imageWidth, imageHeight, tileWidth, tileHeight);
    }

    public int columns() { return columns; }
    public int rows() { return rows; }
    public int tileCount() { return columns * rows; }
    public int imageWidth() { return imageWidth; }
    public int imageHeight() { return imageHeight; }

    public TileRectangle rectangleAt(TileCoordinate coordinate) {
        int x = coordinate.x(), y = coordinate.y();
        if (x < 0 || x >= columns || y < 0 || y >= rows) {
            throw new IndexOutOfBoundsException("Tile " + coordinate + " outside " + columns + "x" + rows + " grid");
        }
        int left = x * tileWidth;
        int top = y * tileHeight;
        int width = (x == columns - 1) ? imageWidth - left : tileWidth;
        int height = (y == rows - 1) ? imageHeight - top : tileHeight;
        return new TileRectangle(left, top, width, height);
    }

    /** Row-major list of every coordinate. */
    public List<TileCoordinate> coordinates() {
        List<TileCoordinate> out = new ArrayList<>(tileCount());
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                out.add(new TileCoordinate(x, y));
            }
        }
        return Collections.unmodifiableList(out);
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }

    @Override
    public String toString() {
        return columns + "x" + rows + " tiles of " + tileWidth + "x" + tileHeight + " over " + imageWidth + "x" + imageHeight;
    }
}
