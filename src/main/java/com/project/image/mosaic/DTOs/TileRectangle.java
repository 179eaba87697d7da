package com.project.image.mosaic.DTOs;

/** Pixel bounds of one tile in the master image. */
public record TileRectangle(int left, int top, int width, int height) {

    public int right() {
        return left + width;
    }

    public int bottom() {
        return top + height;
    }

    public long area() {
        return (long) width * height;
    }

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }
}
