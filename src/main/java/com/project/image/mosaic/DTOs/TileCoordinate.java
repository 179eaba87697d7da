package com.project.image.mosaic.DTOs;

public record TileCoordinate(int x, int y) {
    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
