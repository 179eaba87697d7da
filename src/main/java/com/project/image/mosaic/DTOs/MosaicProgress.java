package com.project.image.mosaic.DTOs;

public record MosaicProgress(MosaicStatus status, int current, int maximum, String message) {

    public static MosaicProgress status(MosaicStatus status, String message) {
        return new MosaicProgress(status, 0, 0, message);
    }

    public double percent() {
        return maximum <= 0 ? 0.0 : 100.0 * current / maximum;
    }
}
