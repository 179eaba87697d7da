package com.project.image.mosaic.DTOs;

public enum MatchStrategyType {
    /** Nearest average color by RGB distance, or a flat color fill. */
    COLOR,
    /** Random photo washed with the target color, scored by hue. */
    HUE,
    /** Nearest photo with repetition avoidance. */
    PHOTO
}
