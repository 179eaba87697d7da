package com.project.image.mosaic.DTOs;

/**
 * What a matcher picked for one target color.
 *
 * @param seed            image to draw, null for a flat fill
 * @param distance        strategy-specific distance of the match
 * @param overlayColor    color wash blended over the tile, alpha included
 * @param withinTolerance false when the strategy had to fall back past its tolerance
 */
public record MatchResult(SeedImageRecord seed, double distance, ColorMetrics overlayColor, boolean withinTolerance) {
}
