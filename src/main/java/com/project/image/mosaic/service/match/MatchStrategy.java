package com.project.image.mosaic.service.match;

import com.project.image.mosaic.DTOs.ColorMetrics;
import com.project.image.mosaic.DTOs.MatchResult;
import com.project.image.mosaic.DTOs.MatchStrategyType;
import com.project.image.mosaic.DTOs.SeedCatalog;

/**
 * Picks the seed image to place over a tile of the given target color. Implementations
 * are stateless; anything that must survive across tiles of one run lives in the
 * {@link MatchState}. {@code select} is called concurrently from the tile workers.
 */
public interface MatchStrategy {

    MatchStrategyType type();

    /** False for strategies that never draw a photo. */
    default boolean requiresCatalog() {
        return true;
    }

    MatchResult select(ColorMetrics target, SeedCatalog catalog, MatchState state);
}
